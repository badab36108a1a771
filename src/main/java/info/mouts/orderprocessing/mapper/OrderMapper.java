package info.mouts.orderprocessing.mapper;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.domain.OrderLineItem;
import info.mouts.orderprocessing.domain.OrderStatus;
import info.mouts.orderprocessing.dto.OrderItemDTO;
import info.mouts.orderprocessing.dto.OrderItemRequestDTO;
import info.mouts.orderprocessing.dto.OrderMessageDTO;
import info.mouts.orderprocessing.dto.OrderRequestDTO;
import info.mouts.orderprocessing.dto.OrderResponseDTO;

/**
 * Mapper interface for converting between order DTOs and the {@link Order}
 * entity using MapStruct.
 */
@Mapper(componentModel = "spring")
public interface OrderMapper {

    OrderItemDTO toItemDto(OrderItemRequestDTO dto);

    List<OrderItemDTO> toItemDtoList(List<OrderItemRequestDTO> dtoList);

    OrderLineItem toLineItem(OrderItemDTO dto);

    OrderItemDTO fromLineItem(OrderLineItem item);

    /**
     * Builds the queue message for an accepted order request.
     *
     * @param request     The validated request.
     * @param orderId     Identifier assigned to the order.
     * @param totalAmount Computed order total.
     * @param status      Initial status.
     * @param createdAt   Acceptance time.
     * @return The message to enqueue.
     */
    @Mapping(target = "orderId", source = "orderId")
    @Mapping(target = "customerId", source = "request.customerId")
    @Mapping(target = "items", source = "request.items")
    @Mapping(target = "totalAmount", source = "totalAmount")
    @Mapping(target = "status", source = "status")
    @Mapping(target = "createdAt", source = "createdAt")
    OrderMessageDTO toMessage(OrderRequestDTO request, String orderId, BigDecimal totalAmount, OrderStatus status,
            Instant createdAt);

    /**
     * Maps a queue message to a new, not yet persisted {@link Order}.
     *
     * @param message The parsed queue message.
     * @return The mapped {@link Order} entity.
     */
    @Mapping(target = "newEntity", ignore = true)
    Order toEntity(OrderMessageDTO message);

    /**
     * Maps an {@link Order} entity to an {@link OrderResponseDTO}. Both
     * {@code id} and {@code orderId} carry the order identifier.
     *
     * @param entity The source {@link Order} entity.
     * @return The mapped {@link OrderResponseDTO}.
     */
    @Mapping(source = "orderId", target = "id")
    @Mapping(source = "orderId", target = "orderId")
    @Mapping(source = "createdAt", target = "updatedAt")
    OrderResponseDTO toOrderResponseDto(Order entity);

    List<OrderResponseDTO> toOrderResponseDtoList(List<Order> entityList);
}
