package info.mouts.orderprocessing.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import info.mouts.orderprocessing.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object representing a stored order.
 * {@code id} and {@code order_id} carry the same value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "A stored order")
public class OrderResponseDTO {
    private String id;
    private String orderId;
    private String customerId;
    private BigDecimal totalAmount;
    private List<OrderItemDTO> items;
    private OrderStatus status;
    private Instant createdAt;
    private Instant updatedAt;
}
