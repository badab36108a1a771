package info.mouts.orderprocessing.service.impl;

import java.time.Clock;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.domain.OrderStatus;
import info.mouts.orderprocessing.dto.OrderMessageDTO;
import info.mouts.orderprocessing.exception.MalformedOrderMessageException;
import info.mouts.orderprocessing.mapper.OrderMapper;
import info.mouts.orderprocessing.queue.QueueMessage;
import info.mouts.orderprocessing.service.OrderProcessingService;
import info.mouts.orderprocessing.store.OrderStore;
import info.mouts.orderprocessing.util.OrderUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderProcessingService} interface.
 * <p>
 * The order is inserted with the status it was queued with and then marked
 * completed. A redelivered message finds the row already stored, skips the
 * insert and only repeats the status update.
 * </p>
 */
@Service
@Slf4j
public class OrderProcessingServiceImpl implements OrderProcessingService {
    private final OrderStore orderStore;
    private final OrderMapper orderMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Constructs an instance of {@code OrderProcessingServiceImpl}.
     *
     * @param orderStore   The store orders are written to.
     * @param orderMapper  The mapper for converting messages to entities.
     * @param objectMapper The JSON mapper for message bodies.
     * @param clock        The clock used when a message lacks a creation time.
     */
    public OrderProcessingServiceImpl(OrderStore orderStore, OrderMapper orderMapper, ObjectMapper objectMapper,
            Clock clock) {
        this.orderStore = orderStore;
        this.orderMapper = orderMapper;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Order processMessage(QueueMessage queueMessage) {
        OrderMessageDTO message = parse(queueMessage);
        log.info("Processing order {} from message {} (delivery {})", message.getOrderId(),
                queueMessage.getMessageId(), queueMessage.getReceiveCount());

        Order order = orderMapper.toEntity(message);

        if (!orderStore.insert(order)) {
            log.info("Order {} already stored, completing redelivered message", order.getOrderId());
        }

        orderStore.updateStatus(order.getOrderId(), OrderStatus.COMPLETED);
        order.setStatus(OrderStatus.COMPLETED);

        log.info("Order {} processed", order.getOrderId());
        return order;
    }

    private OrderMessageDTO parse(QueueMessage queueMessage) {
        String body = queueMessage.getBody();
        if (body == null || body.isBlank()) {
            throw new MalformedOrderMessageException("Message " + queueMessage.getMessageId() + " has an empty body");
        }

        OrderMessageDTO message;
        try {
            message = objectMapper.readValue(body, OrderMessageDTO.class);
        } catch (JsonProcessingException e) {
            throw new MalformedOrderMessageException(
                    "Message " + queueMessage.getMessageId() + " is not a valid order document", e);
        }

        if (message == null || isBlank(message.getOrderId()) || isBlank(message.getCustomerId())
                || message.getItems() == null) {
            throw new MalformedOrderMessageException(
                    "Message " + queueMessage.getMessageId() + " lacks order_id, customer_id or items");
        }

        if (message.getItems().contains(null)) {
            throw new MalformedOrderMessageException(
                    "Message " + queueMessage.getMessageId() + " has a null entry in items");
        }

        if (message.getTotalAmount() == null) {
            message.setTotalAmount(OrderUtils.calculateTotal(message.getItems()));
        }
        if (!OrderUtils.isStorableTotal(message.getTotalAmount())) {
            throw new MalformedOrderMessageException("Message " + queueMessage.getMessageId() + " has total "
                    + message.getTotalAmount() + " above " + OrderUtils.MAX_TOTAL_AMOUNT);
        }
        if (message.getStatus() == null) {
            message.setStatus(OrderStatus.PENDING);
        }
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(clock.instant());
        }

        return message;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
