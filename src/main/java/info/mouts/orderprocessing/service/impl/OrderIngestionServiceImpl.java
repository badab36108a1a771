package info.mouts.orderprocessing.service.impl;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import info.mouts.orderprocessing.domain.OrderStatus;
import info.mouts.orderprocessing.dto.OrderMessageDTO;
import info.mouts.orderprocessing.dto.OrderRequestDTO;
import info.mouts.orderprocessing.mapper.OrderMapper;
import info.mouts.orderprocessing.queue.OrderQueue;
import info.mouts.orderprocessing.queue.QueueUnavailableException;
import info.mouts.orderprocessing.service.OrderIngestionService;
import info.mouts.orderprocessing.util.OrderUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderIngestionService} interface.
 * Computes the order total, assigns a fresh identifier and places the order
 * message on the {@link OrderQueue}.
 */
@Service
@Slf4j
public class OrderIngestionServiceImpl implements OrderIngestionService {
    private final OrderQueue orderQueue;
    private final OrderMapper orderMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Counter acceptedOrdersCounter;
    private Counter rejectedOrdersCounter;

    /**
     * Constructs an instance of {@code OrderIngestionServiceImpl}.
     *
     * @param orderQueue    The queue orders are handed to.
     * @param orderMapper   The mapper for converting between DTOs.
     * @param objectMapper  The JSON mapper for message bodies.
     * @param clock         The clock stamping accepted orders.
     * @param meterRegistry The registry for collecting metrics.
     */
    public OrderIngestionServiceImpl(OrderQueue orderQueue, OrderMapper orderMapper, ObjectMapper objectMapper,
            Clock clock, MeterRegistry meterRegistry) {
        this.orderQueue = orderQueue;
        this.orderMapper = orderMapper;
        this.objectMapper = objectMapper;
        this.clock = clock;

        initializeMetrics(meterRegistry);
    }

    @Override
    public OrderMessageDTO submitOrder(OrderRequestDTO request) {
        String orderId = UUID.randomUUID().toString();
        BigDecimal totalAmount = OrderUtils.calculateTotal(orderMapper.toItemDtoList(request.getItems()));
        Instant createdAt = clock.instant();

        OrderMessageDTO message = orderMapper.toMessage(request, orderId, totalAmount, OrderStatus.PENDING, createdAt);

        String body;
        try {
            body = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize order " + orderId, e);
        }

        try {
            String messageId = orderQueue.send(body, Map.of(
                    OrderUtils.ORDER_ID_ATTRIBUTE, orderId,
                    OrderUtils.CUSTOMER_ID_ATTRIBUTE, request.getCustomerId()));

            acceptedOrdersCounter.increment();
            log.info("Order {} for customer {} queued as message {} with total {}", orderId,
                    request.getCustomerId(), messageId, totalAmount);

            return message;
        } catch (QueueUnavailableException e) {
            rejectedOrdersCounter.increment();
            log.error("Failed to queue order {} for customer {}: {}", orderId, request.getCustomerId(),
                    e.getMessage());
            throw e;
        }
    }

    private void initializeMetrics(MeterRegistry meterRegistry) {
        this.acceptedOrdersCounter = Counter.builder("orders.ingestion.accepted")
                .description("Number of orders accepted and queued")
                .register(meterRegistry);

        this.rejectedOrdersCounter = Counter.builder("orders.ingestion.rejected")
                .description("Number of orders that could not be queued")
                .register(meterRegistry);
    }
}
