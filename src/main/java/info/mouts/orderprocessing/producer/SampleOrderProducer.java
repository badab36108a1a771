package info.mouts.orderprocessing.producer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import info.mouts.orderprocessing.config.AppProperties;
import info.mouts.orderprocessing.dto.OrderItemRequestDTO;
import info.mouts.orderprocessing.dto.OrderMessageDTO;
import info.mouts.orderprocessing.dto.OrderRequestDTO;
import info.mouts.orderprocessing.service.OrderIngestionService;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates random sample orders on a schedule and submits them through the
 * {@link OrderIngestionService}, for demos and load checks. Enabled with
 * {@code app.producer.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "app.producer.enabled", havingValue = "true")
@Slf4j
public class SampleOrderProducer {
    static final List<OrderItemRequestDTO> CATALOG = List.of(
            new OrderItemRequestDTO("PROD-001", null, new BigDecimal("1299.99")),
            new OrderItemRequestDTO("PROD-002", null, new BigDecimal("29.99")),
            new OrderItemRequestDTO("PROD-003", null, new BigDecimal("89.99")),
            new OrderItemRequestDTO("PROD-004", null, new BigDecimal("399.99")),
            new OrderItemRequestDTO("PROD-005", null, new BigDecimal("149.99")));

    private static final int MAX_ITEMS = 3;
    private static final int MAX_QUANTITY = 5;

    private final OrderIngestionService orderIngestionService;
    private final AppProperties.Producer settings;

    public SampleOrderProducer(OrderIngestionService orderIngestionService, AppProperties properties) {
        this.orderIngestionService = orderIngestionService;
        this.settings = properties.getProducer();
    }

    /**
     * Submits a random batch of orders. A failed submission is logged and the
     * rest of the batch continues.
     *
     * @return The number of orders queued.
     */
    @Scheduled(fixedDelayString = "${app.producer.interval:PT5M}", initialDelayString = "${app.producer.initial-delay:PT30S}")
    public int produceBatch() {
        Random random = ThreadLocalRandom.current();
        int batchSize = settings.getMinOrders() + random.nextInt(settings.getMaxOrders() - settings.getMinOrders() + 1);
        int queued = 0;

        for (int i = 0; i < batchSize; i++) {
            OrderRequestDTO request = randomOrder(random);
            try {
                OrderMessageDTO message = orderIngestionService.submitOrder(request);
                log.info("Sample order {} queued for {}", message.getOrderId(), request.getCustomerId());
                queued++;
            } catch (RuntimeException e) {
                log.error("Failed to queue sample order for {}: {}", request.getCustomerId(), e.getMessage(), e);
            }
        }

        log.info("Queued {} of {} sample orders", queued, batchSize);
        return queued;
    }

    static OrderRequestDTO randomOrder(Random random) {
        List<OrderItemRequestDTO> items = new ArrayList<>();
        int itemCount = 1 + random.nextInt(MAX_ITEMS);

        for (int i = 0; i < itemCount; i++) {
            OrderItemRequestDTO product = CATALOG.get(random.nextInt(CATALOG.size()));
            items.add(OrderItemRequestDTO.builder()
                    .productId(product.getProductId())
                    .quantity(1 + random.nextInt(MAX_QUANTITY))
                    .price(product.getPrice())
                    .build());
        }

        return OrderRequestDTO.builder()
                .customerId(String.format("CUST-%04d", 1000 + random.nextInt(9000)))
                .items(items)
                .build();
    }
}
