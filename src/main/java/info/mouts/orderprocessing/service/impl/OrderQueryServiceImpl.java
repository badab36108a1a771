package info.mouts.orderprocessing.service.impl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.dto.HourlyOrderCountDTO;
import info.mouts.orderprocessing.dto.OrderStatsResponseDTO;
import info.mouts.orderprocessing.exception.InvalidPaginationException;
import info.mouts.orderprocessing.exception.OrderNotFoundException;
import info.mouts.orderprocessing.queue.OrderQueue;
import info.mouts.orderprocessing.queue.QueueUnavailableException;
import info.mouts.orderprocessing.service.OrderQueryService;
import info.mouts.orderprocessing.store.OrderStats;
import info.mouts.orderprocessing.store.OrderStore;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderQueryService} interface.
 * Serves the read side of the API from the {@link OrderStore}.
 */
@Service
@Slf4j
public class OrderQueryServiceImpl implements OrderQueryService {
    public static final int MAX_PAGE_SIZE = 100;

    private static final BigDecimal HOURS_PER_DAY = BigDecimal.valueOf(24);

    private final OrderStore orderStore;
    private final OrderQueue orderQueue;

    /**
     * Constructs an instance of {@code OrderQueryServiceImpl}.
     *
     * @param orderStore The store orders are read from.
     * @param orderQueue The queue whose depth is reported in the stats.
     */
    public OrderQueryServiceImpl(OrderStore orderStore, OrderQueue orderQueue) {
        this.orderStore = orderStore;
        this.orderQueue = orderQueue;
    }

    @Override
    public Order findByOrderId(String orderId) {
        return orderStore.findByOrderId(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found for ID: {}", orderId);
                    return new OrderNotFoundException(orderId);
                });
    }

    @Override
    public Page<Order> findPage(int page, int limit) {
        if (page < 1) {
            throw new InvalidPaginationException("page must be a positive integer");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidPaginationException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }

        log.debug("Listing orders page {} with limit {}", page, limit);
        return orderStore.list(page, limit);
    }

    @Override
    public OrderStatsResponseDTO getStats() {
        OrderStats stats = orderStore.stats();

        List<HourlyOrderCountDTO> byHour = stats.getOrdersByHour().stream()
                .map(bucket -> new HourlyOrderCountDTO(String.format("%02d:00", bucket.getHourOfDay()),
                        bucket.getCount()))
                .collect(Collectors.toList());

        double processingRate = BigDecimal.valueOf(stats.getOrdersLast24Hours())
                .divide(HOURS_PER_DAY, 1, RoundingMode.HALF_UP)
                .doubleValue();

        return OrderStatsResponseDTO.builder()
                .ordersToday(stats.getOrdersLast24Hours())
                .processingRate(processingRate)
                .queueDepth(queueDepth())
                .totalOrders(stats.getTotalOrders())
                .ordersByHour(byHour)
                .ordersByStatus(stats.getOrdersByStatus())
                .totalRevenue(stats.getTotalRevenue())
                .build();
    }

    private long queueDepth() {
        try {
            return orderQueue.depth().total();
        } catch (QueueUnavailableException e) {
            log.error("Failed to read queue depth, reporting 0: {}", e.getMessage(), e);
            return 0;
        }
    }
}
