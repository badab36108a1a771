package info.mouts.orderprocessing.store;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import javax.sql.DataSource;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.domain.OrderStatus;
import info.mouts.orderprocessing.repository.OrderRepository;
import info.mouts.orderprocessing.util.OrderUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link OrderStore} backed by Spring Data JPA.
 */
@Component
@Slf4j
public class JpaOrderStore implements OrderStore {
    private static final Duration STATS_WINDOW = Duration.ofHours(24);
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;
    private static final int MAX_PAGE_SIZE = 100;

    private final OrderRepository orderRepository;
    private final DataSource dataSource;
    private final Clock clock;

    /**
     * Constructs an instance of {@code JpaOrderStore}.
     *
     * @param orderRepository Repository for {@link Order} entities.
     * @param dataSource      Data source used for availability checks.
     * @param clock           Clock defining the start of the stats window.
     */
    public JpaOrderStore(OrderRepository orderRepository, DataSource dataSource, Clock clock) {
        this.orderRepository = orderRepository;
        this.dataSource = dataSource;
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The existence check avoids a failed insert in the common redelivery case.
     * Two concurrent inserts of the same order can both pass it; the loser hits
     * the primary key constraint and is reported as a duplicate once the row
     * is confirmed to exist.
     * </p>
     */
    @Override
    public boolean insert(Order order) {
        String orderId = order.getOrderId();

        if (orderRepository.existsById(orderId)) {
            log.warn("Order {} already stored, skipping insert", orderId);
            return false;
        }

        try {
            orderRepository.saveAndFlush(order);
            log.info("Inserted order {} for customer {}", orderId, order.getCustomerId());
            return true;
        } catch (DataIntegrityViolationException e) {
            if (orderRepository.existsById(orderId)) {
                log.warn("Order {} was inserted concurrently, treating as duplicate", orderId);
                return false;
            }
            throw e;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findByOrderId(String orderId) {
        return orderRepository.findById(orderId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Order> list(int page, int pageSize) {
        int safePage = Math.max(page, 1);
        int safePageSize = Math.min(Math.max(pageSize, 1), MAX_PAGE_SIZE);

        PageRequest pageRequest = PageRequest.of(safePage - 1, safePageSize,
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return orderRepository.findAll(pageRequest);
    }

    @Override
    @Transactional
    public boolean updateStatus(String orderId, OrderStatus status) {
        int updated = orderRepository.updateStatus(orderId, status);

        if (updated == 0) {
            log.warn("Status update to {} ignored, order {} not found", status, orderId);
            return false;
        }

        log.debug("Order {} status set to {}", orderId, status);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public OrderStats stats() {
        Instant since = clock.instant().minus(STATS_WINDOW);
        int currentHour = clock.instant().atZone(clock.getZone()).getHour();

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (OrderStatus status : OrderStatus.values()) {
            byStatus.put(status.getValue(), 0L);
        }
        orderRepository.countGroupedByStatus()
                .forEach(row -> byStatus.put(row.getStatus().getValue(), row.getOrderCount()));

        // Hours after the current one belong to yesterday, so they sort first.
        List<OrderStats.HourBucket> byHour = orderRepository.countGroupedByHourSince(since).stream()
                .map(row -> new OrderStats.HourBucket(row.getHourOfDay(), row.getOrderCount()))
                .sorted(Comparator.comparingInt(bucket -> Math.floorMod(bucket.getHourOfDay() - currentHour - 1, 24)))
                .collect(Collectors.toList());

        BigDecimal revenue = orderRepository.sumTotalAmount();

        return OrderStats.builder()
                .totalOrders(orderRepository.count())
                .ordersLast24Hours(orderRepository.countByCreatedAtGreaterThanEqual(since))
                .ordersByStatus(byStatus)
                .ordersByHour(byHour)
                .totalRevenue(revenue == null ? BigDecimal.ZERO.setScale(OrderUtils.AMOUNT_SCALE)
                        : revenue.setScale(OrderUtils.AMOUNT_SCALE, OrderUtils.AMOUNT_ROUNDING))
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return orderRepository.count();
    }

    @Override
    public boolean isAvailable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.error("Database availability check failed: {}", e.getMessage(), e);
            return false;
        }
    }
}
