package info.mouts.orderprocessing.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.Page;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.domain.OrderLineItem;
import info.mouts.orderprocessing.domain.OrderStatus;
import info.mouts.orderprocessing.repository.OrderRepository;

@DataJpaTest(properties = "spring.datasource.url=jdbc:h2:mem:store-test;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
public class JpaOrderStoreTest {
    private static final Instant NOW = Instant.parse("2025-04-01T12:30:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private DataSource dataSource;

    private JpaOrderStore orderStore;

    @BeforeEach
    void setUp() {
        orderStore = new JpaOrderStore(orderRepository, dataSource, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Order createOrder(String orderId, Instant createdAt, String total) {
        return Order.builder()
                .orderId(orderId)
                .customerId("CUST-1")
                .totalAmount(new BigDecimal(total))
                .items(List.of(new OrderLineItem("PROD-001", 1, new BigDecimal(total))))
                .status(OrderStatus.PENDING)
                .createdAt(createdAt)
                .build();
    }

    @Nested
    @DisplayName("insert")
    class InsertTests {

        @Test
        @DisplayName("Should store a new order with its items")
        void insert_newOrder_isStored() {
            boolean inserted = orderStore.insert(createOrder("order-1", NOW, "29.99"));
            entityManager.clear();

            assertThat(inserted).isTrue();

            Optional<Order> found = orderStore.findByOrderId("order-1");
            assertThat(found).isPresent();
            assertThat(found.get().getCustomerId()).isEqualTo("CUST-1");
            assertThat(found.get().getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(found.get().getTotalAmount()).isEqualByComparingTo("29.99");
            assertThat(found.get().getItems()).hasSize(1);
            assertThat(found.get().getItems().get(0).getProductId()).isEqualTo("PROD-001");
            assertThat(found.get().getCreatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should leave the stored row untouched when the order is inserted again")
        void insert_duplicate_isNoOp() {
            orderStore.insert(createOrder("order-1", NOW, "29.99"));
            entityManager.clear();

            Order duplicate = createOrder("order-1", NOW, "99.99");
            duplicate.setCustomerId("CUST-2");

            assertThat(orderStore.insert(duplicate)).isFalse();
            entityManager.clear();

            assertThat(orderStore.count()).isEqualTo(1);
            Order stored = orderStore.findByOrderId("order-1").orElseThrow();
            assertThat(stored.getCustomerId()).isEqualTo("CUST-1");
            assertThat(stored.getTotalAmount()).isEqualByComparingTo("29.99");
        }
    }

    @Nested
    @DisplayName("updateStatus")
    class UpdateStatusTests {

        @Test
        @DisplayName("Should update the status of a stored order")
        void updateStatus_existing() {
            orderStore.insert(createOrder("order-1", NOW, "10.00"));

            assertThat(orderStore.updateStatus("order-1", OrderStatus.COMPLETED)).isTrue();
            assertThat(orderStore.findByOrderId("order-1")).get()
                    .extracting(Order::getStatus).isEqualTo(OrderStatus.COMPLETED);
        }

        @Test
        @DisplayName("Should report false for an unknown order")
        void updateStatus_unknown() {
            assertThat(orderStore.updateStatus("missing", OrderStatus.COMPLETED)).isFalse();
        }
    }

    @Test
    @DisplayName("Should page orders newest first with the overall total")
    void list_pagesNewestFirst() {
        for (int i = 0; i < 45; i++) {
            orderStore.insert(createOrder("order-" + i, NOW.minus(Duration.ofMinutes(i)), "1.00"));
        }
        entityManager.clear();

        Page<Order> firstPage = orderStore.list(1, 20);
        Page<Order> lastPage = orderStore.list(3, 20);

        assertThat(firstPage.getContent()).hasSize(20);
        assertThat(firstPage.getTotalElements()).isEqualTo(45);
        assertThat(firstPage.getContent().get(0).getOrderId()).isEqualTo("order-0");
        assertThat(firstPage.getContent().get(19).getOrderId()).isEqualTo("order-19");
        assertThat(lastPage.getContent()).hasSize(5);
        assertThat(lastPage.getContent().get(4).getOrderId()).isEqualTo("order-44");
    }

    @Test
    @DisplayName("Should compute counts, hour buckets and revenue")
    void stats_aggregatesOrders() {
        orderStore.insert(createOrder("recent-1", NOW.minus(Duration.ofMinutes(10)), "10.00"));
        orderStore.insert(createOrder("recent-2", NOW.minus(Duration.ofMinutes(20)), "5.50"));
        orderStore.insert(createOrder("earlier", NOW.minus(Duration.ofHours(3)), "4.50"));
        orderStore.insert(createOrder("old", NOW.minus(Duration.ofDays(2)), "100.00"));
        orderStore.updateStatus("old", OrderStatus.COMPLETED);
        entityManager.clear();

        OrderStats stats = orderStore.stats();

        assertThat(stats.getTotalOrders()).isEqualTo(4);
        assertThat(stats.getOrdersLast24Hours()).isEqualTo(3);
        assertThat(stats.getOrdersByStatus()).containsEntry("pending", 3L).containsEntry("completed", 1L);
        assertThat(stats.getTotalRevenue()).isEqualByComparingTo("120.00");
        assertThat(stats.getOrdersByHour())
                .extracting(OrderStats.HourBucket::getHourOfDay, OrderStats.HourBucket::getCount)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple(9, 1L),
                        org.assertj.core.groups.Tuple.tuple(12, 2L));
    }

    @Test
    @DisplayName("Should report zero revenue and zero counts for an empty store")
    void stats_emptyStore() {
        OrderStats stats = orderStore.stats();

        assertThat(stats.getTotalOrders()).isZero();
        assertThat(stats.getOrdersByHour()).isEmpty();
        assertThat(stats.getOrdersByStatus()).containsEntry("pending", 0L).containsEntry("completed", 0L);
        assertThat(stats.getTotalRevenue()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Should report the database as available")
    void isAvailable() {
        assertThat(orderStore.isAvailable()).isTrue();
    }
}
