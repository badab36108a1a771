package info.mouts.orderprocessing.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.anyInt;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.dto.OrderStatsResponseDTO;
import info.mouts.orderprocessing.exception.InvalidPaginationException;
import info.mouts.orderprocessing.exception.OrderNotFoundException;
import info.mouts.orderprocessing.queue.OrderQueue;
import info.mouts.orderprocessing.queue.QueueDepth;
import info.mouts.orderprocessing.queue.QueueUnavailableException;
import info.mouts.orderprocessing.store.OrderStats;
import info.mouts.orderprocessing.store.OrderStore;

@MockitoSettings(strictness = Strictness.LENIENT)
@ExtendWith(MockitoExtension.class)
public class OrderQueryServiceImplTest {
    @Mock
    private OrderStore orderStore;

    @Mock
    private OrderQueue orderQueue;

    private OrderQueryServiceImpl queryService;

    @BeforeEach
    void setUp() {
        queryService = new OrderQueryServiceImpl(orderStore, orderQueue);
    }

    @Test
    @DisplayName("Should return a stored order")
    void findByOrderId_found() {
        Order order = Order.builder().orderId("order-1").build();
        when(orderStore.findByOrderId("order-1")).thenReturn(Optional.of(order));

        assertThat(queryService.findByOrderId("order-1")).isSameAs(order);
    }

    @Test
    @DisplayName("Should throw OrderNotFoundException for an unknown order")
    void findByOrderId_notFound() {
        when(orderStore.findByOrderId("missing")).thenReturn(Optional.empty());

        OrderNotFoundException ex = assertThrows(OrderNotFoundException.class,
                () -> queryService.findByOrderId("missing"));
        assertThat(ex.getMessage()).contains("missing");
    }

    @Nested
    @DisplayName("Pagination")
    class PaginationTests {

        @Test
        @DisplayName("Should delegate a valid page request to the store")
        void validPage() {
            Page<Order> page = new PageImpl<>(List.of());
            when(orderStore.list(2, 100)).thenReturn(page);

            assertThat(queryService.findPage(2, 100)).isSameAs(page);
        }

        @Test
        @DisplayName("Should reject page 0")
        void pageZero() {
            assertThrows(InvalidPaginationException.class, () -> queryService.findPage(0, 20));
            verify(orderStore, never()).list(anyInt(), anyInt());
        }

        @Test
        @DisplayName("Should reject a limit outside 1 to 100")
        void limitOutOfRange() {
            assertThrows(InvalidPaginationException.class, () -> queryService.findPage(1, 0));
            assertThrows(InvalidPaginationException.class, () -> queryService.findPage(1, 101));
        }
    }

    @Nested
    @DisplayName("Stats")
    class StatsTests {

        @BeforeEach
        void setUpStats() {
            Map<String, Long> byStatus = new LinkedHashMap<>();
            byStatus.put("pending", 2L);
            byStatus.put("completed", 38L);

            when(orderStore.stats()).thenReturn(OrderStats.builder()
                    .totalOrders(40)
                    .ordersLast24Hours(37)
                    .ordersByStatus(byStatus)
                    .ordersByHour(List.of(new OrderStats.HourBucket(23, 5), new OrderStats.HourBucket(7, 32)))
                    .totalRevenue(new BigDecimal("1234.50"))
                    .build());
        }

        @Test
        @DisplayName("Should combine store aggregates with the queue depth")
        void getStats_combinesSources() {
            when(orderQueue.depth()).thenReturn(new QueueDepth(3, 2));

            OrderStatsResponseDTO stats = queryService.getStats();

            assertThat(stats.getOrdersToday()).isEqualTo(37);
            assertThat(stats.getProcessingRate()).isEqualTo(1.5);
            assertThat(stats.getQueueDepth()).isEqualTo(5);
            assertThat(stats.getTotalOrders()).isEqualTo(40);
            assertThat(stats.getOrdersByStatus()).containsEntry("completed", 38L);
            assertThat(stats.getTotalRevenue()).isEqualByComparingTo("1234.50");
            assertThat(stats.getOrdersByHour())
                    .extracting(bucket -> bucket.getHour())
                    .containsExactly("23:00", "07:00");
        }

        @Test
        @DisplayName("Should report a queue depth of 0 when the queue cannot be reached")
        void getStats_queueDown() {
            when(orderQueue.depth()).thenThrow(new QueueUnavailableException("down", new RuntimeException()));

            assertThat(queryService.getStats().getQueueDepth()).isZero();
        }
    }
}
