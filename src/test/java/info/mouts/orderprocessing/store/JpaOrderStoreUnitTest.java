package info.mouts.orderprocessing.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.domain.OrderLineItem;
import info.mouts.orderprocessing.domain.OrderStatus;
import info.mouts.orderprocessing.repository.OrderRepository;

@MockitoSettings(strictness = Strictness.LENIENT)
@ExtendWith(MockitoExtension.class)
public class JpaOrderStoreUnitTest {
    @Mock
    private OrderRepository orderRepository;

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    private JpaOrderStore orderStore;
    private Order order;

    @BeforeEach
    void setUp() {
        orderStore = new JpaOrderStore(orderRepository, dataSource, Clock.systemUTC());
        order = Order.builder()
                .orderId("order-1")
                .customerId("CUST-1")
                .totalAmount(BigDecimal.ONE)
                .items(List.of(new OrderLineItem("PROD-1", 1, BigDecimal.ONE)))
                .status(OrderStatus.PENDING)
                .createdAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("Should skip the insert when the order already exists")
    void insert_existing_skipsSave() {
        when(orderRepository.existsById("order-1")).thenReturn(true);

        assertThat(orderStore.insert(order)).isFalse();
        verify(orderRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Should treat a constraint violation from a concurrent insert as a duplicate")
    void insert_concurrentDuplicate_returnsFalse() {
        when(orderRepository.existsById("order-1")).thenReturn(false, true);
        when(orderRepository.saveAndFlush(order)).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThat(orderStore.insert(order)).isFalse();
    }

    @Test
    @DisplayName("Should rethrow a constraint violation that is not a duplicate")
    void insert_otherViolation_rethrows() {
        when(orderRepository.existsById("order-1")).thenReturn(false, false);
        when(orderRepository.saveAndFlush(order)).thenThrow(new DataIntegrityViolationException("not null"));

        assertThrows(DataIntegrityViolationException.class, () -> orderStore.insert(order));
    }

    @Test
    @DisplayName("Should clamp the page and page size before querying")
    void list_clampsBounds() {
        when(orderRepository.findAll(any(Pageable.class))).thenReturn(Page.empty());

        orderStore.list(0, 500);

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(orderRepository).findAll(captor.capture());
        assertThat(captor.getValue().getPageNumber()).isZero();
        assertThat(captor.getValue().getPageSize()).isEqualTo(100);
        assertThat(captor.getValue().getSort().getOrderFor("createdAt")).isNotNull();
    }

    @Test
    @DisplayName("Should report the database unavailable when no connection can be obtained")
    void isAvailable_connectionFails() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        assertThat(orderStore.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("Should report the database available when the connection is valid")
    void isAvailable_validConnection() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(2)).thenReturn(true);

        assertThat(orderStore.isAvailable()).isTrue();
        verify(connection).close();
    }
}
