package info.mouts.orderprocessing.store;

import java.util.Optional;

import org.springframework.data.domain.Page;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.domain.OrderStatus;

/**
 * Durable storage for orders.
 */
public interface OrderStore {
    /**
     * Inserts an order if no order with the same {@code orderId} exists.
     * Inserting an existing identifier leaves the stored row untouched.
     *
     * @param order The order to insert.
     * @return {@code true} if a row was written, {@code false} if the order was
     *         already stored.
     */
    boolean insert(Order order);

    Optional<Order> findByOrderId(String orderId);

    /**
     * Lists orders newest first.
     *
     * @param page     1-based page number.
     * @param pageSize Number of orders per page.
     * @return The requested page, with the total number of stored orders.
     */
    Page<Order> list(int page, int pageSize);

    /**
     * @return {@code true} if the order existed and was updated.
     */
    boolean updateStatus(String orderId, OrderStatus status);

    OrderStats stats();

    long count();

    /**
     * Runs a trivial round trip against the database.
     *
     * @return {@code false} if the database cannot be reached.
     */
    boolean isAvailable();
}
