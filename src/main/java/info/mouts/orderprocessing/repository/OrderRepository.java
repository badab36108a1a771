package info.mouts.orderprocessing.repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.domain.OrderStatus;

/**
 * Spring Data JPA repository for {@link Order} entities.
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * Number of orders grouped by status.
     */
    interface StatusCount {
        OrderStatus getStatus();

        Long getOrderCount();
    }

    /**
     * Number of orders grouped by hour of day.
     */
    interface HourCount {
        Integer getHourOfDay();

        Long getOrderCount();
    }

    /**
     * Sets the status of an order without loading it.
     *
     * @param orderId The order identifier.
     * @param status  The new status.
     * @return The number of rows updated, 0 when the order does not exist.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Order o set o.status = :status where o.orderId = :orderId")
    int updateStatus(@Param("orderId") String orderId, @Param("status") OrderStatus status);

    long countByCreatedAtGreaterThanEqual(Instant since);

    @Query("select o.status as status, count(o) as orderCount from Order o group by o.status")
    List<StatusCount> countGroupedByStatus();

    @Query("select extract(hour from o.createdAt) as hourOfDay, count(o) as orderCount from Order o "
            + "where o.createdAt >= :since group by extract(hour from o.createdAt)")
    List<HourCount> countGroupedByHourSince(@Param("since") Instant since);

    @Query("select sum(o.totalAmount) from Order o")
    BigDecimal sumTotalAmount();
}
