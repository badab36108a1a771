package info.mouts.orderprocessing.store;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregates computed by {@link OrderStore#stats()}.
 */
@Value
@Builder
public class OrderStats {
    long totalOrders;
    long ordersLast24Hours;
    Map<String, Long> ordersByStatus;

    /**
     * Hour buckets of the last 24 hours, oldest hour first. Hours without
     * orders are omitted.
     */
    List<HourBucket> ordersByHour;

    BigDecimal totalRevenue;

    @Value
    public static class HourBucket {
        int hourOfDay;
        long count;
    }
}
