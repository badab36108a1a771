package info.mouts.orderprocessing.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import info.mouts.orderprocessing.dto.OrderItemDTO;

/**
 * Constants and helpers shared by the ingestion and processing sides of the
 * pipeline.
 */
public final class OrderUtils {
    public static final String ORDER_ID_ATTRIBUTE = "order_id";
    public static final String CUSTOMER_ID_ATTRIBUTE = "customer_id";

    public static final String ACCEPTED_MESSAGE = "Order accepted for processing";
    public static final String ACCEPTED_STATUS = "queued";

    public static final int AMOUNT_SCALE = 2;
    public static final RoundingMode AMOUNT_ROUNDING = RoundingMode.HALF_UP;

    /**
     * Largest total the {@code NUMERIC(10, 2)} column holds.
     */
    public static final BigDecimal MAX_TOTAL_AMOUNT = new BigDecimal("99999999.99");

    private OrderUtils() {
    }

    /**
     * Sums {@code price * quantity} over all items and rounds the result to two
     * decimal places, half up.
     *
     * @param items The order items. Null items and items with a missing price
     *              or quantity contribute nothing.
     * @return The order total.
     */
    public static BigDecimal calculateTotal(List<OrderItemDTO> items) {
        if (items == null) {
            return BigDecimal.ZERO.setScale(AMOUNT_SCALE);
        }

        return items.stream()
                .filter(item -> item != null && item.getPrice() != null && item.getQuantity() != null)
                .map(item -> item.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(AMOUNT_SCALE, AMOUNT_ROUNDING);
    }

    /**
     * @return {@code true} if the amount can be stored as an order total.
     */
    public static boolean isStorableTotal(BigDecimal amount) {
        return amount != null && amount.compareTo(MAX_TOTAL_AMOUNT) <= 0;
    }
}
