package info.mouts.orderprocessing.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an order.
 * Serialized in lowercase both on the wire and in the {@code orders.status}
 * column.
 */
public enum OrderStatus {
    /**
     * Order accepted by the ingestion endpoint and waiting in the queue.
     */
    PENDING("pending"),

    /**
     * Order persisted by the queue worker.
     */
    COMPLETED("completed");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a status from its wire value, ignoring case.
     *
     * @param value The wire value, e.g. {@code "pending"}.
     * @return The matching {@link OrderStatus}.
     * @throws IllegalArgumentException If no status matches.
     */
    @JsonCreator
    public static OrderStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
