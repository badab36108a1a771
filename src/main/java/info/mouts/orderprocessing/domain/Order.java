package info.mouts.orderprocessing.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Represents a persisted order.
 * <p>
 * The identifier is assigned by the ingestion endpoint, so the entity
 * implements {@link Persistable} to force an {@code INSERT} on first save. A
 * second insert of the same {@code orderId} fails on the primary key instead
 * of silently merging over the stored row.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "items")
@EqualsAndHashCode(of = "orderId")
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_created_at", columnList = "created_at DESC"),
        @Index(name = "idx_orders_customer_id", columnList = "customer_id")
})
public class Order implements Persistable<String> {
    @Id
    @Column(name = "order_id", nullable = false, updatable = false)
    private String orderId;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "items", nullable = false)
    @Builder.Default
    private List<OrderLineItem> items = new ArrayList<>();

    @Column(name = "status", nullable = false, length = 50)
    private OrderStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    @Builder.Default
    private boolean newEntity = true;

    @Override
    public String getId() {
        return orderId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    /**
     * Orders are never edited after insert apart from their status, so the
     * last update time is reported as the creation time.
     *
     * @return The creation instant.
     */
    public Instant getUpdatedAt() {
        return createdAt;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
