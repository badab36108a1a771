package info.mouts.orderprocessing.domain;

import java.math.BigDecimal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single line of an order. Stored inside the JSON {@code items} column of
 * {@link Order}, so it is a value object rather than an entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderLineItem {
    private String productId;
    private Integer quantity;
    private BigDecimal price;
}
