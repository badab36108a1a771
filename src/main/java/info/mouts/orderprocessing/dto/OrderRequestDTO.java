package info.mouts.orderprocessing.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import info.mouts.orderprocessing.util.OrderUtils;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.GroupSequence;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object for an order submitted to {@code POST /api/orders}.
 * <p>
 * Constraints are checked in a fixed order (customer, then the item list,
 * then each item) so the reported error is always the first rule broken.
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@GroupSequence({ OrderRequestDTO.CustomerChecks.class, OrderRequestDTO.ItemsChecks.class,
        OrderRequestDTO.ItemChecks.class, OrderRequestDTO.TotalChecks.class, OrderRequestDTO.class })
@Schema(description = "Order submission payload")
public class OrderRequestDTO {
    public interface CustomerChecks {
    }

    public interface ItemsChecks {
    }

    public interface ItemChecks {
    }

    public interface TotalChecks {
    }

    @NotBlank(message = "customer_id is required", groups = CustomerChecks.class)
    @Schema(description = "Customer identifier", example = "CUST-1234")
    private String customerId;

    @NotEmpty(message = "items must be a non-empty array", groups = ItemsChecks.class)
    @Schema(description = "Ordered products")
    private List<@NotNull(message = "Each item must be an object", groups = ItemChecks.class) @Valid OrderItemRequestDTO> items;

    /**
     * Checked last, once every item is known to have a quantity and a price.
     */
    @JsonIgnore
    @Schema(hidden = true)
    @AssertTrue(message = "total_amount must not exceed 99999999.99", groups = TotalChecks.class)
    public boolean isTotalStorable() {
        if (items == null) {
            return true;
        }

        BigDecimal total = items.stream()
                .filter(Objects::nonNull)
                .filter(item -> item.getPrice() != null && item.getQuantity() != null)
                .map(item -> item.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(OrderUtils.AMOUNT_SCALE, OrderUtils.AMOUNT_ROUNDING);

        return OrderUtils.isStorableTotal(total);
    }
}
