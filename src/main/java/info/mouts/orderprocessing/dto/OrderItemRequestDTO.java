package info.mouts.orderprocessing.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object for a single item of an incoming order request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "A product line of an order request")
public class OrderItemRequestDTO {
    @NotBlank(message = "Each item must have a product_id", groups = OrderRequestDTO.ItemChecks.class)
    @Schema(description = "Product identifier", example = "PROD-001")
    private String productId;

    @NotNull(message = "Each item must have a quantity greater than 0", groups = OrderRequestDTO.ItemChecks.class)
    @Positive(message = "Each item must have a quantity greater than 0", groups = OrderRequestDTO.ItemChecks.class)
    @Schema(description = "Ordered quantity", example = "2")
    private Integer quantity;

    @NotNull(message = "Each item must have a price of at least 0", groups = OrderRequestDTO.ItemChecks.class)
    @PositiveOrZero(message = "Each item must have a price of at least 0", groups = OrderRequestDTO.ItemChecks.class)
    @Schema(description = "Unit price", example = "29.99")
    private BigDecimal price;
}
