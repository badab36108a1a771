package info.mouts.orderprocessing.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Acknowledgement returned once an order has been queued")
public class OrderAcceptedResponseDTO {
    @Schema(example = "Order accepted for processing")
    private String message;

    private String orderId;

    @Schema(description = "Always \"queued\": the order is not stored yet", example = "queued")
    private String status;

    private BigDecimal totalAmount;
}
