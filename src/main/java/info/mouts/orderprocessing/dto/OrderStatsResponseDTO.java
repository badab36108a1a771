package info.mouts.orderprocessing.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated pipeline statistics returned by {@code GET /api/stats}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Pipeline statistics")
public class OrderStatsResponseDTO {
    @Schema(description = "Orders created in the last 24 hours")
    private long ordersToday;

    @Schema(description = "Average orders per hour over the last 24 hours, one decimal place")
    private double processingRate;

    @Schema(description = "Visible plus in-flight messages, 0 when the queue cannot be reached")
    private long queueDepth;

    private long totalOrders;

    @Schema(description = "Orders of the last 24 hours grouped by hour of day")
    private List<HourlyOrderCountDTO> ordersByHour;

    private Map<String, Long> ordersByStatus;

    private BigDecimal totalRevenue;
}
