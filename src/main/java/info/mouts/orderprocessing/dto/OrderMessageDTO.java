package info.mouts.orderprocessing.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import info.mouts.orderprocessing.domain.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of an order message as placed on the queue by the ingestion endpoint
 * and read back by the queue worker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderMessageDTO {
    private String orderId;
    private String customerId;
    private BigDecimal totalAmount;
    private List<OrderItemDTO> items;
    private OrderStatus status;
    private Instant createdAt;
}
