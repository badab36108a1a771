package info.mouts.orderprocessing.dto;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A page of stored orders, newest first")
public class OrderPageResponseDTO {
    private List<OrderResponseDTO> orders;

    @Schema(description = "Total number of stored orders")
    private long total;

    private int page;
    private int limit;
}
