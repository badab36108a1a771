package info.mouts.orderprocessing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HourlyOrderCountDTO {
    /**
     * Hour of day in {@code HH:00} form.
     */
    private String hour;
    private long count;
}
