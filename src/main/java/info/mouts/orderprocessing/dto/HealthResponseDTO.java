package info.mouts.orderprocessing.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Health report. The dependency fields are only present on
 * {@code GET /api/health}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponseDTO {
    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String CONNECTED = "connected";
    public static final String DISCONNECTED = "disconnected";

    private String status;
    private Instant timestamp;
    private DependencyStatus database;
    private DependencyStatus queue;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DependencyStatus {
        private String status;

        public static DependencyStatus of(boolean available) {
            return new DependencyStatus(available ? CONNECTED : DISCONNECTED);
        }
    }
}
