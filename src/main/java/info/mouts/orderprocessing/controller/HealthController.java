package info.mouts.orderprocessing.controller;

import java.time.Clock;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.orderprocessing.dto.HealthResponseDTO;
import info.mouts.orderprocessing.queue.OrderQueue;
import info.mouts.orderprocessing.queue.QueueUnavailableException;
import info.mouts.orderprocessing.store.OrderStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * Liveness and dependency health endpoints.
 */
@RestController
@Tag(name = "Health API", description = "Liveness and dependency checks")
@Slf4j
public class HealthController {
    private final OrderStore orderStore;
    private final OrderQueue orderQueue;
    private final Clock clock;

    /**
     * Constructs an instance of {@code HealthController}.
     *
     * @param orderStore The store whose connectivity is checked.
     * @param orderQueue The queue whose connectivity is checked.
     * @param clock      The clock stamping health reports.
     */
    public HealthController(OrderStore orderStore, OrderQueue orderQueue, Clock clock) {
        this.orderStore = orderStore;
        this.orderQueue = orderQueue;
        this.clock = clock;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Liveness", description = "Always healthy while the process serves requests.")
    public ResponseEntity<HealthResponseDTO> liveness() {
        return ResponseEntity.ok(HealthResponseDTO.builder()
                .status(HealthResponseDTO.HEALTHY)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Checks the database and the queue.
     *
     * @return HTTP 200 if both are reachable, HTTP 503 otherwise.
     */
    @GetMapping(value = "/api/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Dependency Health", description = "Reports database and queue connectivity.")
    public ResponseEntity<HealthResponseDTO> dependencyHealth() {
        boolean databaseUp = orderStore.isAvailable();
        boolean queueUp = isQueueAvailable();
        boolean healthy = databaseUp && queueUp;

        HealthResponseDTO response = HealthResponseDTO.builder()
                .status(healthy ? HealthResponseDTO.HEALTHY : HealthResponseDTO.DEGRADED)
                .timestamp(clock.instant())
                .database(HealthResponseDTO.DependencyStatus.of(databaseUp))
                .queue(HealthResponseDTO.DependencyStatus.of(queueUp))
                .build();

        if (!healthy) {
            log.warn("Health check failed: database {}, queue {}", response.getDatabase().getStatus(),
                    response.getQueue().getStatus());
        }

        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    private boolean isQueueAvailable() {
        try {
            orderQueue.depth();
            return true;
        } catch (QueueUnavailableException e) {
            log.error("Queue health check failed: {}", e.getMessage());
            return false;
        }
    }
}
