package info.mouts.orderprocessing.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.orderprocessing.dto.OrderStatsResponseDTO;
import info.mouts.orderprocessing.service.OrderQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/api/stats")
@Tag(name = "Stats API", description = "Pipeline statistics")
public class StatsController {
    private final OrderQueryService orderQueryService;

    public StatsController(OrderQueryService orderQueryService) {
        this.orderQueryService = orderQueryService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get Stats", description = "Order counts, hourly volume, revenue and queue depth.")
    public ResponseEntity<OrderStatsResponseDTO> getStats() {
        return ResponseEntity.ok(orderQueryService.getStats());
    }
}
