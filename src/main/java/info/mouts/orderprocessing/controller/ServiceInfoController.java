package info.mouts.orderprocessing.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.orderprocessing.dto.ServiceInfoResponseDTO;
import io.swagger.v3.oas.annotations.Hidden;

/**
 * Describes the service and lists its endpoints.
 */
@RestController
@Hidden
public class ServiceInfoController {
    private final String serviceName;
    private final String serviceVersion;

    public ServiceInfoController(@Value("${spring.application.name:order-processing-service}") String serviceName,
            @Value("${app.version:1.0.0}") String serviceVersion) {
        this.serviceName = serviceName;
        this.serviceVersion = serviceVersion;
    }

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public ServiceInfoResponseDTO serviceInfo() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/health");
        endpoints.put("dependencyHealth", "/api/health");
        endpoints.put("orders", "/api/orders");
        endpoints.put("stats", "/api/stats");

        return ServiceInfoResponseDTO.builder()
                .service(serviceName)
                .version(serviceVersion)
                .status("running")
                .endpoints(endpoints)
                .build();
    }
}
