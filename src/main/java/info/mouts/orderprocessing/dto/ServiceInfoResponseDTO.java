package info.mouts.orderprocessing.dto;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceInfoResponseDTO {
    private String service;
    private String version;
    private String status;
    private Map<String, String> endpoints;
}
