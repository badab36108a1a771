package info.mouts.orderprocessing.config;

import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;

@Configuration
@OpenAPIDefinition(info = @Info(title = "Order Processing API", version = "1.0.0",
        description = "Accepts orders for asynchronous processing and exposes stored orders and pipeline statistics"))
public class OpenApiConfig {
}
