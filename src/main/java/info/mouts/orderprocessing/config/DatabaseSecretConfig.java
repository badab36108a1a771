package info.mouts.orderprocessing.config;

import javax.sql.DataSource;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Builds the application {@link DataSource} from credentials held in AWS
 * Secrets Manager when {@code app.database.secret-id} is set. Failing to read
 * the secret fails startup.
 */
@Configuration
@ConditionalOnProperty(name = "app.database.secret-id")
@Slf4j
public class DatabaseSecretConfig {

    @Bean(destroyMethod = "close")
    public SecretsManagerClient secretsManagerClient(AppProperties properties) {
        SecretsManagerClientBuilder builder = SecretsManagerClient.builder();
        String region = properties.getDatabase().getSecretRegion();

        if (region != null && !region.isBlank()) {
            builder.region(Region.of(region));
        }

        return builder.build();
    }

    @Bean
    public DatabaseCredentials databaseCredentials(SecretsManagerClient secretsManagerClient,
            AppProperties properties, ObjectMapper objectMapper) {
        String secretId = properties.getDatabase().getSecretId();
        log.info("Loading database credentials from secret {}", secretId);

        String secret = secretsManagerClient.getSecretValue(GetSecretValueRequest.builder()
                .secretId(secretId)
                .build())
                .secretString();

        try {
            return objectMapper.readValue(secret, DatabaseCredentials.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Secret " + secretId + " does not hold valid database credentials", e);
        }
    }

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource dataSource(DataSourceProperties dataSourceProperties, DatabaseCredentials credentials) {
        log.info("Connecting to database {} on {}:{}", credentials.getDbname(), credentials.getHost(),
                credentials.getPort());

        dataSourceProperties.setUrl(credentials.toJdbcUrl());
        dataSourceProperties.setUsername(credentials.getUsername());
        dataSourceProperties.setPassword(credentials.getPassword());

        return dataSourceProperties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }
}
