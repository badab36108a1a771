package info.mouts.orderprocessing.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Database connection fields stored as JSON in a Secrets Manager secret.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseCredentials {
    private String username;
    private String password;
    private String host;
    private Integer port = 5432;
    private String dbname = "orders";

    public String toJdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, dbname);
    }
}
