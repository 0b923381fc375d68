package io.github.yok.flexload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code connection} section in {@code application.yml}.
 *
 * <pre>
 * connection:
 *   url: jdbc:postgresql://localhost:5432/warehouse
 *   user: loader
 *   password: secret
 *   driver-class: org.postgresql.Driver
 * </pre>
 *
 * <p>
 * {@code url} defaults to the {@code DATABASE_URL} environment variable.
 * </p>
 */
@Component
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/warehouse)
    private String url;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Fully qualified JDBC driver class name
    private String driverClass = "org.postgresql.Driver";
}
