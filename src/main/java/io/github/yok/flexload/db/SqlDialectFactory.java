package io.github.yok.flexload.db;

import io.github.yok.flexload.config.LoadConfig;
import io.github.yok.flexload.db.postgresql.PostgresqlDialect;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Selects the {@link SqlDialect} for a connection from the database product name.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqlDialectFactory {

    private final LoadConfig loadConfig;

    /**
     * Creates the dialect for a connection.
     *
     * @param connection open connection
     * @return dialect
     * @throws SQLException if the database metadata cannot be read
     * @throws IllegalStateException if the database is not supported
     */
    public SqlDialect create(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        if (product != null && product.toLowerCase(Locale.ROOT).contains("postgres")) {
            log.debug("Using PostgreSQL dialect (max identifier length {})",
                    loadConfig.getMaxIdentifierLength());
            return new PostgresqlDialect(loadConfig.getMaxIdentifierLength());
        }
        throw new IllegalStateException("Unsupported database: " + product);
    }
}
