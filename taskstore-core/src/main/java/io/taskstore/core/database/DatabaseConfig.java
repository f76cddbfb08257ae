package io.taskstore.core.database;

import java.time.Duration;
import com.google.common.base.Optional;
import org.immutables.value.Value;
import io.taskstore.client.config.Config;
import io.taskstore.client.config.ConfigException;

/**
 * Connection settings read from the {@code database.*} keys. The type is
 * either {@code h2} or {@code postgresql}; the server attributes apply to
 * PostgreSQL only.
 */
@Value.Immutable
public interface DatabaseConfig
{
    String POSTGRESQL = "postgresql";
    String H2 = "h2";

    String getType();

    /**
     * Directory of an H2 file database. Absent for an in-memory database.
     */
    Optional<String> getPath();

    Optional<String> getHost();

    Optional<Integer> getPort();

    Optional<String> getDatabase();

    Optional<String> getUser();

    Optional<String> getPassword();

    boolean getSsl();

    Optional<String> getSslMode();

    Duration getLoginTimeout();

    Duration getSocketTimeout();

    // connection pool

    Duration getConnectionTimeout();

    Duration getIdleTimeout();

    Duration getValidationTimeout();

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    @Value.Check
    default void check()
    {
        if (isPostgres(getType())) {
            if (!getHost().isPresent() || !getDatabase().isPresent() || !getUser().isPresent()) {
                throw new ConfigException("database.host, database.database and database.user are required for postgresql");
            }
        }
        else if (!H2.equals(getType())) {
            throw new ConfigException("Unsupported database type: " + getType());
        }
        if (getMaximumPoolSize() < 1 || getMinimumPoolSize() > getMaximumPoolSize()) {
            throw new ConfigException("database.minimumPoolSize must not exceed database.maximumPoolSize, which must be positive");
        }
    }

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        String type = config.get("database.type", String.class, "memory");
        switch (type) {
        case "memory":
            builder.type(H2);
            break;
        case H2:
            builder.type(H2)
                .path(config.get("database.path", String.class));
            break;
        case POSTGRESQL:
            builder.type(POSTGRESQL)
                .host(config.getOptional("database.host", String.class))
                .port(config.getOptional("database.port", Integer.class))
                .database(config.getOptional("database.database", String.class))
                .user(config.getOptional("database.user", String.class))
                .password(config.getOptional("database.password", String.class))
                .sslMode(config.getOptional("database.sslmode", String.class));
            break;
        default:
            throw new ConfigException("Unknown database.type: " + type);
        }

        // one connection is held by the notification listener while a session is open
        int maximumPoolSize = config.get("database.maximumPoolSize", int.class,
                Runtime.getRuntime().availableProcessors() * 4 + 1);

        return builder
            .ssl(config.get("database.ssl", boolean.class, false))
            .loginTimeout(seconds(config, "database.loginTimeout", 30))
            .socketTimeout(seconds(config, "database.socketTimeout", 1800))
            .connectionTimeout(seconds(config, "database.connectionTimeout", 30))
            .idleTimeout(seconds(config, "database.idleTimeout", 600))
            .validationTimeout(seconds(config, "database.validationTimeout", 5))
            .maximumPoolSize(maximumPoolSize)
            .minimumPoolSize(config.get("database.minimumPoolSize", int.class, maximumPoolSize))
            .build();
    }

    static Duration seconds(Config config, String key, int defaultSeconds)
    {
        return Duration.ofSeconds(config.get(key, int.class, defaultSeconds));
    }

    static boolean isPostgres(String databaseType)
    {
        return POSTGRESQL.equals(databaseType);
    }
}
