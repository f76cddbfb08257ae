package io.taskstore.core.database;

import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.Properties;
import java.util.UUID;
import javax.sql.DataSource;
import com.google.common.base.Throwables;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the store's {@link DataSource} on first use. PostgreSQL goes through a
 * HikariCP pool. H2 uses a plain data source that pins one connection until
 * {@link #close()} so that an in-memory database lives as long as the provider.
 */
public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(DataSourceProvider.class);

    private final DatabaseConfig config;
    private DataSource ds;
    private AutoCloseable closer;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            String url = jdbcUrl(config);
            logger.debug("Using database URL {}", url);
            if (DatabaseConfig.isPostgres(config.getType())) {
                openPool(url);
            }
            else {
                openH2(url);
            }
        }
        return ds;
    }

    static String jdbcUrl(DatabaseConfig config)
    {
        if (DatabaseConfig.isPostgres(config.getType())) {
            String host = config.getHost().get();
            if (config.getPort().isPresent()) {
                host = host + ":" + config.getPort().get();
            }
            return "jdbc:postgresql://" + host + "/" + config.getDatabase().get();
        }
        else if (config.getPath().isPresent()) {
            // h2 requires an absolute path
            return "jdbc:h2:" + Paths.get(config.getPath().get(), "taskstore").toAbsolutePath();
        }
        else {
            return "jdbc:h2:mem:taskstore-" + UUID.randomUUID();
        }
    }

    static Properties jdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();
        props.setProperty("user", config.getUser().get());
        props.setProperty("password", config.getPassword().or(""));
        props.setProperty("loginTimeout", Long.toString(config.getLoginTimeout().getSeconds()));
        props.setProperty("socketTimeout", Long.toString(config.getSocketTimeout().getSeconds()));
        // keeps the idle LISTEN connection from being dropped by firewalls
        props.setProperty("tcpKeepAlive", "true");
        if (config.getSsl()) {
            props.setProperty("ssl", "true");
            props.setProperty("sslmode", config.getSslMode().or("require"));
        }
        else if (config.getSslMode().isPresent()) {
            props.setProperty("sslmode", config.getSslMode().get());
        }
        return props;
    }

    private void openH2(String url)
    {
        // An in-memory H2 database is dropped when its last connection closes.
        // One connection is held here until close() instead of using
        // DB_CLOSE_DELAY=-1, which would leave no way to drop it.
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");
        try {
            this.closer = h2.getConnection();
        }
        catch (SQLException ex) {
            throw new IllegalStateException("Failed to open database " + url, ex);
        }
        this.ds = h2;
    }

    private void openPool(String url)
    {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("taskstore");
        hikari.setJdbcUrl(url);
        hikari.setDataSourceProperties(jdbcProperties(config));
        hikari.setConnectionTimeout(config.getConnectionTimeout().toMillis());
        hikari.setIdleTimeout(config.getIdleTimeout().toMillis());
        hikari.setValidationTimeout(config.getValidationTimeout().toMillis());
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumPoolSize());

        // connectionTestQuery must stay unset: ThreadLocalTransactionManager
        // relies on Connection.isValid returning false for an aborted transaction.

        HikariDataSource pool = new HikariDataSource(hikari);
        this.ds = pool;
        this.closer = pool;
    }

    @Override
    public synchronized void close()
    {
        if (ds != null) {
            try {
                closer.close();
            }
            catch (Exception ex) {
                Throwables.throwIfUnchecked(ex);
                throw new IllegalStateException("Failed to close database", ex);
            }
            ds = null;
            closer = null;
        }
    }
}
