package io.taskstore.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import com.google.common.base.Optional;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.taskstore.spi.ConflictingIdException;

public abstract class BasicDatabaseStoreManager <D>
{
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String databaseType;
    protected final String schema;
    private final Class<? extends D> daoIface;
    private final TransactionManager transactionManager;

    protected BasicDatabaseStoreManager(
            String databaseType,
            String schema,
            Class<? extends D> daoIface,
            TransactionManager transactionManager)
    {
        this.databaseType = databaseType;
        this.schema = schema;
        this.daoIface = daoIface;
        this.transactionManager = transactionManager;
    }

    // PostgreSQL leases rows with a single UPDATE ... RETURNING; H2 needs a select then an update
    protected boolean supportsUpdateReturning()
    {
        return DatabaseConfig.isPostgres(databaseType);
    }

    public interface NewResourceAction <T>
    {
        T call();
    }

    public <T> T catchConflict(NewResourceAction<T> function, String id)
            throws ConflictingIdException
    {
        try {
            return function.call();
        }
        catch (UnableToExecuteStatementException ex) {
            if (ex.getCause() instanceof SQLException) {
                SQLException sqlEx = (SQLException) ex.getCause();
                if (isConflictException(sqlEx)) {
                    throw new ConflictingIdException(id);
                }
            }
            throw ex;
        }
    }

    public boolean isConflictException(SQLException ex)
    {
        // h2 and postgresql
        return "23505".equals(ex.getSQLState());
    }

    public interface TransactionAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public <T> T transaction(TransactionAction<T, D> action)
    {
        Handle handle = transactionManager.getHandle();
        return action.call(handle, attach(handle));
    }

    public <T> T autoCommit(TransactionAction<T, D> action)
    {
        return transactionManager.autoCommit(() -> {
            Handle handle = transactionManager.getHandle();
            return action.call(handle, attach(handle));
        });
    }

    private D attach(Handle handle)
    {
        // statements refer to tables as <schema>.name
        handle.define("schema", schema);
        return handle.attach(daoIface);
    }

    public static Optional<String> getOptionalString(ResultSet r, String column)
            throws SQLException
    {
        String v = r.getString(column);
        if (r.wasNull()) {
            return Optional.absent();
        }
        return Optional.of(v);
    }

    public static Optional<Instant> getOptionalTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        Timestamp t = r.getTimestamp(column);
        if (r.wasNull()) {
            return Optional.absent();
        }
        return Optional.of(t.toInstant());
    }
}
