package io.taskstore.core.database;

import java.sql.SQLException;
import javax.sql.DataSource;
import com.google.common.base.Throwables;
import com.google.inject.Inject;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionException;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

public class ThreadLocalTransactionManager
        implements TransactionManager
{
    private static final Logger logger = LoggerFactory.getLogger(ThreadLocalTransactionManager.class);

    private static final int COMMIT_VALIDATION_TIMEOUT_SECONDS = 30;

    private final ThreadLocal<ThreadHandle> current = new ThreadLocal<>();
    private final Jdbi jdbi;

    @Inject
    public ThreadLocalTransactionManager(DataSource ds)
    {
        this.jdbi = Jdbi.create(checkNotNull(ds));
        jdbi.installPlugin(new SqlObjectPlugin());
    }

    // Borrows a connection on first use so that a body which returns early
    // never touches the pool.
    private class ThreadHandle
    {
        private final boolean transactional;
        private Handle handle;

        ThreadHandle(boolean transactional)
        {
            this.transactional = transactional;
        }

        Handle get()
        {
            if (handle == null) {
                handle = jdbi.open();
                if (transactional) {
                    // jdbi turns auto-commit off here and restores it on commit or rollback
                    handle.begin();
                }
            }
            return handle;
        }

        void commit()
        {
            if (handle == null) {
                return;
            }
            // PostgreSQL answers COMMIT of a transaction whose statement failed
            // with a silent ROLLBACK.
            boolean valid;
            try {
                valid = handle.getConnection().isValid(COMMIT_VALIDATION_TIMEOUT_SECONDS);
            }
            catch (SQLException ex) {
                throw new TransactionException("Failed to validate connection before commit", ex);
            }
            if (!valid) {
                throw new TransactionException("Transaction was aborted by the database and can't be committed");
            }
            handle.commit();
        }

        void close()
        {
            if (handle == null) {
                return;
            }
            try {
                if (handle.isInTransaction()) {
                    handle.rollback();
                }
            }
            catch (RuntimeException ex) {
                logger.warn("Failed to roll back transaction", ex);
            }
            finally {
                handle.close();
            }
        }
    }

    @Override
    public Handle getHandle()
    {
        ThreadHandle h = current.get();
        if (h == null) {
            throw new IllegalStateException("Not in transaction");
        }
        return h.get();
    }

    @Override
    public boolean isInTransaction()
    {
        ThreadHandle h = current.get();
        return h != null && h.transactional;
    }

    @Override
    public <T> T begin(SupplierInTransaction<T, RuntimeException> func)
    {
        return begin(func, RuntimeException.class);
    }

    @Override
    public <T, E extends Exception> T begin(SupplierInTransaction<T, E> func, Class<E> exceptionClass)
        throws E
    {
        ThreadHandle outer = current.get();
        if (outer != null && outer.transactional) {
            throw new IllegalStateException("Nested transaction is not allowed");
        }

        ThreadHandle tx = new ThreadHandle(true);
        current.set(tx);
        try {
            T result = func.get();
            tx.commit();
            return result;
        }
        catch (Exception ex) {
            Throwables.throwIfInstanceOf(ex, exceptionClass);
            Throwables.throwIfUnchecked(ex);
            throw new TransactionException("Transaction failed", ex);
        }
        finally {
            current.set(outer);
            tx.close();
        }
    }

    @Override
    public <T> T autoCommit(SupplierInTransaction<T, RuntimeException> func)
    {
        if (current.get() != null) {
            return func.get();
        }

        ThreadHandle h = new ThreadHandle(false);
        current.set(h);
        try {
            return func.get();
        }
        finally {
            current.remove();
            h.close();
        }
    }
}
