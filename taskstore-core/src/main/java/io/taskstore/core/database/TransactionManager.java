package io.taskstore.core.database;

import org.jdbi.v3.core.Handle;

/**
 * Scopes a Jdbi {@link Handle} to the calling thread. Store managers never
 * open handles themselves; they run inside {@link #begin} or {@link #autoCommit}
 * and pick the handle up with {@link #getHandle()}.
 */
public interface TransactionManager
{
    /**
     * Returns the handle bound to the calling thread.
     *
     * @throws IllegalStateException if neither begin nor autoCommit is running
     */
    Handle getHandle();

    /**
     * Returns true if the calling thread runs inside {@link #begin}.
     */
    boolean isInTransaction();

    /**
     * Runs {@code func} in a new transaction that is committed when it returns
     * and rolled back when it throws.
     */
    <T> T begin(SupplierInTransaction<T, RuntimeException> func);

    /**
     * Same as {@link #begin(SupplierInTransaction)} but lets {@code func} throw
     * a checked exception of {@code exceptionClass} as is.
     */
    <T, E extends Exception> T begin(SupplierInTransaction<T, E> func, Class<E> exceptionClass)
        throws E;

    /**
     * Runs {@code func} on the current handle if there is one, otherwise on a
     * temporary handle in auto-commit mode.
     */
    <T> T autoCommit(SupplierInTransaction<T, RuntimeException> func);

    @FunctionalInterface
    interface SupplierInTransaction<T, E extends Exception>
    {
        T get()
                throws E;
    }
}
