package io.taskstore.core;

/**
 * Hook for errors that are logged but not propagated to the caller, such
 * as failures of event subscribers.
 */
public interface ErrorReporter
{
    void reportUncaughtError(Throwable error);

    static ErrorReporter empty()
    {
        return new ErrorReporter()
        {
            @Override
            public void reportUncaughtError(Throwable error)
            { }
        };
    }
}
