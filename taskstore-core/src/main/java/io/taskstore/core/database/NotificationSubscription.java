package io.taskstore.core.database;

import java.time.Duration;
import java.util.List;

public interface NotificationSubscription
        extends AutoCloseable
{
    /**
     * Returns payloads received on the channel, waiting at most
     * {@code timeout} for the first one. Returns an empty list on timeout.
     */
    List<String> poll(Duration timeout)
        throws Exception;

    /**
     * Round trip that keeps an idle connection alive.
     */
    void ping()
        throws Exception;

    /**
     * Stops listening and releases the connection. Never throws.
     */
    @Override
    void close();
}
