package io.taskstore.core.database;

public interface NotificationSource
{
    /**
     * Opens a dedicated connection listening on {@code channel}.
     */
    NotificationSubscription subscribe(String channel)
        throws Exception;
}
