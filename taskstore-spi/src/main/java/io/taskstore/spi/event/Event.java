package io.taskstore.spi.event;

import java.time.Instant;

/**
 * Notification about a committed change in a data store. Events are
 * delivered in process and never persisted.
 */
public abstract class Event
{
    public abstract Instant getTimestamp();
}
