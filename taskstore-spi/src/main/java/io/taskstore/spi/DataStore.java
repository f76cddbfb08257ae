package io.taskstore.spi;

/**
 * Schedule and job storage shared by scheduler and worker processes.
 * Blocking acquire operations and notification delivery are available only
 * while at least one {@link DataStoreSession} is open.
 */
public interface DataStore
        extends ScheduleStore, JobStore
{
    DataStoreSession open();

    EventHub getEventHub();

    /**
     * Deletes every schedule and job.
     */
    void clear();
}
