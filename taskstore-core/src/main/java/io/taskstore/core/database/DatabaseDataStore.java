package io.taskstore.core.database;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.taskstore.spi.ConflictPolicy;
import io.taskstore.spi.ConflictingIdException;
import io.taskstore.spi.DataStore;
import io.taskstore.spi.DataStoreSession;
import io.taskstore.spi.EventHub;
import io.taskstore.spi.Job;
import io.taskstore.spi.Schedule;

public class DatabaseDataStore
        implements DataStore
{
    private final TransactionManager tm;
    private final DataStoreLifecycle lifecycle;
    private final DatabaseScheduleStoreManager schedules;
    private final DatabaseJobStoreManager jobs;
    private final EventHub eventHub;

    @Inject
    public DatabaseDataStore(TransactionManager tm, DataStoreLifecycle lifecycle,
            DatabaseScheduleStoreManager schedules, DatabaseJobStoreManager jobs,
            EventHub eventHub)
    {
        this.tm = tm;
        this.lifecycle = lifecycle;
        this.schedules = schedules;
        this.jobs = jobs;
        this.eventHub = eventHub;
    }

    @Override
    public DataStoreSession open()
    {
        return lifecycle.open();
    }

    @Override
    public EventHub getEventHub()
    {
        return eventHub;
    }

    @Override
    public void clear()
    {
        tm.begin(() -> {
            schedules.deleteAllSchedules();
            jobs.deleteAllJobs();
            return null;
        });
    }

    @Override
    public void addSchedule(Schedule schedule, ConflictPolicy policy)
        throws ConflictingIdException
    {
        schedules.addSchedule(schedule, policy);
    }

    @Override
    public Set<String> removeSchedules(Collection<String> ids)
    {
        return schedules.removeSchedules(ids);
    }

    @Override
    public List<Schedule> getSchedules()
    {
        return schedules.getSchedules();
    }

    @Override
    public List<Schedule> getSchedules(Optional<Set<String>> ids)
    {
        return schedules.getSchedules(ids);
    }

    @Override
    public List<Schedule> tryAcquireSchedules(String ownerId, int limit)
    {
        return schedules.tryAcquireSchedules(ownerId, limit);
    }

    @Override
    public List<Schedule> acquireSchedules(String ownerId, int limit)
        throws InterruptedException
    {
        return schedules.acquireSchedules(ownerId, limit);
    }

    @Override
    public void releaseSchedules(String ownerId, List<Schedule> released)
    {
        schedules.releaseSchedules(ownerId, released);
    }

    @Override
    public void addJob(Job job)
    {
        jobs.addJob(job);
    }

    @Override
    public List<Job> getJobs()
    {
        return jobs.getJobs();
    }

    @Override
    public List<Job> getJobs(Optional<Set<UUID>> ids)
    {
        return jobs.getJobs(ids);
    }

    @Override
    public List<Job> tryAcquireJobs(String ownerId, int limit)
    {
        return jobs.tryAcquireJobs(ownerId, limit);
    }

    @Override
    public List<Job> acquireJobs(String ownerId, int limit)
        throws InterruptedException
    {
        return jobs.acquireJobs(ownerId, limit);
    }

    @Override
    public void releaseJobs(String ownerId, Collection<Job> released)
    {
        jobs.releaseJobs(ownerId, released);
    }
}
