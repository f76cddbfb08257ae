package io.taskstore.core.database;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.statement.UseRowMapper;
import io.taskstore.core.event.EventPublisher;
import io.taskstore.spi.ImmutableJob;
import io.taskstore.spi.Job;
import io.taskstore.spi.JobStore;
import io.taskstore.spi.Serializer;
import io.taskstore.spi.event.JobAdded;

import static com.google.common.base.Preconditions.checkArgument;
import static io.taskstore.core.database.NotificationListener.JOB_PAYLOAD;

public class DatabaseJobStoreManager
        extends BasicDatabaseStoreManager<DatabaseJobStoreManager.Dao>
        implements JobStore
{
    private final TransactionManager tm;
    private final DataStoreConfig storeConfig;
    private final Serializer serializer;
    private final EventPublisher publisher;
    private final NotificationSender notifier;
    private final DataStoreLifecycle lifecycle;
    private final Clock clock;

    @Inject
    public DatabaseJobStoreManager(TransactionManager tm, DatabaseConfig databaseConfig, DataStoreConfig storeConfig,
            Serializer serializer, EventPublisher publisher, NotificationSender notifier,
            DataStoreLifecycle lifecycle, Clock clock)
    {
        super(databaseConfig.getType(), storeConfig.getSchema(), dao(databaseConfig.getType()), tm);
        this.tm = tm;
        this.storeConfig = storeConfig;
        this.serializer = serializer;
        this.publisher = publisher;
        this.notifier = notifier;
        this.lifecycle = lifecycle;
        this.clock = clock;
    }

    private static Class<? extends Dao> dao(String type)
    {
        switch (type) {
        case "postgresql":
            return PgDao.class;
        case "h2":
            return H2Dao.class;
        default:
            throw new IllegalArgumentException("Unknown database type: " + type);
        }
    }

    private Instant now()
    {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    @Override
    public void addJob(Job job)
    {
        byte[] data = serializer.serialize(job);
        String[] tags = job.getTags().toArray(new String[0]);

        tm.begin(() -> transaction((handle, dao) ->
                    dao.insertJob(job.getId(), job.getTaskId(), job.getCreatedAt(), data, tags)));

        publisher.publish(JobAdded.of(now(), job.getId(), job.getTaskId(), job.getScheduleId()));
        lifecycle.wakeJobs();
        notifier.send(JOB_PAYLOAD);
    }

    @Override
    public List<Job> getJobs()
    {
        return getJobs(Optional.absent());
    }

    @Override
    public List<Job> getJobs(Optional<Set<UUID>> ids)
    {
        if (ids.isPresent() && ids.get().isEmpty()) {
            return ImmutableList.of();
        }
        List<StoredRow> rows = autoCommit((handle, dao) -> {
            if (ids.isPresent()) {
                return dao.getJobsByIds(ids.get());
            }
            else {
                return dao.getJobs();
            }
        });
        return toJobs(rows);
    }

    @Override
    public List<Job> tryAcquireJobs(String ownerId, int limit)
    {
        checkArgument(limit > 0, "limit must be positive");
        Instant now = now();
        Instant until = now.plus(storeConfig.getLockExpirationDelay());

        List<StoredRow> rows = tm.begin(() -> transaction((handle, dao) -> {
            List<String> ids;
            if (supportsUpdateReturning()) {
                ids = ((PgDao) dao).acquireJobs(now, limit, ownerId, until);
            }
            else {
                ids = dao.lockAvailableJobs(now, limit);
                if (!ids.isEmpty()) {
                    dao.leaseJobs(toUuids(ids), ownerId, until);
                }
            }
            if (ids.isEmpty()) {
                return ImmutableList.<StoredRow>of();
            }
            return dao.getJobsByCreationTime(toUuids(ids));
        }));

        if (!rows.isEmpty()) {
            logger.debug("Acquired {} jobs for {}", rows.size(), ownerId);
        }
        return toJobs(rows);
    }

    @Override
    public List<Job> acquireJobs(String ownerId, int limit)
        throws InterruptedException
    {
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            List<Job> jobs = tryAcquireJobs(ownerId, limit);
            if (!jobs.isEmpty()) {
                return jobs;
            }
            lifecycle.getJobSignal().await(storeConfig.getMaxPollTime());
        }
    }

    @Override
    public void releaseJobs(String ownerId, Collection<Job> jobs)
    {
        if (jobs.isEmpty()) {
            return;
        }
        Set<UUID> ids = jobs.stream().map(Job::getId).collect(Collectors.toSet());
        int deleted = tm.begin(() -> transaction((handle, dao) -> dao.deleteOwnedJobs(ids, ownerId)));
        if (deleted < ids.size()) {
            logger.debug("Released {} of {} jobs for {}; the others were not leased by it", deleted, ids.size(), ownerId);
        }
    }

    /**
     * Deletes every job. Must be called in a transaction.
     */
    public void deleteAllJobs()
    {
        transaction((handle, dao) -> dao.deleteAllJobs());
    }

    private static List<UUID> toUuids(List<String> ids)
    {
        return ids.stream().map(UUID::fromString).collect(Collectors.toList());
    }

    private List<Job> toJobs(List<StoredRow> rows)
    {
        ImmutableList.Builder<Job> builder = ImmutableList.builder();
        for (StoredRow row : rows) {
            Job job = serializer.deserialize(row.getSerializedData(), Job.class);
            builder.add(ImmutableJob.copyOf(job)
                    .withAcquiredBy(row.getAcquiredBy())
                    .withAcquiredUntil(row.getAcquiredUntil()));
        }
        return builder.build();
    }

    public interface H2Dao
            extends Dao
    {
    }

    public interface PgDao
            extends Dao
    {
        @SqlQuery("with ids as (" +
                "select id from <schema>.jobs" +
                " where acquired_until is null or :now > acquired_until" +
                " order by created_at" +
                " limit :limit" +
                " for no key update skip locked" +
                ")" +
                " update <schema>.jobs" +
                " set acquired_by = :owner, acquired_until = :until" +
                " where id in (select id from ids)" +
                " returning id")
        List<String> acquireJobs(@Bind("now") Instant now, @Bind("limit") int limit,
                @Bind("owner") String owner, @Bind("until") Instant until);
    }

    public interface Dao
    {
        @SqlUpdate("insert into <schema>.jobs" +
                " (id, task_id, created_at, serialized_data, tags)" +
                " values (:id, :taskId, :createdAt, :data, :tags)")
        int insertJob(@Bind("id") UUID id, @Bind("taskId") String taskId, @Bind("createdAt") Instant createdAt,
                @Bind("data") byte[] data, @Bind("tags") String[] tags);

        @SqlQuery("select id, serialized_data, acquired_by, acquired_until from <schema>.jobs" +
                " order by id")
        @UseRowMapper(StoredRowMapper.class)
        List<StoredRow> getJobs();

        @SqlQuery("select id, serialized_data, acquired_by, acquired_until from <schema>.jobs" +
                " where id in (<ids>)" +
                " order by id")
        @UseRowMapper(StoredRowMapper.class)
        List<StoredRow> getJobsByIds(@BindList("ids") Collection<UUID> ids);

        @SqlQuery("select id, serialized_data, acquired_by, acquired_until from <schema>.jobs" +
                " where id in (<ids>)" +
                " order by created_at, id")
        @UseRowMapper(StoredRowMapper.class)
        List<StoredRow> getJobsByCreationTime(@BindList("ids") Collection<UUID> ids);

        @SqlQuery("select id from <schema>.jobs" +
                " where acquired_until is null or :now > acquired_until" +
                " order by created_at" +
                " limit :limit" +
                " for update skip locked")
        List<String> lockAvailableJobs(@Bind("now") Instant now, @Bind("limit") int limit);

        @SqlUpdate("update <schema>.jobs" +
                " set acquired_by = :owner, acquired_until = :until" +
                " where id in (<ids>)")
        int leaseJobs(@BindList("ids") Collection<UUID> ids,
                @Bind("owner") String owner, @Bind("until") Instant until);

        @SqlUpdate("delete from <schema>.jobs" +
                " where id in (<ids>)" +
                " and acquired_by = :owner")
        int deleteOwnedJobs(@BindList("ids") Collection<UUID> ids, @Bind("owner") String owner);

        @SqlUpdate("delete from <schema>.jobs")
        int deleteAllJobs();
    }
}
