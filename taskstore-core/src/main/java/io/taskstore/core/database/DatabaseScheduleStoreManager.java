package io.taskstore.core.database;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.statement.UseRowMapper;
import io.taskstore.core.event.EventPublisher;
import io.taskstore.spi.ConflictPolicy;
import io.taskstore.spi.ConflictingIdException;
import io.taskstore.spi.ImmutableSchedule;
import io.taskstore.spi.Schedule;
import io.taskstore.spi.ScheduleStore;
import io.taskstore.spi.SerializationException;
import io.taskstore.spi.Serializer;
import io.taskstore.spi.event.Event;
import io.taskstore.spi.event.ScheduleAdded;
import io.taskstore.spi.event.ScheduleRemoved;
import io.taskstore.spi.event.ScheduleUpdated;

import static com.google.common.base.Preconditions.checkArgument;
import static io.taskstore.core.database.NotificationListener.SCHEDULE_PAYLOAD;

public class DatabaseScheduleStoreManager
        extends BasicDatabaseStoreManager<DatabaseScheduleStoreManager.Dao>
        implements ScheduleStore
{
    private final TransactionManager tm;
    private final DataStoreConfig storeConfig;
    private final Serializer serializer;
    private final EventPublisher publisher;
    private final NotificationSender notifier;
    private final DataStoreLifecycle lifecycle;
    private final Clock clock;

    @Inject
    public DatabaseScheduleStoreManager(TransactionManager tm, DatabaseConfig databaseConfig, DataStoreConfig storeConfig,
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
    public void addSchedule(Schedule schedule, ConflictPolicy policy)
        throws ConflictingIdException
    {
        byte[] data = serializer.serialize(schedule);
        Instant nextFireTime = schedule.getNextFireTime().orNull();

        Event event;
        try {
            tm.begin(() -> catchConflict(() ->
                        transaction((handle, dao) -> dao.insertSchedule(schedule.getId(), schedule.getTaskId(), data, nextFireTime)),
                        schedule.getId()),
                    ConflictingIdException.class);
            event = ScheduleAdded.of(now(), schedule.getId(), schedule.getNextFireTime());
        }
        catch (ConflictingIdException ex) {
            switch (policy) {
            case REPLACE:
                tm.begin(() -> transaction((handle, dao) ->
                            dao.replaceSchedule(schedule.getId(), schedule.getTaskId(), data, nextFireTime)));
                event = ScheduleUpdated.of(now(), schedule.getId(), schedule.getNextFireTime());
                break;
            case DO_NOTHING:
                logger.debug("Schedule {} already exists. Keeping the stored one", schedule.getId());
                return;
            default:
                throw ex;
            }
        }

        publisher.publish(event);
        lifecycle.wakeSchedules();
        notifier.send(SCHEDULE_PAYLOAD);
    }

    @Override
    public Set<String> removeSchedules(Collection<String> ids)
    {
        if (ids.isEmpty()) {
            return ImmutableSet.of();
        }
        Set<String> distinctIds = ImmutableSet.copyOf(ids);
        Instant now = now();

        List<String> removed = tm.begin(() -> transaction((handle, dao) -> {
            List<String> removable = dao.lockRemovableSchedules(distinctIds, now);
            if (!removable.isEmpty()) {
                dao.deleteSchedules(removable);
            }
            return removable;
        }));

        for (String id : removed) {
            publisher.publish(ScheduleRemoved.of(now, id));
        }
        return ImmutableSet.copyOf(removed);
    }

    @Override
    public List<Schedule> getSchedules()
    {
        return getSchedules(Optional.absent());
    }

    @Override
    public List<Schedule> getSchedules(Optional<Set<String>> ids)
    {
        if (ids.isPresent() && ids.get().isEmpty()) {
            return ImmutableList.of();
        }
        List<StoredRow> rows = autoCommit((handle, dao) -> {
            if (ids.isPresent()) {
                return dao.getSchedulesByIds(ids.get());
            }
            else {
                return dao.getSchedules();
            }
        });
        return toSchedules(rows);
    }

    @Override
    public List<Schedule> tryAcquireSchedules(String ownerId, int limit)
    {
        checkArgument(limit > 0, "limit must be positive");
        Instant now = now();
        Instant until = now.plus(storeConfig.getLockExpirationDelay());

        List<StoredRow> rows = tm.begin(() -> transaction((handle, dao) -> {
            List<String> ids;
            if (supportsUpdateReturning()) {
                ids = ((PgDao) dao).acquireSchedules(now, limit, ownerId, until);
            }
            else {
                ids = dao.lockAvailableSchedules(now, limit);
                if (!ids.isEmpty()) {
                    dao.leaseSchedules(ids, ownerId, until);
                }
            }
            if (ids.isEmpty()) {
                return ImmutableList.<StoredRow>of();
            }
            return dao.getSchedulesByFireTime(ids);
        }));

        if (!rows.isEmpty()) {
            logger.debug("Acquired {} schedules for {}", rows.size(), ownerId);
        }
        return toSchedules(rows);
    }

    @Override
    public List<Schedule> acquireSchedules(String ownerId, int limit)
        throws InterruptedException
    {
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            List<Schedule> schedules = tryAcquireSchedules(ownerId, limit);
            if (!schedules.isEmpty()) {
                return schedules;
            }
            lifecycle.getScheduleSignal().await(storeConfig.getMaxPollTime());
        }
    }

    @Override
    public void releaseSchedules(String ownerId, List<Schedule> schedules)
    {
        List<String> updateIds = new ArrayList<>();
        List<byte[]> updateData = new ArrayList<>();
        List<Instant> updateFireTimes = new ArrayList<>();
        List<String> finishedIds = new ArrayList<>();

        for (Schedule schedule : schedules) {
            if (!schedule.getNextFireTime().isPresent()) {
                finishedIds.add(schedule.getId());
                continue;
            }
            byte[] data;
            try {
                data = serializer.serialize(schedule);
            }
            catch (SerializationException ex) {
                logger.warn("Failed to serialize schedule {}. Removing it from the data store", schedule.getId(), ex);
                finishedIds.add(schedule.getId());
                continue;
            }
            updateIds.add(schedule.getId());
            updateData.add(data);
            updateFireTimes.add(schedule.getNextFireTime().get());
        }

        if (updateIds.isEmpty() && finishedIds.isEmpty()) {
            return;
        }

        Instant now = now();
        List<Event> events = tm.begin(() -> transaction((handle, dao) -> {
            ImmutableList.Builder<Event> builder = ImmutableList.builder();
            if (!updateIds.isEmpty()) {
                int[] counts = dao.releaseSchedules(updateIds, updateData, updateFireTimes, ownerId);
                for (int i = 0; i < counts.length; i++) {
                    if (counts[i] > 0) {
                        builder.add(ScheduleUpdated.of(now, updateIds.get(i), Optional.of(updateFireTimes.get(i))));
                    }
                }
            }
            if (!finishedIds.isEmpty()) {
                List<String> owned = dao.lockOwnedSchedules(finishedIds, ownerId);
                if (!owned.isEmpty()) {
                    dao.deleteSchedules(owned);
                }
                for (String id : owned) {
                    builder.add(ScheduleRemoved.of(now, id));
                }
            }
            return builder.build();
        }));

        publisher.publishAll(events);
        if (events.stream().anyMatch(event -> event instanceof ScheduleUpdated)) {
            lifecycle.wakeSchedules();
            notifier.send(SCHEDULE_PAYLOAD);
        }
    }

    /**
     * Deletes every schedule. Must be called in a transaction.
     */
    public void deleteAllSchedules()
    {
        transaction((handle, dao) -> dao.deleteAllSchedules());
    }

    private List<Schedule> toSchedules(List<StoredRow> rows)
    {
        ImmutableList.Builder<Schedule> builder = ImmutableList.builder();
        for (StoredRow row : rows) {
            Schedule schedule = serializer.deserialize(row.getSerializedData(), Schedule.class);
            builder.add(ImmutableSchedule.copyOf(schedule)
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
                "select id from <schema>.schedules" +
                " where next_fire_time is not null" +
                " and :now >= next_fire_time" +
                " and (acquired_until is null or :now > acquired_until)" +
                " order by next_fire_time" +
                " limit :limit" +
                " for no key update skip locked" +
                ")" +
                " update <schema>.schedules" +
                " set acquired_by = :owner, acquired_until = :until" +
                " where id in (select id from ids)" +
                " returning id")
        List<String> acquireSchedules(@Bind("now") Instant now, @Bind("limit") int limit,
                @Bind("owner") String owner, @Bind("until") Instant until);
    }

    public interface Dao
    {
        @SqlUpdate("insert into <schema>.schedules" +
                " (id, task_id, serialized_data, next_fire_time)" +
                " values (:id, :taskId, :data, :nextFireTime)")
        int insertSchedule(@Bind("id") String id, @Bind("taskId") String taskId,
                @Bind("data") byte[] data, @Bind("nextFireTime") Instant nextFireTime);

        @SqlUpdate("update <schema>.schedules" +
                " set task_id = :taskId, serialized_data = :data, next_fire_time = :nextFireTime" +
                " where id = :id")
        int replaceSchedule(@Bind("id") String id, @Bind("taskId") String taskId,
                @Bind("data") byte[] data, @Bind("nextFireTime") Instant nextFireTime);

        @SqlQuery("select id, serialized_data, acquired_by, acquired_until from <schema>.schedules" +
                " order by id")
        @UseRowMapper(StoredRowMapper.class)
        List<StoredRow> getSchedules();

        @SqlQuery("select id, serialized_data, acquired_by, acquired_until from <schema>.schedules" +
                " where id in (<ids>)" +
                " order by id")
        @UseRowMapper(StoredRowMapper.class)
        List<StoredRow> getSchedulesByIds(@BindList("ids") Collection<String> ids);

        @SqlQuery("select id, serialized_data, acquired_by, acquired_until from <schema>.schedules" +
                " where id in (<ids>)" +
                " order by next_fire_time, id")
        @UseRowMapper(StoredRowMapper.class)
        List<StoredRow> getSchedulesByFireTime(@BindList("ids") Collection<String> ids);

        @SqlQuery("select id from <schema>.schedules" +
                " where next_fire_time is not null" +
                " and :now >= next_fire_time" +
                " and (acquired_until is null or :now > acquired_until)" +
                " order by next_fire_time" +
                " limit :limit" +
                " for update skip locked")
        List<String> lockAvailableSchedules(@Bind("now") Instant now, @Bind("limit") int limit);

        @SqlUpdate("update <schema>.schedules" +
                " set acquired_by = :owner, acquired_until = :until" +
                " where id in (<ids>)")
        int leaseSchedules(@BindList("ids") Collection<String> ids,
                @Bind("owner") String owner, @Bind("until") Instant until);

        @SqlBatch("update <schema>.schedules" +
                " set serialized_data = :data, next_fire_time = :nextFireTime," +
                " acquired_by = null, acquired_until = null" +
                " where id = :id and acquired_by = :owner")
        int[] releaseSchedules(@Bind("id") List<String> ids, @Bind("data") List<byte[]> data,
                @Bind("nextFireTime") List<Instant> nextFireTimes, @Bind("owner") String owner);

        @SqlQuery("select id from <schema>.schedules" +
                " where id in (<ids>)" +
                " and (acquired_until is null or :now > acquired_until)" +
                " for update")
        List<String> lockRemovableSchedules(@BindList("ids") Collection<String> ids, @Bind("now") Instant now);

        @SqlQuery("select id from <schema>.schedules" +
                " where id in (<ids>)" +
                " and acquired_by = :owner" +
                " for update")
        List<String> lockOwnedSchedules(@BindList("ids") Collection<String> ids, @Bind("owner") String owner);

        @SqlUpdate("delete from <schema>.schedules" +
                " where id in (<ids>)")
        int deleteSchedules(@BindList("ids") Collection<String> ids);

        @SqlUpdate("delete from <schema>.schedules")
        int deleteAllSchedules();
    }
}
