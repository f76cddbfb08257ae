package io.taskstore.core.database;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.*;
import com.google.common.base.Optional;
import com.google.common.collect.*;
import io.taskstore.core.serializer.JacksonSerializer;
import io.taskstore.spi.ConflictPolicy;
import io.taskstore.spi.ConflictingIdException;
import io.taskstore.spi.DataStoreSession;
import io.taskstore.spi.Schedule;
import io.taskstore.spi.SerializationException;
import io.taskstore.spi.Serializer;
import io.taskstore.spi.event.*;
import static io.taskstore.client.ObjectMappers.objectMapper;
import static io.taskstore.core.database.DatabaseTestingUtils.*;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

public class DatabaseScheduleStoreManagerTest
{
    private DatabaseFactory factory;
    private DatabaseDataStore store;
    private DataStoreSession session;
    private ManualClock clock;
    private List<Event> events;

    @Before
    public void setUp()
        throws Exception
    {
        setUp(new JacksonSerializer(objectMapper()));
    }

    private void setUp(Serializer serializer)
    {
        factory = setupDatabase(testStoreConfig().build(), serializer);
        store = factory.getDataStore();
        session = store.open();
        clock = factory.getClock();
        events = new CopyOnWriteArrayList<>();
        store.getEventHub().subscribe(events::add);
    }

    @After
    public void destroy()
        throws Exception
    {
        session.close();
        factory.close();
    }

    private Schedule schedule(String id, Optional<Instant> nextFireTime)
    {
        return Schedule.builder()
            .id(id)
            .taskId("task-" + id)
            .trigger("interval:60")
            .args(createConfig().set("key", "value"))
            .nextFireTime(nextFireTime)
            .build();
    }

    private Schedule schedule(String id, Instant nextFireTime)
    {
        return schedule(id, Optional.of(nextFireTime));
    }

    private static List<String> ids(List<Schedule> schedules)
    {
        List<String> ids = new ArrayList<>();
        for (Schedule schedule : schedules) {
            ids.add(schedule.getId());
        }
        return ids;
    }

    @Test
    public void addAndGetSchedule()
        throws Exception
    {
        Schedule s1 = schedule("s1", START_TIME);
        store.addSchedule(s1, ConflictPolicy.EXCEPTION);

        List<Schedule> schedules = store.getSchedules();
        assertThat(schedules.size(), is(1));
        Schedule stored = schedules.get(0);
        assertThat(stored.getId(), is("s1"));
        assertThat(stored.getTaskId(), is("task-s1"));
        assertThat(stored.getTrigger(), is(Optional.of("interval:60")));
        assertThat(stored.getArgs(), is(s1.getArgs()));
        assertThat(stored.getNextFireTime(), is(Optional.of(START_TIME)));
        assertThat(stored.getAcquiredBy(), is(Optional.absent()));
        assertThat(stored.getAcquiredUntil(), is(Optional.absent()));

        assertThat(events, contains(ScheduleAdded.of(START_TIME, "s1", Optional.of(START_TIME))));
    }

    @Test
    public void addConflictingScheduleThrows()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        Schedule other = Schedule.builder()
            .from(schedule("s1", START_TIME.plusSeconds(60)))
            .taskId("other")
            .build();

        try {
            store.addSchedule(other, ConflictPolicy.EXCEPTION);
            fail();
        }
        catch (ConflictingIdException ex) {
            assertThat(ex.getId(), is("s1"));
        }

        assertThat(store.getSchedules().get(0).getTaskId(), is("task-s1"));
        assertThat(events.size(), is(1));
    }

    @Test
    public void addConflictingScheduleReplaces()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        Instant later = START_TIME.plusSeconds(60);
        Schedule other = Schedule.builder()
            .from(schedule("s1", later))
            .taskId("other")
            .build();

        store.addSchedule(other, ConflictPolicy.REPLACE);

        Schedule stored = store.getSchedules().get(0);
        assertThat(stored.getTaskId(), is("other"));
        assertThat(stored.getNextFireTime(), is(Optional.of(later)));
        assertThat(events.get(1), is(ScheduleUpdated.of(START_TIME, "s1", Optional.of(later))));
    }

    @Test
    public void addConflictingScheduleKeepsStoredOne()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        Schedule other = Schedule.builder()
            .from(schedule("s1", START_TIME))
            .taskId("other")
            .build();

        store.addSchedule(other, ConflictPolicy.DO_NOTHING);

        assertThat(store.getSchedules().get(0).getTaskId(), is("task-s1"));
        assertThat(events.size(), is(1));
    }

    @Test
    public void getSchedulesByIds()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("s2", START_TIME), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("s3", START_TIME), ConflictPolicy.EXCEPTION);

        assertThat(ids(store.getSchedules()), contains("s1", "s2", "s3"));
        assertThat(ids(store.getSchedules(Optional.of(ImmutableSet.of("s3", "s1", "missing")))), contains("s1", "s3"));
        assertThat(store.getSchedules(Optional.of(ImmutableSet.of())), is(empty()));
    }

    @Test
    public void acquireReleaseAndReacquire()
        throws Exception
    {
        Instant t0 = START_TIME;
        store.addSchedule(schedule("s1", t0), ConflictPolicy.EXCEPTION);

        List<Schedule> acquired = store.tryAcquireSchedules("A", 10);
        assertThat(ids(acquired), contains("s1"));
        assertThat(acquired.get(0).getAcquiredBy(), is(Optional.of("A")));
        assertThat(acquired.get(0).getAcquiredUntil(), is(Optional.of(t0.plusSeconds(30))));

        Instant t1 = t0.plus(Duration.ofMinutes(10));
        store.releaseSchedules("A", ImmutableList.of(Schedule.builder()
                    .from(acquired.get(0))
                    .nextFireTime(t1)
                    .lastFireTime(t0)
                    .build()));
        assertThat(events.get(events.size() - 1), is(ScheduleUpdated.of(t0, "s1", Optional.of(t1))));

        Schedule released = store.getSchedules().get(0);
        assertThat(released.getNextFireTime(), is(Optional.of(t1)));
        assertThat(released.getLastFireTime(), is(Optional.of(t0)));
        assertThat(released.getAcquiredBy(), is(Optional.absent()));

        assertThat(store.tryAcquireSchedules("B", 10), is(empty()));

        clock.set(t1);
        List<Schedule> reacquired = store.tryAcquireSchedules("B", 10);
        assertThat(ids(reacquired), contains("s1"));
        assertThat(reacquired.get(0).getAcquiredBy(), is(Optional.of("B")));
    }

    @Test
    public void acquireSkipsLeasedSchedulesUntilExpiration()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);

        assertThat(ids(store.tryAcquireSchedules("A", 10)), contains("s1"));
        assertThat(store.tryAcquireSchedules("B", 10), is(empty()));

        clock.advance(Duration.ofSeconds(30));
        assertThat(store.tryAcquireSchedules("B", 10), is(empty()));

        clock.advance(Duration.ofSeconds(1));
        assertThat(ids(store.tryAcquireSchedules("B", 10)), contains("s1"));
    }

    @Test
    public void acquireOrdersByFireTimeAndHonorsLimit()
        throws Exception
    {
        store.addSchedule(schedule("late", START_TIME.minusSeconds(10)), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("early", START_TIME.minusSeconds(30)), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("middle", START_TIME.minusSeconds(20)), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("future", START_TIME.plusSeconds(10)), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("finished", Optional.absent()), ConflictPolicy.EXCEPTION);

        assertThat(ids(store.tryAcquireSchedules("A", 2)), contains("early", "middle"));
        assertThat(ids(store.tryAcquireSchedules("A", 10)), contains("late"));
        assertThat(store.tryAcquireSchedules("A", 10), is(empty()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void acquireRejectsNonPositiveLimit()
        throws Exception
    {
        store.tryAcquireSchedules("A", 0);
    }

    @Test
    public void releaseByStaleOwnerIsIgnored()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        Schedule acquiredByA = store.tryAcquireSchedules("A", 1).get(0);

        clock.advance(Duration.ofSeconds(31));
        assertThat(ids(store.tryAcquireSchedules("B", 1)), contains("s1"));
        int eventCount = events.size();

        store.releaseSchedules("A", ImmutableList.of(Schedule.builder()
                    .from(acquiredByA)
                    .nextFireTime(START_TIME.plusSeconds(3600))
                    .build()));
        store.releaseSchedules("A", ImmutableList.of(Schedule.builder()
                    .from(acquiredByA)
                    .nextFireTime(Optional.absent())
                    .build()));

        Schedule stored = store.getSchedules().get(0);
        assertThat(stored.getAcquiredBy(), is(Optional.of("B")));
        assertThat(stored.getNextFireTime(), is(Optional.of(START_TIME)));
        assertThat(events.size(), is(eventCount));
    }

    @Test
    public void ownerIdIsBoundAsValue()
        throws Exception
    {
        String owner = "worker' or '1'='1";
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("s2", START_TIME), ConflictPolicy.EXCEPTION);

        List<Schedule> acquired = store.tryAcquireSchedules(owner, 1);
        assertThat(acquired.get(0).getAcquiredBy(), is(Optional.of(owner)));
        assertThat(ids(store.tryAcquireSchedules("B", 1)), contains("s2"));

        store.releaseSchedules("nobody' or '1'='1", ImmutableList.of(Schedule.builder()
                    .from(acquired.get(0))
                    .nextFireTime(Optional.absent())
                    .build()));
        assertThat(store.getSchedules().size(), is(2));

        store.releaseSchedules(owner, ImmutableList.of(Schedule.builder()
                    .from(acquired.get(0))
                    .nextFireTime(Optional.absent())
                    .build()));
        assertThat(ids(store.getSchedules()), contains("s2"));
    }

    @Test
    public void releaseFinishedScheduleRemovesIt()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        Schedule acquired = store.tryAcquireSchedules("A", 1).get(0);

        store.releaseSchedules("A", ImmutableList.of(Schedule.builder()
                    .from(acquired)
                    .nextFireTime(Optional.absent())
                    .build()));

        assertThat(store.getSchedules(), is(empty()));
        assertThat(events.get(events.size() - 1), is(ScheduleRemoved.of(START_TIME, "s1")));
    }

    @Test
    public void releaseRemovesScheduleThatFailsToSerialize()
        throws Exception
    {
        destroy();
        setUp(new FailingSerializer("broken"));

        store.addSchedule(schedule("ok", START_TIME), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("broken", Optional.absent()), ConflictPolicy.EXCEPTION);
        assertThat(ids(store.tryAcquireSchedules("A", 10)), contains("ok"));

        List<Schedule> all = store.getSchedules();
        List<Schedule> released = new ArrayList<>();
        for (Schedule s : all) {
            released.add(Schedule.builder().from(s).nextFireTime(START_TIME.plusSeconds(60)).build());
        }
        // a finished schedule is never acquired, so lease it by hand
        factory.getTransactionManager().begin(() -> {
            factory.getTransactionManager().getHandle()
                .createUpdate("update " + factory.getStoreConfig().getSchema() + ".schedules set acquired_by = :owner where id = :id")
                .bind("owner", "A")
                .bind("id", "broken")
                .execute();
            return null;
        });

        store.releaseSchedules("A", released);

        List<Schedule> remaining = store.getSchedules();
        assertThat(ids(remaining), contains("ok"));
        assertThat(remaining.get(0).getNextFireTime(), is(Optional.of(START_TIME.plusSeconds(60))));
    }

    @Test
    public void removeSchedulesSkipsLeasedOnes()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        store.addSchedule(schedule("s2", START_TIME.plusSeconds(60)), ConflictPolicy.EXCEPTION);
        store.tryAcquireSchedules("A", 10);

        Set<String> removed = store.removeSchedules(ImmutableList.of("s1", "s2", "missing"));
        assertThat(removed, containsInAnyOrder("s2"));
        assertThat(ids(store.getSchedules()), contains("s1"));
        assertThat(events.get(events.size() - 1), is(ScheduleRemoved.of(START_TIME, "s2")));

        clock.advance(Duration.ofSeconds(31));
        assertThat(store.removeSchedules(ImmutableList.of("s1")), containsInAnyOrder("s1"));
        assertThat(store.getSchedules(), is(empty()));

        assertThat(store.removeSchedules(ImmutableList.of()), is(empty()));
    }

    @Test
    public void eventsArePublishedAfterCommit()
        throws Exception
    {
        TransactionManager tm = factory.getTransactionManager();
        List<Boolean> inTransaction = new CopyOnWriteArrayList<>();
        List<Integer> visibleRows = new CopyOnWriteArrayList<>();
        store.getEventHub().subscribe(event -> {
            inTransaction.add(tm.isInTransaction());
            visibleRows.add(store.getSchedules().size());
        });

        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
        store.removeSchedules(ImmutableList.of("s1"));

        assertThat(inTransaction, contains(false, false));
        assertThat(visibleRows, contains(1, 0));
    }

    @Test
    public void failingSubscriberDoesNotFailMutation()
        throws Exception
    {
        store.getEventHub().subscribe(event -> {
            throw new IllegalStateException("subscriber failure");
        });
        List<Event> later = new ArrayList<>();
        store.getEventHub().subscribe(later::add);

        store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);

        assertThat(store.getSchedules().size(), is(1));
        assertThat(later.size(), is(1));
    }

    @Test
    public void acquireWaitsUntilScheduleIsAdded()
        throws Exception
    {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<List<Schedule>> future = executor.submit(() -> store.acquireSchedules("A", 1));
            Thread.sleep(200);
            assertFalse(future.isDone());

            store.addSchedule(schedule("s1", START_TIME), ConflictPolicy.EXCEPTION);
            assertThat(ids(future.get(5, TimeUnit.SECONDS)), contains("s1"));
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void acquireWakesUpWhenScheduleBecomesDue()
        throws Exception
    {
        store.addSchedule(schedule("s1", START_TIME.plusSeconds(60)), ConflictPolicy.EXCEPTION);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<List<Schedule>> future = executor.submit(() -> store.acquireSchedules("A", 1));
            Thread.sleep(200);
            assertFalse(future.isDone());

            clock.advance(Duration.ofSeconds(60));
            assertThat(ids(future.get(5, TimeUnit.SECONDS)), contains("s1"));
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void acquireIsInterruptible()
        throws Exception
    {
        AtomicReference<Throwable> error = new AtomicReference<>();
        Thread thread = new Thread(() -> {
            try {
                store.acquireSchedules("A", 1);
            }
            catch (Throwable ex) {
                error.set(ex);
            }
        });
        thread.start();
        Thread.sleep(200);
        thread.interrupt();
        thread.join(5000);

        assertFalse(thread.isAlive());
        assertThat(error.get(), instanceOf(InterruptedException.class));
    }

    @Test
    public void acquireRequiresOpenSession()
        throws Exception
    {
        session.close();
        try {
            store.acquireSchedules("A", 1);
            fail();
        }
        catch (IllegalStateException ex) {
            assertThat(ex.getMessage(), is("Data store is not open"));
        }
        finally {
            session = store.open();
        }
    }

    @Test
    public void concurrentAcquirersNeverShareSchedules()
        throws Exception
    {
        for (int i = 0; i < 20; i++) {
            store.addSchedule(schedule(String.format("s%02d", i), START_TIME.minusSeconds(i)), ConflictPolicy.EXCEPTION);
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                String owner = "worker-" + w;
                futures.add(executor.submit(() -> {
                    List<String> acquired = new ArrayList<>();
                    while (true) {
                        List<Schedule> batch = store.tryAcquireSchedules(owner, 3);
                        if (batch.isEmpty()) {
                            return acquired;
                        }
                        acquired.addAll(ids(batch));
                    }
                }));
            }

            List<String> all = new ArrayList<>();
            for (Future<List<String>> future : futures) {
                all.addAll(future.get(30, TimeUnit.SECONDS));
            }
            assertThat(all.size(), is(20));
            assertThat(ImmutableSet.copyOf(all).size(), is(20));
        }
        finally {
            executor.shutdownNow();
        }
    }

    private static class FailingSerializer
            implements Serializer
    {
        private final Serializer delegate = new JacksonSerializer(objectMapper());
        private final String failingId;

        FailingSerializer(String failingId)
        {
            this.failingId = failingId;
        }

        @Override
        public byte[] serialize(Object object)
        {
            if (object instanceof Schedule && ((Schedule) object).getId().equals(failingId)
                    && ((Schedule) object).getNextFireTime().isPresent()) {
                throw new SerializationException("Can't serialize " + failingId, new RuntimeException());
            }
            return delegate.serialize(object);
        }

        @Override
        public <T> T deserialize(byte[] data, Class<T> type)
        {
            return delegate.deserialize(data, type);
        }
    }
}
