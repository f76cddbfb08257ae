package io.taskstore.core.event;

import java.time.Instant;
import java.util.*;

import org.junit.*;
import com.google.common.base.Optional;
import com.google.inject.Guice;
import io.taskstore.core.ErrorReporter;
import io.taskstore.spi.EventHub.Subscription;
import io.taskstore.spi.event.*;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class LocalEventHubTest
{
    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private final Event added = ScheduleAdded.of(NOW, "s1", Optional.of(NOW));
    private final Event removed = ScheduleRemoved.of(NOW, "s1");
    private final Event jobAdded = JobAdded.of(NOW, UUID.randomUUID(), "t1", Optional.absent());

    @Test
    public void deliversInSubscriptionOrder()
    {
        LocalEventHub hub = new LocalEventHub();
        List<String> calls = new ArrayList<>();
        hub.subscribe(event -> calls.add("first"));
        hub.subscribe(event -> calls.add("second"));

        hub.publish(added);
        assertThat(calls, contains("first", "second"));
    }

    @Test
    public void filtersByType()
    {
        LocalEventHub hub = new LocalEventHub();
        List<ScheduleEvent> scheduleEvents = new ArrayList<>();
        List<JobAdded> jobEvents = new ArrayList<>();
        hub.subscribe(ScheduleEvent.class, scheduleEvents::add);
        hub.subscribe(JobAdded.class, jobEvents::add);

        hub.publish(added);
        hub.publish(jobAdded);
        hub.publish(removed);

        assertThat(scheduleEvents, contains(added, removed));
        assertThat(jobEvents, contains(jobAdded));
    }

    @Test
    public void closedSubscriptionStopsDelivery()
    {
        LocalEventHub hub = new LocalEventHub();
        List<Event> events = new ArrayList<>();
        Subscription subscription = hub.subscribe(events::add);

        subscription.close();
        subscription.close();
        hub.publish(added);

        assertThat(events, is(empty()));
    }

    @Test
    public void failingSubscriberIsIsolatedAndReported()
    {
        ErrorReporter reporter = mock(ErrorReporter.class);
        LocalEventHub hub = Guice.createInjector(binder -> binder.bind(ErrorReporter.class).toInstance(reporter))
            .getInstance(LocalEventHub.class);

        RuntimeException failure = new IllegalStateException("broken subscriber");
        List<Event> events = new ArrayList<>();
        hub.subscribe(event -> {
            throw failure;
        });
        hub.subscribe(events::add);

        hub.publish(added);

        assertThat(events, contains(added));
        verify(reporter).reportUncaughtError(failure);
    }

    @Test
    public void subscriberMayUnsubscribeWhileDelivering()
    {
        LocalEventHub hub = new LocalEventHub();
        List<Event> events = new ArrayList<>();
        Subscription[] self = new Subscription[1];
        self[0] = hub.subscribe(event -> {
            events.add(event);
            self[0].close();
        });

        hub.publish(added);
        hub.publish(removed);

        assertThat(events, contains(added));
    }
}
