package io.taskstore.core.event;

import java.time.Instant;

import org.junit.*;
import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import io.taskstore.core.ErrorReporter;
import io.taskstore.core.database.TransactionManager;
import io.taskstore.spi.EventHub;
import io.taskstore.spi.event.Event;
import io.taskstore.spi.event.ScheduleRemoved;
import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class EventPublisherTest
{
    private final Event event = ScheduleRemoved.of(Instant.parse("2024-05-01T00:00:00Z"), "s1");

    private EventHub hub;
    private TransactionManager tm;
    private ErrorReporter reporter;
    private EventPublisher publisher;

    @Before
    public void setUp()
    {
        hub = mock(EventHub.class);
        tm = mock(TransactionManager.class);
        reporter = mock(ErrorReporter.class);
        publisher = Guice.createInjector(binder -> {
            binder.bind(EventHub.class).toInstance(hub);
            binder.bind(TransactionManager.class).toInstance(tm);
            binder.bind(ErrorReporter.class).toInstance(reporter);
        }).getInstance(EventPublisher.class);
    }

    @Test
    public void publishesOutsideTransaction()
    {
        publisher.publishAll(ImmutableList.of(event, event));
        verify(hub, times(2)).publish(event);
    }

    @Test
    public void rejectsPublishingInsideTransaction()
    {
        when(tm.isInTransaction()).thenReturn(true);
        try {
            publisher.publish(event);
            fail();
        }
        catch (IllegalStateException ex) {
            verifyNoInteractions(hub);
        }
    }

    @Test
    public void hubFailureIsReported()
    {
        RuntimeException failure = new IllegalStateException("hub failure");
        doThrow(failure).when(hub).publish(event);

        publisher.publish(event);

        verify(reporter).reportUncaughtError(failure);
    }
}
