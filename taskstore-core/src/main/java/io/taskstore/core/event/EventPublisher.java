package io.taskstore.core.event;

import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.taskstore.core.ErrorReporter;
import io.taskstore.core.database.TransactionManager;
import io.taskstore.spi.EventHub;
import io.taskstore.spi.event.Event;

import static io.taskstore.core.log.LogMarkers.UNEXPECTED_SERVER_ERROR;

/**
 * Publishes events of committed mutations. Publishing never fails the
 * mutation that produced the event.
 */
public class EventPublisher
{
    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private final EventHub hub;
    private final TransactionManager tm;

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public EventPublisher(EventHub hub, TransactionManager tm)
    {
        this.hub = hub;
        this.tm = tm;
    }

    public void publish(Event event)
    {
        if (tm.isInTransaction()) {
            throw new IllegalStateException("Events must be published after the transaction commits: " + event);
        }
        try {
            hub.publish(event);
        }
        catch (RuntimeException ex) {
            logger.error(UNEXPECTED_SERVER_ERROR, "Failed to publish {}", event, ex);
            errorReporter.reportUncaughtError(ex);
        }
    }

    public void publishAll(Iterable<? extends Event> events)
    {
        for (Event event : events) {
            publish(event);
        }
    }
}
