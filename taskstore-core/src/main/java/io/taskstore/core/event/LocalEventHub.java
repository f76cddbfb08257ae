package io.taskstore.core.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.taskstore.core.ErrorReporter;
import io.taskstore.spi.EventHub;
import io.taskstore.spi.event.Event;

import static io.taskstore.core.log.LogMarkers.UNEXPECTED_SERVER_ERROR;

/**
 * Delivers events synchronously to subscribers of this process, in
 * subscription order.
 */
public class LocalEventHub
        implements EventHub
{
    private static final Logger logger = LoggerFactory.getLogger(LocalEventHub.class);

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    private class Registration <E extends Event>
            implements Subscription
    {
        private final Class<E> type;
        private final Listener<? super E> listener;

        Registration(Class<E> type, Listener<? super E> listener)
        {
            this.type = type;
            this.listener = listener;
        }

        void deliver(Event event)
        {
            if (type.isInstance(event)) {
                listener.onEvent(type.cast(event));
            }
        }

        @Override
        public void close()
        {
            registrations.remove(this);
        }
    }

    @Override
    public Subscription subscribe(Listener<Event> listener)
    {
        return subscribe(Event.class, listener);
    }

    @Override
    public <E extends Event> Subscription subscribe(Class<E> type, Listener<? super E> listener)
    {
        Registration<E> registration = new Registration<>(type, listener);
        registrations.add(registration);
        return registration;
    }

    @Override
    public void publish(Event event)
    {
        for (Registration<?> registration : registrations) {
            try {
                registration.deliver(event);
            }
            catch (RuntimeException ex) {
                logger.error(UNEXPECTED_SERVER_ERROR, "Event subscriber failed to handle {}", event, ex);
                errorReporter.reportUncaughtError(ex);
            }
        }
    }
}
