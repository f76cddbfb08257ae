package io.taskstore.spi;

import io.taskstore.spi.event.Event;

public interface EventHub
{
    interface Subscription
            extends AutoCloseable
    {
        @Override
        void close();
    }

    interface Listener<E extends Event>
    {
        void onEvent(E event);
    }

    Subscription subscribe(Listener<Event> listener);

    <E extends Event> Subscription subscribe(Class<E> type, Listener<? super E> listener);

    void publish(Event event);
}
