package io.taskstore.spi.event;

public abstract class ScheduleEvent
        extends Event
{
    public abstract String getScheduleId();
}
