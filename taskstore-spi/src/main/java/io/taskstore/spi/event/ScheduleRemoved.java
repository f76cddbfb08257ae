package io.taskstore.spi.event;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleRemoved.class)
@JsonDeserialize(as = ImmutableScheduleRemoved.class)
public abstract class ScheduleRemoved
        extends ScheduleEvent
{
    public static ScheduleRemoved of(Instant timestamp, String scheduleId)
    {
        return ImmutableScheduleRemoved.builder()
            .timestamp(timestamp)
            .scheduleId(scheduleId)
            .build();
    }
}
