package io.taskstore.spi.event;

import java.time.Instant;
import com.google.common.base.Optional;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleAdded.class)
@JsonDeserialize(as = ImmutableScheduleAdded.class)
public abstract class ScheduleAdded
        extends ScheduleEvent
{
    public abstract Optional<Instant> getNextFireTime();

    public static ScheduleAdded of(Instant timestamp, String scheduleId, Optional<Instant> nextFireTime)
    {
        return ImmutableScheduleAdded.builder()
            .timestamp(timestamp)
            .scheduleId(scheduleId)
            .nextFireTime(nextFireTime)
            .build();
    }
}
