package io.taskstore.spi.event;

import java.time.Instant;
import com.google.common.base.Optional;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleUpdated.class)
@JsonDeserialize(as = ImmutableScheduleUpdated.class)
public abstract class ScheduleUpdated
        extends ScheduleEvent
{
    public abstract Optional<Instant> getNextFireTime();

    public static ScheduleUpdated of(Instant timestamp, String scheduleId, Optional<Instant> nextFireTime)
    {
        return ImmutableScheduleUpdated.builder()
            .timestamp(timestamp)
            .scheduleId(scheduleId)
            .nextFireTime(nextFireTime)
            .build();
    }
}
