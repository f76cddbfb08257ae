package io.taskstore.spi.event;

import java.time.Instant;
import java.util.UUID;
import com.google.common.base.Optional;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJobAdded.class)
@JsonDeserialize(as = ImmutableJobAdded.class)
public abstract class JobAdded
        extends Event
{
    public abstract UUID getJobId();

    public abstract String getTaskId();

    public abstract Optional<String> getScheduleId();

    public static JobAdded of(Instant timestamp, UUID jobId, String taskId, Optional<String> scheduleId)
    {
        return ImmutableJobAdded.builder()
            .timestamp(timestamp)
            .jobId(jobId)
            .taskId(taskId)
            .scheduleId(scheduleId)
            .build();
    }
}
