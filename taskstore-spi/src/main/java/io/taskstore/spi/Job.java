package io.taskstore.spi;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import java.util.UUID;
import com.google.common.base.Optional;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;
import io.taskstore.client.config.Config;

/**
 * A one-shot request to run a task. Workers acquire jobs in creation order.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableJob.class)
@JsonDeserialize(as = ImmutableJob.class)
public abstract class Job
{
    @Value.Default
    public UUID getId()
    {
        return UUID.randomUUID();
    }

    public abstract String getTaskId();

    public abstract Config getArgs();

    public abstract Optional<String> getScheduleId();

    public abstract Optional<Instant> getScheduledFireTime();

    public abstract Optional<Instant> getStartDeadline();

    public abstract Set<String> getTags();

    // databases keep microseconds
    @Value.Default
    public Instant getCreatedAt()
    {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    @JsonIgnore
    public abstract Optional<String> getAcquiredBy();

    @JsonIgnore
    public abstract Optional<Instant> getAcquiredUntil();

    public static ImmutableJob.Builder builder()
    {
        return ImmutableJob.builder();
    }
}
