package io.taskstore.spi;

import java.time.Instant;
import java.util.Set;
import com.google.common.base.Optional;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;
import io.taskstore.client.config.Config;

/**
 * A recurring definition that produces jobs. The next fire time is computed
 * by the scheduler before the schedule is stored or released; an absent
 * next fire time means the schedule is finished.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSchedule.class)
@JsonDeserialize(as = ImmutableSchedule.class)
public abstract class Schedule
{
    public abstract String getId();

    public abstract String getTaskId();

    /**
     * Opaque description of the trigger. Never interpreted by the store.
     */
    public abstract Optional<String> getTrigger();

    public abstract Config getArgs();

    public abstract Set<String> getTags();

    public abstract Optional<Instant> getNextFireTime();

    public abstract Optional<Instant> getLastFireTime();

    // lease columns, overlaid by the store and never serialized
    @JsonIgnore
    public abstract Optional<String> getAcquiredBy();

    @JsonIgnore
    public abstract Optional<Instant> getAcquiredUntil();

    public static ImmutableSchedule.Builder builder()
    {
        return ImmutableSchedule.builder();
    }
}
