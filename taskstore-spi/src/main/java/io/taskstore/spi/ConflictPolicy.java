package io.taskstore.spi;

/**
 * What {@link ScheduleStore#addSchedule(Schedule, ConflictPolicy)} does when
 * a schedule with the same id already exists.
 */
public enum ConflictPolicy
{
    /**
     * Fail with {@link ConflictingIdException} and leave the stored row untouched.
     */
    EXCEPTION,

    /**
     * Overwrite the stored task id, payload and next fire time.
     */
    REPLACE,

    /**
     * Keep the stored row.
     */
    DO_NOTHING,
}
