package io.taskstore.spi;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import com.google.common.base.Optional;

public interface ScheduleStore
{
    /**
     * Stores a schedule. The {@code ScheduleAdded} or {@code ScheduleUpdated}
     * event is published after the row is committed.
     *
     * @throws ConflictingIdException if the id exists and policy is {@link ConflictPolicy#EXCEPTION}
     */
    void addSchedule(Schedule schedule, ConflictPolicy policy)
        throws ConflictingIdException;

    /**
     * Deletes the given schedules unless another owner holds an unexpired
     * lease on them.
     *
     * @return ids actually deleted
     */
    Set<String> removeSchedules(Collection<String> ids);

    List<Schedule> getSchedules();

    /**
     * @param ids absent to return every schedule
     * @return schedules ordered by id
     */
    List<Schedule> getSchedules(Optional<Set<String>> ids);

    /**
     * Leases up to {@code limit} due schedules to {@code ownerId} in one
     * attempt. Returns an empty list when none is available.
     */
    List<Schedule> tryAcquireSchedules(String ownerId, int limit);

    /**
     * Leases up to {@code limit} due schedules to {@code ownerId}, waiting
     * for a notification or the poll interval between attempts. Never
     * returns an empty list.
     */
    List<Schedule> acquireSchedules(String ownerId, int limit)
        throws InterruptedException;

    /**
     * Hands leased schedules back. Schedules with a next fire time are
     * written back with the lease cleared; the others are deleted. Rows
     * whose lease now belongs to another owner are not touched.
     */
    void releaseSchedules(String ownerId, List<Schedule> schedules);
}
