package io.taskstore.spi;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import com.google.common.base.Optional;

public interface JobStore
{
    void addJob(Job job);

    List<Job> getJobs();

    List<Job> getJobs(Optional<Set<UUID>> ids);

    List<Job> tryAcquireJobs(String ownerId, int limit);

    List<Job> acquireJobs(String ownerId, int limit)
        throws InterruptedException;

    /**
     * Deletes finished jobs still leased by {@code ownerId}.
     */
    void releaseJobs(String ownerId, Collection<Job> jobs);
}
