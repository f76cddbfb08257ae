package io.taskstore.core.database;

import java.time.Duration;

/**
 * Wakes threads that wait for schedules or jobs to become available.
 * Setting an already set signal has no further effect. A waiter that
 * observes the signal clears it.
 */
public class WakeSignal
{
    private boolean set = false;

    public synchronized void set()
    {
        if (!set) {
            set = true;
            notifyAll();
        }
    }

    public synchronized boolean isSet()
    {
        return set;
    }

    /**
     * Waits until the signal is set or the timeout elapses.
     *
     * @return true if the signal was set
     */
    public synchronized boolean await(Duration timeout)
            throws InterruptedException
    {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!set) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            long millis = remaining / 1_000_000;
            int nanos = (int) (remaining % 1_000_000);
            wait(millis, nanos);
        }
        set = false;
        return true;
    }
}
