package io.taskstore.core.database;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background loop that turns notifications on the store channel into wake
 * signals. Connection failures are retried until {@link #stop()} is called.
 */
public class NotificationListener
        implements Runnable
{
    private static final Logger logger = LoggerFactory.getLogger(NotificationListener.class);

    public static final String SCHEDULE_PAYLOAD = "schedule";
    public static final String JOB_PAYLOAD = "job";

    // upper bound of each wait so that stop() is observed promptly
    private static final Duration POLL_SLICE = Duration.ofMillis(500);

    private final NotificationSource source;
    private final String channel;
    private final WakeSignal scheduleSignal;
    private final WakeSignal jobSignal;
    private final Duration maxIdleTime;
    private final Duration retryInterval;
    private final Duration pollSlice;

    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean stopped = false;
    private volatile Thread thread;

    public NotificationListener(NotificationSource source, String channel,
            WakeSignal scheduleSignal, WakeSignal jobSignal,
            Duration maxIdleTime, Duration retryInterval)
    {
        this(source, channel, scheduleSignal, jobSignal, maxIdleTime, retryInterval, POLL_SLICE);
    }

    @VisibleForTesting
    NotificationListener(NotificationSource source, String channel,
            WakeSignal scheduleSignal, WakeSignal jobSignal,
            Duration maxIdleTime, Duration retryInterval, Duration pollSlice)
    {
        this.source = source;
        this.channel = channel;
        this.scheduleSignal = scheduleSignal;
        this.jobSignal = jobSignal;
        this.maxIdleTime = maxIdleTime;
        this.retryInterval = retryInterval;
        this.pollSlice = pollSlice.compareTo(maxIdleTime) > 0 ? maxIdleTime : pollSlice;
    }

    @Override
    public void run()
    {
        thread = Thread.currentThread();
        try {
            while (!stopped) {
                try {
                    listen();
                }
                catch (InterruptedException ex) {
                    if (!stopped) {
                        logger.warn("Notification listener on channel {} was interrupted", channel);
                    }
                    break;
                }
                catch (Exception ex) {
                    if (stopped) {
                        break;
                    }
                    logger.warn("Notification listener on channel {} failed. Reconnecting in {} ms",
                            channel, retryInterval.toMillis(), ex);
                    try {
                        Thread.sleep(retryInterval.toMillis());
                    }
                    catch (InterruptedException ie) {
                        break;
                    }
                }
            }
        }
        finally {
            logger.info("Notification listener on channel {} stopped", channel);
            thread = null;
            finished.countDown();
        }
    }

    private void listen()
            throws Exception
    {
        try (NotificationSubscription subscription = source.subscribe(channel)) {
            logger.info("Listening for notifications on channel {}", channel);
            long lastActivity = System.nanoTime();
            while (!stopped) {
                if (Thread.interrupted()) {
                    throw new InterruptedException();
                }
                List<String> payloads = subscription.poll(pollSlice);
                if (!payloads.isEmpty()) {
                    for (String payload : payloads) {
                        dispatch(payload);
                    }
                    lastActivity = System.nanoTime();
                }
                else if (System.nanoTime() - lastActivity >= maxIdleTime.toNanos()) {
                    subscription.ping();
                    lastActivity = System.nanoTime();
                }
            }
        }
    }

    private void dispatch(String payload)
    {
        logger.debug("Received notification {} on channel {}", payload, channel);
        switch (payload) {
        case SCHEDULE_PAYLOAD:
            scheduleSignal.set();
            break;
        case JOB_PAYLOAD:
            jobSignal.set();
            break;
        default:
            // other payloads share the channel
            break;
        }
    }

    public void stop()
    {
        stopped = true;
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }

    public boolean isStopped()
    {
        return stopped;
    }

    /**
     * Waits until {@link #run()} returns.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitTermination(Duration timeout)
            throws InterruptedException
    {
        return finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
