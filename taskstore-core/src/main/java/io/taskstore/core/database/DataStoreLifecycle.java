package io.taskstore.core.database;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import com.google.inject.Inject;
import com.google.inject.name.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.taskstore.client.config.ConfigException;
import io.taskstore.spi.DataStoreSession;

/**
 * Reference-counted open state shared by the schedule and job stores. The
 * first session sets up the schema and starts the notification listener;
 * closing the last one stops it.
 */
public class DataStoreLifecycle
{
    private static final Logger logger = LoggerFactory.getLogger(DataStoreLifecycle.class);

    public static final String LISTENER_EXECUTOR = "taskstore.notification-listener";

    private static final Duration LISTENER_STOP_TIMEOUT = Duration.ofSeconds(10);

    private final SchemaManager schemaManager;
    private final NotificationSource notificationSource;
    private final ExecutorService listenerExecutor;
    private final DataStoreConfig storeConfig;
    private final boolean notificationsEnabled;

    private int loans = 0;
    private WakeSignal scheduleSignal;
    private WakeSignal jobSignal;
    private NotificationListener listener;

    @Inject
    public DataStoreLifecycle(SchemaManager schemaManager,
            NotificationSource notificationSource,
            @Named(LISTENER_EXECUTOR) ExecutorService listenerExecutor,
            DatabaseConfig databaseConfig,
            DataStoreConfig storeConfig)
    {
        this.schemaManager = schemaManager;
        this.notificationSource = notificationSource;
        this.listenerExecutor = listenerExecutor;
        this.storeConfig = storeConfig;
        this.notificationsEnabled = DatabaseConfig.isPostgres(databaseConfig.getType())
            && storeConfig.getNotifyChannel().isPresent();
    }

    public synchronized DataStoreSession open()
    {
        if (listenerExecutor.isShutdown()) {
            throw new ConfigException("Data store is bound to a notification listener executor that is already shut down");
        }

        if (loans == 0) {
            schemaManager.setup();
            scheduleSignal = new WakeSignal();
            jobSignal = new WakeSignal();
            if (notificationsEnabled) {
                startListener();
            }
            else {
                logger.info("Notifications are disabled. Waiting acquirers poll every {} ms",
                        storeConfig.getMaxPollTime().toMillis());
            }
        }
        loans++;
        return new Session();
    }

    private void startListener()
    {
        NotificationListener newListener = new NotificationListener(
                notificationSource,
                storeConfig.getNotifyChannel().get(),
                scheduleSignal, jobSignal,
                storeConfig.getMaxIdleTime(),
                storeConfig.getListenerRetryInterval());
        try {
            listenerExecutor.execute(newListener);
        }
        catch (RejectedExecutionException ex) {
            scheduleSignal = null;
            jobSignal = null;
            throw new ConfigException("Notification listener executor rejected the listener", ex);
        }
        listener = newListener;
    }

    private void release()
    {
        NotificationListener stopping;
        synchronized (this) {
            loans--;
            if (loans > 0) {
                return;
            }

            stopping = listener;
            listener = null;
            if (stopping != null) {
                stopping.stop();
            }

            // wake waiters so that they notice the store is closed
            scheduleSignal.set();
            jobSignal.set();
            scheduleSignal = null;
            jobSignal = null;
        }

        // outside the monitor so that wakeSchedules and wakeJobs never wait for the listener
        if (stopping != null) {
            try {
                if (!stopping.awaitTermination(LISTENER_STOP_TIMEOUT)) {
                    logger.warn("Notification listener did not stop within {} seconds", LISTENER_STOP_TIMEOUT.getSeconds());
                }
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public synchronized boolean isOpen()
    {
        return loans > 0;
    }

    synchronized int getLoans()
    {
        return loans;
    }

    public synchronized WakeSignal getScheduleSignal()
    {
        checkOpen();
        return scheduleSignal;
    }

    public synchronized WakeSignal getJobSignal()
    {
        checkOpen();
        return jobSignal;
    }

    public synchronized void wakeSchedules()
    {
        if (scheduleSignal != null) {
            scheduleSignal.set();
        }
    }

    public synchronized void wakeJobs()
    {
        if (jobSignal != null) {
            jobSignal.set();
        }
    }

    private void checkOpen()
    {
        if (loans == 0) {
            throw new IllegalStateException("Data store is not open");
        }
    }

    private class Session
            implements DataStoreSession
    {
        private final AtomicBoolean closed = new AtomicBoolean(false);

        @Override
        public void close()
        {
            if (closed.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
