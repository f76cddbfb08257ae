package io.taskstore.core.database;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a wake-up notification to other processes listening on the store
 * channel. Does nothing on H2 or when no channel is configured. Delivery
 * is best effort: failures are logged because waiters poll anyway.
 */
public class NotificationSender
{
    private static final Logger logger = LoggerFactory.getLogger(NotificationSender.class);

    private final TransactionManager tm;
    private final Optional<String> channel;

    @Inject
    public NotificationSender(TransactionManager tm, DatabaseConfig databaseConfig, DataStoreConfig storeConfig)
    {
        this.tm = tm;
        if (DatabaseConfig.isPostgres(databaseConfig.getType())) {
            this.channel = storeConfig.getNotifyChannel();
        }
        else {
            this.channel = Optional.absent();
        }
    }

    public boolean isEnabled()
    {
        return channel.isPresent();
    }

    public void send(String payload)
    {
        if (!channel.isPresent()) {
            return;
        }
        if (tm.isInTransaction()) {
            throw new IllegalStateException("Notifications must be sent after commit");
        }
        try {
            tm.autoCommit(() -> tm.getHandle()
                    .createQuery("select pg_notify(:channel, :payload)")
                    .bind("channel", channel.get())
                    .bind("payload", payload)
                    .mapTo(String.class)
                    .list());
        }
        catch (RuntimeException ex) {
            logger.warn("Failed to send notification {} on channel {}", payload, channel.get(), ex);
        }
    }
}
