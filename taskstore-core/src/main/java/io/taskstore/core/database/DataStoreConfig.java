package io.taskstore.core.database;

import java.time.Duration;
import java.util.regex.Pattern;
import com.google.common.base.Optional;
import org.immutables.value.Value;
import io.taskstore.client.config.Config;
import io.taskstore.client.config.ConfigException;

/**
 * Settings of the schedule and job stores, read from {@code store.*} keys.
 */
@Value.Immutable
public abstract class DataStoreConfig
{
    // schema and channel names are interpolated into DDL and LISTEN
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public abstract String getSchema();

    /**
     * Channel used for LISTEN/NOTIFY. Absent disables notifications.
     */
    public abstract Optional<String> getNotifyChannel();

    public abstract Duration getLockExpirationDelay();

    public abstract Duration getMaxPollTime();

    public abstract Duration getMaxIdleTime();

    public abstract Duration getListenerRetryInterval();

    public abstract boolean getStartFromScratch();

    @Value.Check
    protected void check()
    {
        checkIdentifier("store.schema", getSchema());
        if (getNotifyChannel().isPresent()) {
            checkIdentifier("store.notify_channel", getNotifyChannel().get());
        }
        checkPositive("store.lock_expiration_seconds", getLockExpirationDelay());
        checkPositive("store.max_poll_millis", getMaxPollTime());
        checkPositive("store.max_idle_seconds", getMaxIdleTime());
        checkPositive("store.listener_retry_millis", getListenerRetryInterval());
    }

    private static void checkIdentifier(String key, String value)
    {
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new ConfigException("Parameter '" + key + "' must be a plain SQL identifier but got '" + value + "'");
        }
    }

    private static void checkPositive(String key, Duration value)
    {
        if (value.isNegative() || value.isZero()) {
            throw new ConfigException("Parameter '" + key + "' must be positive");
        }
    }

    public static ImmutableDataStoreConfig.Builder builder()
    {
        return ImmutableDataStoreConfig.builder();
    }

    public static ImmutableDataStoreConfig.Builder defaultBuilder()
    {
        return builder()
            .schema("public")
            .notifyChannel("taskstore")
            .lockExpirationDelay(Duration.ofSeconds(30))
            .maxPollTime(Duration.ofMillis(1000))
            .maxIdleTime(Duration.ofSeconds(60))
            .listenerRetryInterval(Duration.ofMillis(1000))
            .startFromScratch(false);
    }

    public static DataStoreConfig convertFrom(Config config)
    {
        String channel = config.get("store.notify_channel", String.class, "taskstore");
        return builder()
            .schema(config.get("store.schema", String.class, "public"))
            .notifyChannel(channel.isEmpty() ? Optional.absent() : Optional.of(channel))
            .lockExpirationDelay(Duration.ofSeconds(config.get("store.lock_expiration_seconds", long.class, 30L)))
            .maxPollTime(Duration.ofMillis(config.get("store.max_poll_millis", long.class, 1000L)))
            .maxIdleTime(Duration.ofSeconds(config.get("store.max_idle_seconds", long.class, 60L)))
            .listenerRetryInterval(Duration.ofMillis(config.get("store.listener_retry_millis", long.class, 1000L)))
            .startFromScratch(config.get("store.start_from_scratch", boolean.class, false))
            .build();
    }
}
