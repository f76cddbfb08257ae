package io.taskstore.core;

import java.time.Clock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.taskstore.client.ObjectMappers;
import io.taskstore.client.config.Config;
import io.taskstore.client.config.ConfigFactory;
import io.taskstore.core.database.DatabaseDataStore;
import io.taskstore.core.database.DatabaseModule;
import io.taskstore.core.event.EventPublisher;
import io.taskstore.core.event.LocalEventHub;
import io.taskstore.core.serializer.JacksonSerializer;
import io.taskstore.spi.DataStore;
import io.taskstore.spi.EventHub;
import io.taskstore.spi.JobStore;
import io.taskstore.spi.ScheduleStore;
import io.taskstore.spi.Serializer;

/**
 * Binds a {@link DataStore} backed by the database described by the
 * {@code database.*} and {@code store.*} keys of the given config.
 */
public class TaskStoreModule
        implements Module
{
    private final Config systemConfig;

    public TaskStoreModule(Config systemConfig)
    {
        this.systemConfig = systemConfig;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.install(new DatabaseModule());

        binder.bind(Config.class).toInstance(systemConfig);
        binder.bind(ObjectMapper.class).toInstance(ObjectMappers.objectMapper());
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(Clock.class).toInstance(Clock.systemUTC());
        binder.bind(Serializer.class).to(JacksonSerializer.class).in(Scopes.SINGLETON);
        binder.bind(EventHub.class).to(LocalEventHub.class).in(Scopes.SINGLETON);
        binder.bind(EventPublisher.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseDataStore.class).in(Scopes.SINGLETON);
        binder.bind(DataStore.class).to(DatabaseDataStore.class);
        binder.bind(ScheduleStore.class).to(DatabaseDataStore.class);
        binder.bind(JobStore.class).to(DatabaseDataStore.class);
    }
}
