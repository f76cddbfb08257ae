package io.taskstore.core.database;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.sql.DataSource;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import com.google.inject.name.Names;
import io.taskstore.client.config.Config;

public class DatabaseModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(TransactionManager.class).to(ThreadLocalTransactionManager.class).in(Scopes.SINGLETON);
        binder.bind(SchemaManager.class).in(Scopes.SINGLETON);
        binder.bind(NotificationSource.class).to(PgNotificationSource.class).in(Scopes.SINGLETON);
        binder.bind(NotificationSender.class).in(Scopes.SINGLETON);
        binder.bind(ExecutorService.class)
            .annotatedWith(Names.named(DataStoreLifecycle.LISTENER_EXECUTOR))
            .toProvider(ListenerExecutorProvider.class)
            .in(Scopes.SINGLETON);
        binder.bind(DataStoreLifecycle.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseScheduleStoreManager.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseJobStoreManager.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    public DatabaseConfig provideDatabaseConfig(Config systemConfig)
    {
        return DatabaseConfig.convertFrom(systemConfig);
    }

    @Provides
    @Singleton
    public DataStoreConfig provideDataStoreConfig(Config systemConfig)
    {
        return DataStoreConfig.convertFrom(systemConfig);
    }

    public static class ListenerExecutorProvider
            implements Provider<ExecutorService>
    {
        @Override
        public ExecutorService get()
        {
            return Executors.newCachedThreadPool(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("notification-listener-%d")
                    .build()
                    );
        }
    }
}
