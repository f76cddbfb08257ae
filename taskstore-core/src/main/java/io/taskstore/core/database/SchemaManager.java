package io.taskstore.core.database;

import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.taskstore.core.database.schema.SchemaContext;
import io.taskstore.core.database.schema.SchemaVersionException;

import static io.taskstore.core.database.schema.CreateTableBuilder.ColumnType.BINARY;
import static io.taskstore.core.database.schema.CreateTableBuilder.ColumnType.STRING;
import static io.taskstore.core.database.schema.CreateTableBuilder.ColumnType.STRING_ARRAY;
import static io.taskstore.core.database.schema.CreateTableBuilder.ColumnType.TIMESTAMP;
import static io.taskstore.core.database.schema.CreateTableBuilder.ColumnType.UUID;

/**
 * Creates the metadata, schedules and jobs tables on first use and refuses
 * schemas written by a newer version.
 */
public class SchemaManager
{
    private static final Logger logger = LoggerFactory.getLogger(SchemaManager.class);

    public static final int SCHEMA_VERSION = 1;

    private final TransactionManager tm;
    private final DataStoreConfig storeConfig;
    private final SchemaContext context;

    @Inject
    public SchemaManager(TransactionManager tm, DatabaseConfig databaseConfig, DataStoreConfig storeConfig)
    {
        this.tm = tm;
        this.storeConfig = storeConfig;
        this.context = new SchemaContext(DatabaseConfig.isPostgres(databaseConfig.getType()), storeConfig.getSchema());
    }

    public void setup()
    {
        tm.begin(() -> {
            setup(tm.getHandle());
            return null;
        });
    }

    private void setup(Handle handle)
    {
        handle.execute("create schema if not exists " + storeConfig.getSchema());

        if (storeConfig.getStartFromScratch()) {
            logger.info("Dropping tables of schema {}", storeConfig.getSchema());
            handle.execute("drop table if exists " + context.table("schedules"));
            handle.execute("drop table if exists " + context.table("jobs"));
            handle.execute("drop table if exists " + context.table("metadata"));
        }

        handle.execute("create table if not exists " + context.table("metadata") + " (schema_version int not null)");
        if (context.isPostgres()) {
            // serializes concurrent setup by other processes until commit
            handle.execute("lock table " + context.table("metadata") + " in exclusive mode");
        }

        Integer version = handle.createQuery("select schema_version from " + context.table("metadata"))
            .mapTo(Integer.class)
            .findFirst()
            .orElse(null);

        if (version == null) {
            handle.createUpdate("insert into " + context.table("metadata") + " (schema_version) values (:version)")
                .bind("version", SCHEMA_VERSION)
                .execute();
            createTables(handle);
            logger.info("Created tables in schema {} (version {})", storeConfig.getSchema(), SCHEMA_VERSION);
        }
        else if (version > SCHEMA_VERSION) {
            throw new SchemaVersionException(version, SCHEMA_VERSION);
        }
        else {
            logger.debug("Schema {} is at version {}", storeConfig.getSchema(), version);
        }
    }

    private void createTables(Handle handle)
    {
        List<String> statements = ImmutableList.<String>builder()
            .addAll(context.newCreateTableBuilder("schedules")
                    .column("id", STRING, "primary key")
                    .column("task_id", STRING, "not null")
                    .column("serialized_data", BINARY, "not null")
                    .column("next_fire_time", TIMESTAMP, "")
                    .column("acquired_by", STRING, "")
                    .column("acquired_until", TIMESTAMP, "")
                    .fillFactor(80)
                    .index("next_fire_time")
                    .build())
            .addAll(context.newCreateTableBuilder("jobs")
                    .column("id", UUID, "primary key")
                    .column("task_id", STRING, "not null")
                    .column("tags", STRING_ARRAY, "not null")
                    .column("serialized_data", BINARY, "not null")
                    .column("created_at", TIMESTAMP, "not null")
                    .column("acquired_by", STRING, "")
                    .column("acquired_until", TIMESTAMP, "")
                    .fillFactor(80)
                    .index("task_id")
                    .arrayIndex("tags")
                    .build())
            .build();
        for (String sql : statements) {
            handle.execute(sql);
        }
    }
}
