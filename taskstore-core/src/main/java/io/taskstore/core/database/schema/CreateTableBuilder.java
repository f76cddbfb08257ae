package io.taskstore.core.database.schema;

import java.util.ArrayList;
import java.util.List;
import com.google.common.collect.ImmutableList;

/**
 * Collects the columns and indexes of one store table and renders them as
 * PostgreSQL or H2 statements. Every statement is guarded with IF NOT EXISTS
 * so setup can finish a schema that a previous run left half created.
 */
public class CreateTableBuilder
{
    public enum ColumnType
    {
        UUID("uuid", "uuid"),
        STRING("text", "varchar(255)"),
        STRING_ARRAY("text[]", "varchar array"),
        BINARY("bytea", "blob"),
        TIMESTAMP("timestamp with time zone", "timestamp with time zone");

        private final String postgresName;
        private final String h2Name;

        ColumnType(String postgresName, String h2Name)
        {
            this.postgresName = postgresName;
            this.h2Name = h2Name;
        }
    }

    private final boolean postgres;
    private final String tableName;
    private final String qualifiedName;
    private final List<String> columns = new ArrayList<>();
    private final List<String> indexes = new ArrayList<>();
    private int fillFactor = 0;

    CreateTableBuilder(boolean postgres, String tableName, String qualifiedName)
    {
        this.postgres = postgres;
        this.tableName = tableName;
        this.qualifiedName = qualifiedName;
    }

    public CreateTableBuilder column(String name, ColumnType type, String constraints)
    {
        String sqlType = postgres ? type.postgresName : type.h2Name;
        columns.add(constraints.isEmpty() ? name + " " + sqlType : name + " " + sqlType + " " + constraints);
        return this;
    }

    public CreateTableBuilder index(String column)
    {
        indexes.add("create index if not exists " + tableName + "_" + column + "_idx on " + qualifiedName + " (" + column + ")");
        return this;
    }

    /**
     * Adds a GIN index for array containment queries. Skipped on H2.
     */
    public CreateTableBuilder arrayIndex(String column)
    {
        if (postgres) {
            indexes.add("create index if not exists " + tableName + "_" + column + "_idx on " + qualifiedName + " using gin (" + column + ")");
        }
        return this;
    }

    /**
     * Leaves free space in each page for in-place updates. PostgreSQL only.
     */
    public CreateTableBuilder fillFactor(int percent)
    {
        this.fillFactor = percent;
        return this;
    }

    public List<String> build()
    {
        StringBuilder sb = new StringBuilder();
        sb.append("create table if not exists ").append(qualifiedName).append(" (\n  ");
        sb.append(String.join(",\n  ", columns));
        sb.append("\n)");
        if (postgres && fillFactor > 0) {
            sb.append(" with (fillfactor = ").append(fillFactor).append(")");
        }
        return ImmutableList.<String>builder()
            .add(sb.toString())
            .addAll(indexes)
            .build();
    }
}
