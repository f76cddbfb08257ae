package io.taskstore.core.database.schema;

public class SchemaContext
{
    private final boolean postgres;
    private final String schema;

    public SchemaContext(boolean postgres, String schema)
    {
        this.postgres = postgres;
        this.schema = schema;
    }

    public boolean isPostgres()
    {
        return postgres;
    }

    public String table(String name)
    {
        return schema + "." + name;
    }

    public CreateTableBuilder newCreateTableBuilder(String tableName)
    {
        return new CreateTableBuilder(postgres, tableName, table(tableName));
    }
}
