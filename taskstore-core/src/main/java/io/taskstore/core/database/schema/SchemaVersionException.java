package io.taskstore.core.database.schema;

public class SchemaVersionException
        extends RuntimeException
{
    private final int foundVersion;
    private final int supportedVersion;

    public SchemaVersionException(int foundVersion, int supportedVersion)
    {
        super("Unexpected schema version " + foundVersion + "; only version " + supportedVersion + " is supported");
        this.foundVersion = foundVersion;
        this.supportedVersion = supportedVersion;
    }

    public int getFoundVersion()
    {
        return foundVersion;
    }

    public int getSupportedVersion()
    {
        return supportedVersion;
    }
}
