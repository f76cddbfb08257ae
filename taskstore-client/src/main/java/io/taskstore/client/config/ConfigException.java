package io.taskstore.client.config;

/**
 * Thrown when a configuration value is missing, has a wrong type or is
 * otherwise unusable.
 */
public class ConfigException
        extends RuntimeException
{
    public ConfigException(String message)
    {
        super(message);
    }

    public ConfigException(Throwable cause)
    {
        super(cause);
    }

    public ConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
