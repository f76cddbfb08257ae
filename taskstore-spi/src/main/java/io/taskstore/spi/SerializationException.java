package io.taskstore.spi;

public class SerializationException
        extends RuntimeException
{
    public SerializationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
