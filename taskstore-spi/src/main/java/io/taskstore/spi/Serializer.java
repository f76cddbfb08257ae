package io.taskstore.spi;

/**
 * Converts schedules and jobs to the opaque payload stored in the
 * {@code serialized_data} column and back.
 */
public interface Serializer
{
    byte[] serialize(Object object);

    <T> T deserialize(byte[] data, Class<T> type);
}
