package io.taskstore.core.serializer;

import java.io.IOException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import io.taskstore.spi.SerializationException;
import io.taskstore.spi.Serializer;

/**
 * Stores schedules and jobs as UTF-8 JSON documents.
 */
public class JacksonSerializer
        implements Serializer
{
    private final ObjectMapper mapper;

    @Inject
    public JacksonSerializer(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    @Override
    public byte[] serialize(Object object)
    {
        try {
            return mapper.writeValueAsBytes(object);
        }
        catch (JsonProcessingException ex) {
            throw new SerializationException("Failed to serialize " + object.getClass().getSimpleName(), ex);
        }
    }

    @Override
    public <T> T deserialize(byte[] data, Class<T> type)
    {
        try {
            return mapper.readValue(data, type);
        }
        catch (IOException | RuntimeException ex) {
            throw new SerializationException("Failed to deserialize " + type.getSimpleName(), ex);
        }
    }
}
