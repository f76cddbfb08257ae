package io.taskstore.client.config;

import java.util.List;
import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.annotation.JacksonInject;

import static java.util.Locale.ENGLISH;

/**
 * Flat JSON object used both for store settings and for the arguments
 * carried by schedules and jobs. Values are converted through the
 * injected {@link ObjectMapper} on every read and write.
 */
public class Config
{
    private final ObjectMapper mapper;
    private final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new ConfigException("Expected object but got " + object);
        }
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    // JsonNode instead of ObjectNode: jackson-databind#941
    @JsonCreator
    static Config fromJson(@JacksonInject ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new RuntimeJsonMappingException("Expected object but got " + object);
        }
        return new Config(mapper, object);
    }

    @JsonValue
    ObjectNode toJson()
    {
        return object;
    }

    /**
     * Stores {@code value} under {@code key}. A null value removes the key.
     */
    public Config set(String key, Object value)
    {
        if (value == null) {
            object.remove(key);
        }
        else {
            try {
                object.set(key, mapper.valueToTree(value));
            }
            catch (IllegalArgumentException ex) {
                throw new ConfigException("Can't store value of key '" + key + "' as JSON", ex);
            }
        }
        return this;
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    public <E> E get(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        else if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return readValue(key, value, mapper.getTypeFactory().constructType(type));
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readValue(key, value, mapper.getTypeFactory().constructType(type));
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        return Optional.fromNullable(get(key, type, null));
    }

    @SuppressWarnings("unchecked")
    private <E> E readValue(String key, JsonNode value, JavaType type)
    {
        try {
            return (E) mapper.readValue(value.traverse(), type);
        }
        catch (Exception ex) {
            Throwables.throwIfInstanceOf(ex, ConfigException.class);
            String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                    describe(type), key, abbreviate(value), value.getNodeType().toString().toLowerCase(ENGLISH));
            throw new ConfigException(message, ex);
        }
    }

    private static String describe(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (raw.equals(String.class)) {
            return "string type";
        }
        else if (raw.equals(int.class) || raw.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (raw.equals(long.class) || raw.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (raw.equals(boolean.class) || raw.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        else if (List.class.isAssignableFrom(raw)) {
            return "array type";
        }
        return type.toString();
    }

    private static String abbreviate(JsonNode value)
    {
        String json = value.toString();
        return json.length() < 100 ? json : json.substring(0, 97) + "...";
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof Config && object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
