package io.taskstore.client.config;

import java.io.IOException;
import java.util.Properties;
import javax.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    public Config fromJsonString(String json)
    {
        try {
            return new Config(objectMapper, objectMapper.readTree(json));
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
    }

    /**
     * Builds a flat config whose keys are property names, such as
     * {@code database.type} or {@code store.schema}.
     */
    public Config fromProperties(Properties props)
    {
        Config config = create();
        for (String key : props.stringPropertyNames()) {
            config.set(key, props.getProperty(key));
        }
        return config;
    }
}
