package io.credway.spi.config;

import java.io.IOException;
import java.util.Map;
import java.util.Properties;
import javax.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;

public class ConfigFactory
{
    public static ObjectMapper objectMapper()
    {
        return new ObjectMapper()
            .registerModule(new GuavaModule());
    }

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

    public Config create(Object other)
    {
        return create().set("_", other).getNested("_");
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
     * Builds a flat config from system properties style keys such as
     * {@code credentials.vault.url}. Values stay strings; typed getters
     * coerce them on read.
     */
    public Config fromProperties(Properties props)
    {
        Config config = create();
        for (String name : props.stringPropertyNames()) {
            config.set(name, props.getProperty(name));
        }
        return config;
    }

    public Config fromMap(Map<String, ?> map)
    {
        Config config = create();
        for (Map.Entry<String, ?> pair : map.entrySet()) {
            config.set(pair.getKey(), pair.getValue());
        }
        return config;
    }
}
