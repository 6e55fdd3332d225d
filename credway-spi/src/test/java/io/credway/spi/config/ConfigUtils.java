package io.credway.spi.config;

public class ConfigUtils
{
    private ConfigUtils()
    { }

    public static final ConfigFactory configFactory = new ConfigFactory(ConfigFactory.objectMapper());

    public static Config newConfig()
    {
        return configFactory.create();
    }
}
