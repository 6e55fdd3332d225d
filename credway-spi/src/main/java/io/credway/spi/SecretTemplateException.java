package io.credway.spi;

import io.credway.spi.config.ConfigException;

public class SecretTemplateException
        extends ConfigException
{
    public SecretTemplateException(String message)
    {
        super(message);
    }
}
