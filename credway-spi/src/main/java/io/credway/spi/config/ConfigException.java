package io.credway.spi.config;

/**
 * Raised when credential manager configuration is missing, malformed or
 * inconsistent. Configuration errors are fatal at startup.
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
