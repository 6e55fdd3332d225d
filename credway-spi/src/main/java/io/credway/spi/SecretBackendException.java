package io.credway.spi;

/**
 * A backend rejected a secret read, or returned data that could not be decoded.
 */
public class SecretBackendException
        extends RuntimeException
{
    public SecretBackendException(String message)
    {
        super(message);
    }

    public SecretBackendException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
