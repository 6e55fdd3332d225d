package io.credway.spi;

/**
 * A backend call failed for a reason that may go away on its own: network errors,
 * 5xx responses, throttling and request timeouts.
 */
public class TransientBackendException
        extends SecretBackendException
{
    public TransientBackendException(String message)
    {
        super(message);
    }

    public TransientBackendException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
