package io.credway.standards.creds.vault;

/**
 * Login or token renewal failed. Handled by {@link ReAuther}, never thrown to secret readers.
 */
public class AuthException
        extends Exception
{
    public AuthException(String message)
    {
        super(message);
    }

    public AuthException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
