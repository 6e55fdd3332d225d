package io.credway.standards.creds.vault;

public class NonRenewableLeaseException
        extends AuthException
{
    public NonRenewableLeaseException(String message)
    {
        super(message);
    }
}
