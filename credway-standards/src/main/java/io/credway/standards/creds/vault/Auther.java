package io.credway.standards.creds.vault;

import java.time.Duration;

/**
 * Obtains and extends an authentication token.
 * Both operations return the lease of the token. A zero lease means the token does not expire.
 */
public interface Auther
{
    Duration login()
        throws AuthException;

    /**
     * @throws NonRenewableLeaseException if the server will never renew the current token
     */
    Duration renew()
        throws AuthException;
}
