package io.credway.standards.creds.vault;

import com.google.common.base.Optional;

/**
 * Authentication state published by {@link APIClient}. Instances are immutable;
 * a new login or token installation publishes a new instance.
 */
final class VaultClient
{
    static final VaultClient UNAUTHENTICATED = new VaultClient(Optional.absent());

    private final Optional<String> token;

    private VaultClient(Optional<String> token)
    {
        this.token = token;
    }

    static VaultClient withToken(String token)
    {
        return new VaultClient(Optional.of(token));
    }

    Optional<String> getToken()
    {
        return token;
    }

    boolean isAuthenticated()
    {
        return token.isPresent();
    }
}
