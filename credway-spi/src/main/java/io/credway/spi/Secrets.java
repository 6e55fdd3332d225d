package io.credway.spi;

import java.util.List;
import com.google.common.base.Optional;

/**
 * Read access to a secret backend.
 */
public interface Secrets
{
    /**
     * Returns the candidate lookup paths for a scope, most specific first.
     *
     * @param team team name
     * @param pipeline pipeline name, or an empty string when resolving outside of a pipeline
     * @param allowRootPath whether a root level candidate is appended as the last one
     */
    List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath);

    /**
     * Reads a secret at a resolved backend path.
     *
     * @return the secret, or {@link Optional#absent()} when the backend has nothing at the path
     * @throws TransientBackendException if the failure is worth retrying
     * @throws SecretBackendException if the backend rejected the request
     */
    Optional<SecretValue> get(String secretPath);
}
