package io.credway.spi;

import io.credway.spi.config.Config;

public interface CredentialManagerFactory
{
    String getType();

    /**
     * Builds a manager from the parameters under {@code credentials.<type>.}
     * with the prefix removed.
     */
    CredentialManager newManager(Config config);
}
