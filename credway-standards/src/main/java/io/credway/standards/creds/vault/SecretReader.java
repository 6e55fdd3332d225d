package io.credway.standards.creds.vault;

import com.google.common.base.Optional;

public interface SecretReader
{
    /**
     * @return the secret, or absent when nothing is stored at the path
     * @throws io.credway.spi.SecretBackendException if the read failed
     */
    Optional<VaultSecret> read(String path);
}
