package io.credway.standards.creds.kubernetes;

import java.util.Map;
import com.google.common.base.Optional;

public interface KubernetesClient
        extends AutoCloseable
{
    /**
     * Returns the decoded data of a secret, or absent if the secret does not exist.
     */
    Optional<Map<String, String>> getSecretData(String namespace, String name);

    String getServerVersion();

    @Override
    void close();
}
