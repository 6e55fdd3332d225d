package io.credway.standards.creds.kubernetes;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import com.google.common.base.Optional;
import io.credway.spi.SecretBackendException;
import io.credway.spi.TransientBackendException;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

public class DefaultKubernetesClient
        implements KubernetesClient
{
    private static final Logger logger = LoggerFactory.getLogger(DefaultKubernetesClient.class);

    private final io.fabric8.kubernetes.client.KubernetesClient client;

    public DefaultKubernetesClient(final io.fabric8.kubernetes.client.KubernetesClient client)
    {
        this.client = client;
    }

    @Override
    public Optional<Map<String, String>> getSecretData(final String namespace, final String name)
    {
        final Secret secret;
        try {
            secret = client.secrets().inNamespace(namespace).withName(name).get();
        }
        catch (KubernetesClientException e) {
            throw translate("Failed to get secret " + namespace + "/" + name, e);
        }
        if (secret == null) {
            return Optional.absent();
        }

        Map<String, String> data = new LinkedHashMap<>();
        if (secret.getData() != null) {
            for (Map.Entry<String, String> entry : secret.getData().entrySet()) {
                data.put(entry.getKey(), new String(Base64.getDecoder().decode(entry.getValue()), UTF_8));
            }
        }
        if (secret.getStringData() != null) {
            data.putAll(secret.getStringData());
        }
        return Optional.of(data);
    }

    @Override
    public String getServerVersion()
    {
        try {
            return client.getVersion().getGitVersion();
        }
        catch (KubernetesClientException e) {
            throw translate("Failed to get kubernetes server version", e);
        }
    }

    static SecretBackendException translate(String message, KubernetesClientException e)
    {
        int code = e.getCode();
        // no status code when the request did not get a response
        if (code <= 0 || code == 408 || code == 429 || code >= 500) {
            return new TransientBackendException(message + ": " + e.getMessage(), e);
        }
        return new SecretBackendException(message + ": " + e.getMessage(), e);
    }

    @Override
    public void close()
    {
        try {
            client.close();
        }
        catch (RuntimeException e) {
            logger.warn("Failed to close kubernetes client", e);
        }
    }
}
