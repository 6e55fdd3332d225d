package io.credway.standards.creds.kubernetes;

import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.credway.spi.SecretBackendException;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.util.SecretLookupWithPrefix;

/**
 * Secrets stored as Kubernetes secrets in one namespace per team.
 *
 * Secret paths have the form {@code <namespace>:<secret name>}. Pipeline scoped secrets
 * are named {@code <pipeline>.<variable>}.
 */
public class KubernetesSecrets
        implements Secrets
{
    private final KubernetesClient client;
    private final String namespacePrefix;

    public KubernetesSecrets(KubernetesClient client, String namespacePrefix)
    {
        this.client = client;
        this.namespacePrefix = namespacePrefix;
    }

    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        String namespace = namespacePrefix + team;
        ImmutableList.Builder<SecretLookupPath> paths = ImmutableList.builder();
        if (!Strings.isNullOrEmpty(pipeline)) {
            paths.add(new SecretLookupWithPrefix(namespace + ":" + pipeline + "."));
        }
        paths.add(new SecretLookupWithPrefix(namespace + ":"));
        return paths.build();
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        int separator = secretPath.indexOf(':');
        if (separator <= 0 || separator == secretPath.length() - 1) {
            throw new SecretBackendException("Invalid kubernetes secret path, expected <namespace>:<name>: " + secretPath);
        }
        String namespace = secretPath.substring(0, separator);
        String name = secretPath.substring(separator + 1);

        Optional<Map<String, String>> data = client.getSecretData(namespace, name);
        if (!data.isPresent()) {
            return Optional.absent();
        }
        if (data.get().containsKey("value")) {
            return Optional.of(SecretValue.of(data.get().get("value")));
        }
        return Optional.of(SecretValue.of(ImmutableMap.<String, Object>copyOf(data.get())));
    }
}
