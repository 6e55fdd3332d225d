package io.credway.standards.creds.kubernetes;

import com.google.common.collect.ImmutableMap;
import io.credway.spi.CredentialManager;
import io.credway.spi.HealthResponse;
import io.credway.spi.SecretsFactory;
import io.credway.spi.config.ConfigException;

public class KubernetesManager
        implements CredentialManager
{
    static final String HEALTH_METHOD = "/version";

    private final KubernetesConfig config;
    private final KubernetesClientFactory clientFactory;

    private KubernetesClient client;

    public KubernetesManager(KubernetesConfig config, KubernetesClientFactory clientFactory)
    {
        this.config = config;
        this.clientFactory = clientFactory;
    }

    @Override
    public String getName()
    {
        return KubernetesManagerFactory.TYPE;
    }

    @Override
    public KubernetesConfig getConfig()
    {
        return config;
    }

    @Override
    public boolean isConfigured()
    {
        return config.isConfigured();
    }

    @Override
    public void init()
    {
        client = clientFactory.newClient(config);
    }

    @Override
    public void validate()
    {
        if (config.getInCluster() && config.getConfigPath().isPresent()) {
            throw new ConfigException("only one of in_cluster or config_path may be configured");
        }
        if (!config.getInCluster() && !config.getConfigPath().isPresent()) {
            throw new ConfigException("must configure in_cluster or config_path");
        }
    }

    @Override
    public SecretsFactory newSecretsFactory()
    {
        if (client == null) {
            throw new IllegalStateException("kubernetes manager is not initialized");
        }
        KubernetesClient c = client;
        return () -> new KubernetesSecrets(c, config.getNamespacePrefix());
    }

    @Override
    public HealthResponse health()
    {
        if (client == null) {
            return HealthResponse.failed(HEALTH_METHOD, "kubernetes client is not initialized");
        }
        try {
            return HealthResponse.ok(HEALTH_METHOD, ImmutableMap.of("version", client.getServerVersion()));
        }
        catch (RuntimeException ex) {
            return HealthResponse.failed(HEALTH_METHOD, ex.getMessage());
        }
    }

    @Override
    public void close()
    {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
