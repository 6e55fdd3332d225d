package io.credway.standards.creds.kubernetes;

import com.google.inject.Inject;
import io.credway.spi.CredentialManager;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;

public class KubernetesManagerFactory
        implements CredentialManagerFactory
{
    public static final String TYPE = "kubernetes";

    private final KubernetesClientFactory clientFactory;

    @Inject
    public KubernetesManagerFactory(KubernetesClientFactory clientFactory)
    {
        this.clientFactory = clientFactory;
    }

    @Override
    public String getType()
    {
        return TYPE;
    }

    @Override
    public CredentialManager newManager(Config config)
    {
        return new KubernetesManager(KubernetesConfig.convertFrom(config), clientFactory);
    }
}
