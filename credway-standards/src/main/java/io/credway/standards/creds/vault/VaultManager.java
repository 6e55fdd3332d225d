package io.credway.standards.creds.vault;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import io.credway.spi.CredentialManager;
import io.credway.spi.HealthResponse;
import io.credway.spi.SecretsFactory;
import io.credway.spi.config.ConfigException;
import io.credway.util.SecretTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class VaultManager
        implements CredentialManager
{
    private static final Logger logger = LoggerFactory.getLogger(VaultManager.class);

    static final String HEALTH_METHOD = "/v1/sys/health";

    private final VaultConfig config;
    private final ObjectMapper mapper;

    private APIClient client;
    private ReAuther reAuther;

    public VaultManager(VaultConfig config, ObjectMapper mapper)
    {
        this.config = config;
        this.mapper = mapper;
    }

    @Override
    public String getName()
    {
        return VaultManagerFactory.TYPE;
    }

    @Override
    public VaultConfig getConfig()
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
        client = new APIClient(config, mapper);
    }

    @Override
    public void validate()
    {
        if (!config.getUrl().isPresent()) {
            throw new ConfigException("must configure vault url");
        }
        try {
            URI uri = new URI(config.getUrl().get());
            if ((!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) || uri.getHost() == null) {
                throw new ConfigException("invalid vault url: " + config.getUrl().get());
            }
        }
        catch (URISyntaxException ex) {
            throw new ConfigException("invalid vault url: " + config.getUrl().get(), ex);
        }

        VaultAuthConfig auth = config.getAuth();
        if (auth.getClientToken().isPresent() && auth.getBackend().isPresent()) {
            throw new ConfigException("cannot use both client token and auth backend");
        }
        if (!auth.getClientToken().isPresent() && !auth.getBackend().isPresent()) {
            throw new ConfigException("must configure client token or auth backend");
        }

        VaultTlsConfig tls = config.getTls();
        if ("cert".equals(auth.getBackend().orNull())
                && !(tls.getClientCert().isPresent() && tls.getClientKey().isPresent())) {
            throw new ConfigException("must provide client_cert and client_key when using cert auth backend");
        }
        if (tls.getClientCert().isPresent() != tls.getClientKey().isPresent()) {
            throw new ConfigException("client_cert and client_key must be configured together");
        }

        if (auth.getRetryInitial().isNegative() || auth.getRetryInitial().isZero()) {
            throw new ConfigException("auth retry_initial must be positive");
        }
        if (auth.getRetryMax().compareTo(auth.getRetryInitial()) < 0) {
            throw new ConfigException("auth retry_max must not be shorter than retry_initial");
        }

        lookupTemplates();
    }

    private List<SecretTemplate> lookupTemplates()
    {
        ImmutableList.Builder<SecretTemplate> templates = ImmutableList.builder();
        int i = 0;
        for (String source : config.getLookupTemplates()) {
            templates.add(SecretTemplate.build("lookup-template-" + i++, Vault.joinPath(config.getPathPrefix(), source)));
        }
        return templates.build();
    }

    @Override
    public synchronized SecretsFactory newSecretsFactory()
    {
        if (client == null) {
            throw new IllegalStateException("vault manager is not initialized");
        }
        if (reAuther == null) {
            VaultAuthConfig auth = config.getAuth();
            reAuther = new ReAuther(client, auth.getBackendMaxTtl(), auth.getRetryInitial(), auth.getRetryMax());
            reAuther.start();
        }
        return new VaultFactory(client, reAuther, config.getLoginTimeout(),
                config.getPathPrefix(), lookupTemplates(), config.getSharedPath());
    }

    @Override
    public HealthResponse health()
    {
        if (client == null) {
            return HealthResponse.failed(HEALTH_METHOD, "vault client is not initialized");
        }
        try {
            return HealthResponse.ok(HEALTH_METHOD, client.health());
        }
        catch (RuntimeException ex) {
            logger.warn("Vault health check failed", ex);
            return HealthResponse.failed(HEALTH_METHOD, ex.getMessage());
        }
    }

    @Override
    public synchronized void close()
    {
        if (reAuther != null) {
            reAuther.close();
            reAuther = null;
        }
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
