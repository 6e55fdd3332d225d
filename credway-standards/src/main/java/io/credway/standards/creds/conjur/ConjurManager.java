package io.credway.standards.creds.conjur;

import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.credway.spi.CredentialManager;
import io.credway.spi.HealthResponse;
import io.credway.spi.SecretsFactory;
import io.credway.spi.config.ConfigException;
import io.credway.util.SecretTemplate;
import org.eclipse.jetty.http.HttpStatus;

public class ConjurManager
        implements CredentialManager
{
    static final String HEALTH_METHOD = "GET /";

    private final ConjurConfig config;

    private ConjurClient client;

    public ConjurManager(ConjurConfig config)
    {
        this.config = config;
    }

    @Override
    public String getName()
    {
        return ConjurManagerFactory.TYPE;
    }

    @Override
    public ConjurConfig getConfig()
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
        client = new ConjurClient(config);
    }

    @Override
    public void validate()
    {
        if (!config.getApplianceUrl().isPresent()) {
            throw new ConfigException("must provide conjur appliance url");
        }
        if (!config.getAccount().isPresent()) {
            throw new ConfigException("must provide conjur account");
        }
        if (config.getAuthnApiKey().isPresent() && config.getAuthnTokenFile().isPresent()) {
            throw new ConfigException("must provide only one of conjur api key or token file");
        }
        boolean apiKeyAuth = config.getAuthnLogin().isPresent() && config.getAuthnApiKey().isPresent();
        if (!apiKeyAuth && !config.getAuthnTokenFile().isPresent()) {
            throw new ConfigException("must provide conjur login and api key, or token file");
        }
        templates();
    }

    private List<SecretTemplate> templates()
    {
        return ImmutableList.of(
                SecretTemplate.build("pipeline-secret-template", config.getPipelineSecretTemplate()),
                SecretTemplate.build("team-secret-template", config.getTeamSecretTemplate()),
                SecretTemplate.build("secret-template", config.getSecretTemplate()));
    }

    @Override
    public SecretsFactory newSecretsFactory()
    {
        if (client == null) {
            throw new IllegalStateException("conjur manager is not initialized");
        }
        List<SecretTemplate> templates = templates();
        ConjurClient c = client;
        return () -> new ConjurSecrets(c, templates);
    }

    @Override
    public HealthResponse health()
    {
        if (client == null) {
            return HealthResponse.failed(HEALTH_METHOD, "conjur client is not initialized");
        }
        try {
            int status = client.ping();
            if (HttpStatus.isServerError(status)) {
                return HealthResponse.failed(HEALTH_METHOD, "conjur returned HTTP " + status);
            }
            return HealthResponse.ok(HEALTH_METHOD, ImmutableMap.of("status", status));
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
