package io.credway.aws.creds.secretsmanager;

import java.util.List;
import java.util.function.Function;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.secretsmanager.AWSSecretsManager;
import com.amazonaws.services.secretsmanager.AWSSecretsManagerClientBuilder;
import com.amazonaws.services.secretsmanager.model.ListSecretsRequest;
import com.amazonaws.services.secretsmanager.model.ListSecretsResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import io.credway.aws.creds.AwsClients;
import io.credway.aws.creds.AwsCredentialsConfig;
import io.credway.spi.CredentialManager;
import io.credway.spi.HealthResponse;
import io.credway.spi.SecretsFactory;
import io.credway.util.SecretTemplate;

public class AwsSecretsManager
        implements CredentialManager
{
    static final String HEALTH_METHOD = "ListSecrets";

    private final AwsCredentialsConfig config;
    private final ObjectMapper mapper;
    private final Function<AwsCredentialsConfig, AWSSecretsManager> clientBuilder;

    private AWSSecretsManager client;

    public AwsSecretsManager(AwsCredentialsConfig config, ObjectMapper mapper)
    {
        this(config, mapper, AwsSecretsManager::buildClient);
    }

    @VisibleForTesting
    AwsSecretsManager(AwsCredentialsConfig config, ObjectMapper mapper, Function<AwsCredentialsConfig, AWSSecretsManager> clientBuilder)
    {
        this.config = config;
        this.mapper = mapper;
        this.clientBuilder = clientBuilder;
    }

    private static AWSSecretsManager buildClient(AwsCredentialsConfig config)
    {
        return AWSSecretsManagerClientBuilder.standard()
            .withRegion(config.getRegion().get())
            .withCredentials(AwsClients.credentialsProvider(config))
            .build();
    }

    @Override
    public String getName()
    {
        return AwsSecretsManagerFactory.TYPE;
    }

    @Override
    public AwsCredentialsConfig getConfig()
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
        client = clientBuilder.apply(config);
    }

    @Override
    public void validate()
    {
        config.validate();
    }

    @Override
    public SecretsFactory newSecretsFactory()
    {
        if (client == null) {
            throw new IllegalStateException("aws secretsmanager manager is not initialized");
        }
        List<SecretTemplate> templates = config.compileTemplates();
        AWSSecretsManager c = client;
        return () -> new AwsSecretsManagerSecrets(c, templates, mapper);
    }

    @Override
    public HealthResponse health()
    {
        if (client == null) {
            return HealthResponse.failed(HEALTH_METHOD, "aws secretsmanager client is not initialized");
        }
        try {
            ListSecretsResult result = client.listSecrets(new ListSecretsRequest().withMaxResults(1));
            return HealthResponse.ok(HEALTH_METHOD, ImmutableMap.of("secrets", result.getSecretList().size()));
        }
        catch (SdkClientException ex) {
            return HealthResponse.failed(HEALTH_METHOD, ex.getMessage());
        }
    }

    @Override
    public void close()
    {
        if (client != null) {
            client.shutdown();
            client = null;
        }
    }
}
