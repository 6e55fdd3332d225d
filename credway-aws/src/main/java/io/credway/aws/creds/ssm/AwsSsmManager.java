package io.credway.aws.creds.ssm;

import java.util.List;
import java.util.function.Function;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagement;
import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagementClientBuilder;
import com.amazonaws.services.simplesystemsmanagement.model.GetParameterRequest;
import com.amazonaws.services.simplesystemsmanagement.model.ParameterNotFoundException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import io.credway.aws.creds.AwsClients;
import io.credway.aws.creds.AwsCredentialsConfig;
import io.credway.spi.CredentialManager;
import io.credway.spi.HealthResponse;
import io.credway.spi.SecretsFactory;
import io.credway.util.SecretTemplate;

public class AwsSsmManager
        implements CredentialManager
{
    static final String HEALTH_METHOD = "GetParameter";

    // a parameter that is not expected to exist; a not-found answer proves the API is reachable
    static final String HEALTH_CHECK_PARAMETER = "__credway-health-check";

    private final AwsCredentialsConfig config;
    private final Function<AwsCredentialsConfig, AWSSimpleSystemsManagement> clientBuilder;

    private AWSSimpleSystemsManagement client;

    public AwsSsmManager(AwsCredentialsConfig config)
    {
        this(config, AwsSsmManager::buildClient);
    }

    @VisibleForTesting
    AwsSsmManager(AwsCredentialsConfig config, Function<AwsCredentialsConfig, AWSSimpleSystemsManagement> clientBuilder)
    {
        this.config = config;
        this.clientBuilder = clientBuilder;
    }

    private static AWSSimpleSystemsManagement buildClient(AwsCredentialsConfig config)
    {
        return AWSSimpleSystemsManagementClientBuilder.standard()
            .withRegion(config.getRegion().get())
            .withCredentials(AwsClients.credentialsProvider(config))
            .build();
    }

    @Override
    public String getName()
    {
        return AwsSsmManagerFactory.TYPE;
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
            throw new IllegalStateException("aws ssm manager is not initialized");
        }
        List<SecretTemplate> templates = config.compileTemplates();
        AWSSimpleSystemsManagement c = client;
        return () -> new AwsSsmSecrets(c, templates);
    }

    @Override
    public HealthResponse health()
    {
        if (client == null) {
            return HealthResponse.failed(HEALTH_METHOD, "aws ssm client is not initialized");
        }
        try {
            client.getParameter(new GetParameterRequest().withName(HEALTH_CHECK_PARAMETER));
            return HealthResponse.ok(HEALTH_METHOD, ImmutableMap.of("parameter", HEALTH_CHECK_PARAMETER));
        }
        catch (ParameterNotFoundException ex) {
            return HealthResponse.ok(HEALTH_METHOD, ImmutableMap.of("parameter", HEALTH_CHECK_PARAMETER));
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
