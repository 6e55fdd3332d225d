package io.credway.aws.creds.secretsmanager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import io.credway.aws.creds.AwsCredentialsConfig;
import io.credway.spi.CredentialManager;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;

public class AwsSecretsManagerFactory
        implements CredentialManagerFactory
{
    public static final String TYPE = "aws_secretsmanager";

    private final ObjectMapper mapper;

    @Inject
    public AwsSecretsManagerFactory(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    @Override
    public String getType()
    {
        return TYPE;
    }

    @Override
    public CredentialManager newManager(Config config)
    {
        return new AwsSecretsManager(AwsCredentialsConfig.convertFrom(config), mapper);
    }
}
