package io.credway.aws.creds.ssm;

import io.credway.aws.creds.AwsCredentialsConfig;
import io.credway.spi.CredentialManager;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;

public class AwsSsmManagerFactory
        implements CredentialManagerFactory
{
    public static final String TYPE = "aws_ssm";

    @Override
    public String getType()
    {
        return TYPE;
    }

    @Override
    public CredentialManager newManager(Config config)
    {
        return new AwsSsmManager(AwsCredentialsConfig.convertFrom(config));
    }
}
