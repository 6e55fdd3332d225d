package io.credway.aws;

import com.google.common.collect.ImmutableSet;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.credway.core.creds.CredentialManagerRegistry;
import io.credway.core.creds.CredentialsExtensionLoader;
import io.credway.core.creds.CredentialsModule;
import io.credway.spi.config.ConfigFactory;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class AwsCredentialsExtensionTest
{
    @Test
    public void registersAwsBackends()
    {
        ConfigFactory configFactory = new ConfigFactory(ConfigFactory.objectMapper());
        Injector injector = Guice.createInjector(
                new CredentialsModule(configFactory.create()),
                new CredentialsExtensionLoader());

        CredentialManagerRegistry registry = injector.getInstance(CredentialManagerRegistry.class);

        assertThat(registry.getTypes(), is(ImmutableSet.of("aws_secretsmanager", "aws_ssm")));
    }
}
