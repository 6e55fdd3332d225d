package io.credway.aws;

import java.util.Arrays;
import java.util.List;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.credway.aws.creds.secretsmanager.AwsSecretsManagerFactory;
import io.credway.aws.creds.ssm.AwsSsmManagerFactory;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.Extension;

public class AwsCredentialsExtension
        implements Extension
{
    @Override
    public List<Module> getModules()
    {
        return Arrays.asList(new AwsCredentialsModule());
    }

    public static class AwsCredentialsModule
            implements Module
    {
        @Override
        public void configure(Binder binder)
        {
            Multibinder<CredentialManagerFactory> factories = Multibinder.newSetBinder(binder, CredentialManagerFactory.class);
            factories.addBinding().to(AwsSecretsManagerFactory.class).in(Scopes.SINGLETON);
            factories.addBinding().to(AwsSsmManagerFactory.class).in(Scopes.SINGLETON);
        }
    }
}
