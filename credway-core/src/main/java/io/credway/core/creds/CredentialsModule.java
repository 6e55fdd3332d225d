package io.credway.core.creds;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigFactory;

public class CredentialsModule
        implements Module
{
    private final Config systemConfig;

    public CredentialsModule(Config systemConfig)
    {
        this.systemConfig = systemConfig;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.bind(ObjectMapper.class).toInstance(ConfigFactory.objectMapper());
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(Config.class).toInstance(systemConfig);

        // declared here so that the registry can be built without any extension
        Multibinder.newSetBinder(binder, CredentialManagerFactory.class);

        binder.bind(CredentialManagerRegistry.class).in(Scopes.SINGLETON);
        binder.bind(CredentialManagement.class).in(Scopes.SINGLETON);
    }
}
