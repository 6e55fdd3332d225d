package io.credway.core.creds;

import com.google.common.collect.ImmutableSet;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.credway.spi.CredentialManager;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigFactory;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.mockito.Mockito.mock;

public class CredentialsModuleTest
{
    public static class StubFactory
            implements CredentialManagerFactory
    {
        @Override
        public String getType()
        {
            return "stub";
        }

        @Override
        public CredentialManager newManager(Config config)
        {
            return mock(CredentialManager.class);
        }
    }

    private final Config systemConfig = new ConfigFactory(ConfigFactory.objectMapper()).create();

    @Test
    public void registryWithoutExtensions()
    {
        Injector injector = Guice.createInjector(
                new CredentialsModule(systemConfig),
                new CredentialsExtensionLoader());
        assertThat(injector.getInstance(CredentialManagerRegistry.class).getTypes(), is(ImmutableSet.of()));
        assertThat(injector.getInstance(CredentialManagement.class),
                sameInstance(injector.getInstance(CredentialManagement.class)));
    }

    @Test
    public void factoriesBoundByModulesAreRegistered()
    {
        Injector injector = Guice.createInjector(
                new CredentialsModule(systemConfig),
                binder -> Multibinder.newSetBinder(binder, CredentialManagerFactory.class)
                    .addBinding().to(StubFactory.class).in(Scopes.SINGLETON));
        assertThat(injector.getInstance(CredentialManagerRegistry.class).getTypes(), is(ImmutableSet.of("stub")));
    }
}
