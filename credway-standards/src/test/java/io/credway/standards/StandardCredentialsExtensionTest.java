package io.credway.standards;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.credway.core.creds.CredentialManagement;
import io.credway.core.creds.CredentialManagerRegistry;
import io.credway.core.creds.CredentialsExtensionLoader;
import io.credway.core.creds.CredentialsModule;
import io.credway.core.creds.SecretVariables;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigFactory;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class StandardCredentialsExtensionTest
{
    private final ConfigFactory configFactory = new ConfigFactory(ConfigFactory.objectMapper());

    private Injector injector(Config systemConfig)
    {
        return Guice.createInjector(
                new CredentialsModule(systemConfig),
                new CredentialsExtensionLoader());
    }

    @Test
    public void registersStandardBackends()
    {
        CredentialManagerRegistry registry = injector(configFactory.create()).getInstance(CredentialManagerRegistry.class);

        assertThat(registry.getTypes(), is(ImmutableSet.of("conjur", "dummy", "kubernetes", "vault")));
    }

    @Test
    public void resolvesDummyVarsThroughManagement()
    {
        Config systemConfig = configFactory.create()
            .set("credentials.dummy.vars.main/token", "team-token")
            .set("credentials.cache.enabled", true);

        try (CredentialManagement management = injector(systemConfig).getInstance(CredentialManagement.class)) {
            management.start();
            SecretVariables vars = new SecretVariables(management.getSecrets(), "main", "deploy", false);

            assertThat(vars.get("token"), is(Optional.<Object>of("team-token")));
            assertThat(vars.get("missing").isPresent(), is(false));
            assertThat(management.health().getMethod(), is("noop"));
        }
    }
}
