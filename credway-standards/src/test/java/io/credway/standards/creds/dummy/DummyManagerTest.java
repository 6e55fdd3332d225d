package io.credway.standards.creds.dummy;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.credway.spi.CredentialManager;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.spi.config.ConfigFactory;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class DummyManagerTest
{
    private final ConfigFactory configFactory = new ConfigFactory(ConfigFactory.objectMapper());

    private Secrets secrets(CredentialManager manager)
    {
        manager.init();
        manager.validate();
        return manager.newSecretsFactory().newSecrets();
    }

    private static Optional<Object> lookup(Secrets secrets, String team, String pipeline, String name)
    {
        for (SecretLookupPath path : secrets.newSecretLookupPaths(team, pipeline, false)) {
            Optional<SecretValue> value = secrets.get(path.variableToSecretPath(name));
            if (value.isPresent()) {
                return Optional.of(value.get().getValue());
            }
        }
        return Optional.absent();
    }

    @Test
    public void notConfiguredWithoutVars()
    {
        assertThat(new DummyManagerFactory().newManager(configFactory.create()).isConfigured(), is(false));
    }

    @Test
    public void resolvesMostSpecificVar()
    {
        CredentialManager manager = new DummyManagerFactory().newManager(configFactory.create()
                .set("vars", "{\"token\":\"global\",\"main/token\":\"team\",\"main/deploy/token\":\"pipeline\"}"));

        Secrets secrets = secrets(manager);

        assertThat(lookup(secrets, "main", "deploy", "token").get(), is("pipeline"));
        assertThat(lookup(secrets, "main", "build", "token").get(), is("team"));
        assertThat(lookup(secrets, "other", "", "token").get(), is("global"));
        assertThat(lookup(secrets, "main", "deploy", "missing").isPresent(), is(false));
    }

    @Test
    public void readsFlatVarKeys()
    {
        CredentialManager manager = new DummyManagerFactory().newManager(configFactory.create()
                .set("vars.main/db", ImmutableMap.of("username", "admin")));

        assertThat(manager.isConfigured(), is(true));
        Object value = lookup(secrets(manager), "main", "", "db").get();
        assertThat(value, is((Object) ImmutableMap.of("username", "admin")));
    }

    @Test
    public void configHidesValues()
    {
        CredentialManager manager = new DummyManagerFactory().newManager(configFactory.create()
                .set("vars.token", "s3cr3t"));

        assertThat(manager.getConfig().toString().contains("s3cr3t"), is(false));
        assertThat(manager.health().getMethod(), is("noop"));
    }
}
