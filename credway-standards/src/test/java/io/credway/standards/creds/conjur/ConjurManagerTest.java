package io.credway.standards.creds.conjur;

import java.util.List;
import java.util.stream.Collectors;
import com.google.common.collect.ImmutableList;
import io.credway.spi.CredentialManager;
import io.credway.spi.SecretTemplateException;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigException;
import io.credway.spi.config.ConfigFactory;
import io.credway.util.SecretTemplate;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;

public class ConjurManagerTest
{
    private final ConfigFactory configFactory = new ConfigFactory(ConfigFactory.objectMapper());

    private CredentialManager manager(Config config)
    {
        return new ConjurManagerFactory().newManager(config);
    }

    private Config config()
    {
        return configFactory.create()
            .set("appliance_url", "https://conjur.example.com")
            .set("account", "myorg");
    }

    @Test
    public void configuredOnlyWithApplianceUrl()
    {
        assertThat(manager(configFactory.create().set("account", "myorg")).isConfigured(), is(false));
        assertThat(manager(config()).isConfigured(), is(true));
    }

    @Test
    public void requiresAccount()
    {
        ConfigException ex = assertThrows(ConfigException.class, () -> manager(configFactory.create()
                    .set("appliance_url", "https://conjur.example.com")
                    .set("authn_token_file", "/run/conjur/access-token")).validate());
        assertThat(ex.getMessage(), is("must provide conjur account"));
    }

    @Test
    public void requiresLoginAndApiKeyOrTokenFile()
    {
        assertThrows(ConfigException.class, () -> manager(config().set("authn_login", "host/ci")).validate());
        manager(config().set("authn_login", "host/ci").set("authn_api_key", "k")).validate();
        manager(config().set("authn_token_file", "/run/conjur/access-token")).validate();
    }

    @Test
    public void apiKeyAndTokenFileAreExclusive()
    {
        ConfigException ex = assertThrows(ConfigException.class, () -> manager(config()
                    .set("authn_login", "host/ci")
                    .set("authn_api_key", "k")
                    .set("authn_token_file", "/run/conjur/access-token")).validate());
        assertThat(ex.getMessage(), is("must provide only one of conjur api key or token file"));
    }

    @Test
    public void rejectsInvalidTemplate()
    {
        assertThrows(SecretTemplateException.class, () -> manager(config()
                    .set("authn_token_file", "/run/conjur/access-token")
                    .set("team_secret_template", "concourse/{{.Org}}/{{.Secret}}")).validate());
    }

    @Test
    public void lookupPathsInPrecedenceOrder()
    {
        ConjurSecrets secrets = new ConjurSecrets(mock(ConjurClient.class), ImmutableList.of(
                    SecretTemplate.build("pipeline", ConjurConfig.DEFAULT_PIPELINE_SECRET_TEMPLATE),
                    SecretTemplate.build("team", ConjurConfig.DEFAULT_TEAM_SECRET_TEMPLATE),
                    SecretTemplate.build("secret", ConjurConfig.DEFAULT_SECRET_TEMPLATE)));

        assertThat(render(secrets, "main", "deploy"), contains(
                    "concourse/main/deploy/token",
                    "concourse/main/token",
                    "vaultName/token"));
        assertThat(render(secrets, "main", ""), contains(
                    "concourse/main/token",
                    "vaultName/token"));
    }

    private static List<String> render(ConjurSecrets secrets, String team, String pipeline)
    {
        return secrets.newSecretLookupPaths(team, pipeline, false).stream()
            .map(path -> path.variableToSecretPath("token"))
            .collect(Collectors.toList());
    }
}
