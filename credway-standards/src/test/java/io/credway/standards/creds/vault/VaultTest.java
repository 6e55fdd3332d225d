package io.credway.standards.creds.vault;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.standards.creds.TestingClock;
import io.credway.util.SecretTemplate;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class VaultTest
{
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final Map<String, VaultSecret> stored = new HashMap<>();
    private final List<String> reads = new ArrayList<>();

    private Vault vault;

    @Before
    public void setUp()
    {
        SecretReader reader = path -> {
            reads.add(path);
            return Optional.fromNullable(stored.get(path));
        };
        vault = new Vault(reader, "/concourse",
                ImmutableList.of(
                    SecretTemplate.build("pipeline", "/concourse/{{.Team}}/{{.Pipeline}}/{{.Secret}}"),
                    SecretTemplate.build("team", "/concourse/{{.Team}}/{{.Secret}}")),
                Optional.of("shared"),
                new TestingClock(NOW));
    }

    private void store(String path, String value)
    {
        stored.put(path, new VaultSecret(ImmutableMap.<String, Object>of("value", value), Duration.ZERO));
    }

    private Optional<Object> lookup(String team, String pipeline, boolean allowRootPath, String variable)
    {
        for (SecretLookupPath path : vault.newSecretLookupPaths(team, pipeline, allowRootPath)) {
            Optional<SecretValue> value = vault.get(path.variableToSecretPath(variable));
            if (value.isPresent()) {
                return Optional.of(value.get().getValue());
            }
        }
        return Optional.absent();
    }

    private List<String> candidates(String team, String pipeline, boolean allowRootPath)
    {
        return vault.newSecretLookupPaths(team, pipeline, allowRootPath).stream()
            .map(path -> path.variableToSecretPath("foo"))
            .collect(Collectors.toList());
    }

    @Test
    public void lookupPathsInPrecedenceOrder()
    {
        assertThat(candidates("team", "pipeline", false), contains(
                    "/concourse/team/pipeline/foo",
                    "/concourse/team/foo",
                    "/concourse/shared/foo"));
    }

    @Test
    public void rootPathOnlyWhenAllowed()
    {
        assertThat(candidates("team", "pipeline", true), contains(
                    "/concourse/team/pipeline/foo",
                    "/concourse/team/foo",
                    "/concourse/shared/foo",
                    "/concourse/foo"));
    }

    @Test
    public void pipelineTemplateIsSkippedWithoutPipeline()
    {
        assertThat(candidates("team", "", false), contains(
                    "/concourse/team/foo",
                    "/concourse/shared/foo"));
    }

    @Test
    public void pipelineSecretWinsOverTeamSecret()
    {
        store("/concourse/team/pipeline/foo", "pipeline-value");
        store("/concourse/team/foo", "team-value");

        assertThat(lookup("team", "pipeline", false, "foo").get(), is("pipeline-value"));
        assertThat(reads, contains("/concourse/team/pipeline/foo"));
    }

    @Test
    public void teamSecretWinsOverSharedSecret()
    {
        store("/concourse/team/foo", "team-value");
        store("/concourse/shared/foo", "shared-value");

        assertThat(lookup("team", "pipeline", false, "foo").get(), is("team-value"));
    }

    @Test
    public void fallsBackToSharedSecret()
    {
        store("/concourse/shared/foo", "shared-value");

        assertThat(lookup("team", "pipeline", false, "foo").get(), is("shared-value"));
    }

    @Test
    public void rootSecretIsIgnoredUnlessAllowed()
    {
        store("/concourse/foo", "root-value");

        assertThat(lookup("team", "pipeline", false, "foo").isPresent(), is(false));
        assertThat(lookup("team", "pipeline", true, "foo").get(), is("root-value"));
    }

    @Test
    public void secretWithoutValueFieldIsReturnedAsMap()
    {
        stored.put("/concourse/team/db", new VaultSecret(
                    ImmutableMap.<String, Object>of("username", "admin", "password", "s3cr3t"), Duration.ZERO));

        assertThat(vault.get("/concourse/team/db").get().getValue(),
                is(ImmutableMap.<String, Object>of("username", "admin", "password", "s3cr3t")));
    }

    @Test
    public void leasedSecretExpiresHalfwayThroughLease()
    {
        stored.put("/concourse/team/db", new VaultSecret(ImmutableMap.<String, Object>of("value", "x"), Duration.ofMinutes(10)));

        SecretValue value = vault.get("/concourse/team/db").get();
        assertThat(value.getExpiration().get(), is(NOW.plus(Duration.ofMinutes(5))));
    }

    @Test
    public void secretWithoutLeaseHasNoExpiration()
    {
        store("/concourse/team/foo", "bar");

        assertThat(vault.get("/concourse/team/foo").get().getExpiration().isPresent(), is(false));
    }

    @Test
    public void joinPathCollapsesSlashes()
    {
        assertThat(Vault.joinPath("/concourse/", "/{{.Team}}/{{.Secret}}"), is("/concourse/{{.Team}}/{{.Secret}}"));
        assertThat(Vault.joinPath("/concourse", "shared"), is("/concourse/shared"));
    }
}
