package io.credway.standards.creds.vault;

import java.time.Duration;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.credway.spi.SecretBackendException;
import io.credway.spi.TransientBackendException;
import io.credway.spi.config.ConfigFactory;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;

public class APIClientTest
{
    private static final String KV2_MOUNT = "{\"data\":{\"accessor\":\"kv_db2ac651\",\"description\":\"A KV v2 Mount\","
        + "\"options\":{\"version\":\"2\"},\"path\":\"concourse/\",\"type\":\"kv\"}}";

    private static final String KV1_MOUNT = "{\"data\":{\"options\":{\"version\":\"1\"},\"path\":\"concourse/\",\"type\":\"kv\"}}";

    private MockWebServer server;
    private APIClient client;

    @Before
    public void setUp()
            throws Exception
    {
        server = new MockWebServer();
        server.start();
    }

    @After
    public void tearDown()
            throws Exception
    {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.shutdown();
        }
    }

    private APIClient client(VaultAuthConfig auth, Optional<String> namespace)
    {
        VaultConfig config = VaultConfig.defaultBuilder()
            .url(server.url("/").toString())
            .namespace(namespace)
            .auth(auth)
            .build();
        client = new APIClient(config, ConfigFactory.objectMapper());
        return client;
    }

    private APIClient tokenClient()
    {
        APIClient c = client(VaultAuthConfig.defaultBuilder().clientToken("root-token").build(), Optional.absent());
        c.setClient(VaultClient.withToken("root-token"));
        return c;
    }

    private static MockResponse json(int status, String body)
    {
        return new MockResponse()
            .setResponseCode(status)
            .addHeader("Content-Type", "application/json")
            .setBody(body);
    }

    @Test
    public void readsKv2SecretFromDataPath()
            throws Exception
    {
        server.enqueue(json(200, KV2_MOUNT));
        server.enqueue(json(200, "{\"data\":{\"data\":{\"value\":\"bar\"},\"metadata\":{\"version\":1}}}"));

        Optional<VaultSecret> secret = tokenClient().read("/concourse/team/pipeline/foo");

        assertThat(secret.get().getData(), is(ImmutableMap.<String, Object>of("value", "bar")));
        RecordedRequest mount = server.takeRequest();
        assertThat(mount.getPath(), is("/v1/sys/internal/ui/mounts/concourse/team/pipeline/foo"));
        assertThat(mount.getHeader("X-Vault-Token"), is("root-token"));
        assertThat(server.takeRequest().getPath(), is("/v1/concourse/data/team/pipeline/foo"));
    }

    @Test
    public void readsKv1SecretWithLease()
            throws Exception
    {
        server.enqueue(json(200, KV1_MOUNT));
        server.enqueue(json(200, "{\"lease_duration\":60,\"data\":{\"username\":\"admin\",\"password\":\"s3cr3t\"}}"));

        VaultSecret secret = tokenClient().read("/concourse/team/db").get();

        assertThat(secret.getData(), is(ImmutableMap.<String, Object>of("username", "admin", "password", "s3cr3t")));
        assertThat(secret.getLease(), is(Duration.ofSeconds(60)));
        server.takeRequest();
        assertThat(server.takeRequest().getPath(), is("/v1/concourse/team/db"));
    }

    @Test
    public void serverWithoutMountDetailsIsReadAsKv1()
            throws Exception
    {
        server.enqueue(json(404, "{\"errors\":[]}"));
        server.enqueue(json(200, "{\"data\":{\"value\":\"bar\"}}"));

        assertThat(tokenClient().read("/concourse/foo").get().getData().get("value"), is("bar"));
        server.takeRequest();
        assertThat(server.takeRequest().getPath(), is("/v1/concourse/foo"));
    }

    @Test
    public void missingSecretIsAbsent()
    {
        server.enqueue(json(200, KV2_MOUNT));
        server.enqueue(json(404, "{\"errors\":[]}"));

        assertThat(tokenClient().read("/concourse/team/foo").isPresent(), is(false));
    }

    @Test
    public void deletedKv2VersionIsAbsent()
    {
        server.enqueue(json(200, KV2_MOUNT));
        server.enqueue(json(200, "{\"data\":{\"data\":null,\"metadata\":{\"deletion_time\":\"2024-01-01T00:00:00Z\"}}}"));

        assertThat(tokenClient().read("/concourse/team/foo").isPresent(), is(false));
    }

    @Test
    public void serverErrorIsTransient()
    {
        server.enqueue(json(503, "{\"errors\":[\"Vault is sealed\"]}"));

        TransientBackendException ex = assertThrows(TransientBackendException.class,
                () -> tokenClient().read("/concourse/team/foo"));
        assertThat(ex.getMessage(), containsString("Vault is sealed"));
    }

    @Test
    public void throttlingIsTransient()
    {
        server.enqueue(json(200, KV2_MOUNT));
        server.enqueue(json(429, "{\"errors\":[\"rate limit quota exceeded\"]}"));

        assertThrows(TransientBackendException.class, () -> tokenClient().read("/concourse/team/foo"));
    }

    @Test
    public void permissionDeniedIsNotTransient()
    {
        server.enqueue(json(404, "{\"errors\":[]}"));
        server.enqueue(json(403, "{\"errors\":[\"permission denied\"]}"));

        SecretBackendException ex = assertThrows(SecretBackendException.class,
                () -> tokenClient().read("/concourse/team/foo"));
        assertThat(ex, not(instanceOf(TransientBackendException.class)));
        assertThat(ex.getMessage(), containsString("permission denied"));
    }

    @Test
    public void logsInWithAuthBackend()
            throws Exception
    {
        APIClient c = client(VaultAuthConfig.defaultBuilder()
                    .backend("approle")
                    .putParams("role_id", "ci")
                    .putParams("secret_id", "xyz")
                    .build(),
                Optional.absent());
        server.enqueue(json(200, "{\"auth\":{\"client_token\":\"s.issued\",\"lease_duration\":3600,\"renewable\":true}}"));
        server.enqueue(json(200, KV2_MOUNT));
        server.enqueue(json(404, "{\"errors\":[]}"));

        assertThat(c.login(), is(Duration.ofHours(1)));
        assertThat(c.isRenewable(), is(true));

        RecordedRequest login = server.takeRequest();
        assertThat(login.getMethod(), is("POST"));
        assertThat(login.getPath(), is("/v1/auth/approle/login"));
        assertThat(login.getHeader("X-Vault-Token"), is(nullValue()));
        assertThat(login.getBody().readUtf8(), is("{\"role_id\":\"ci\",\"secret_id\":\"xyz\"}"));

        c.read("/concourse/team/foo");
        assertThat(server.takeRequest().getHeader("X-Vault-Token"), is("s.issued"));
    }

    @Test
    public void failedLoginKeepsPreviousClient()
    {
        APIClient c = client(VaultAuthConfig.defaultBuilder().backend("approle").build(), Optional.absent());
        c.setClient(VaultClient.withToken("old"));
        server.enqueue(json(400, "{\"errors\":[\"invalid role ID\"]}"));

        AuthException ex = assertThrows(AuthException.class, c::login);
        assertThat(ex.getCause().getMessage(), containsString("invalid role ID"));
        assertThat(c.getClient().getToken().get(), is("old"));
    }

    @Test
    public void staticTokenIsLookedUp()
            throws Exception
    {
        APIClient c = client(VaultAuthConfig.defaultBuilder().clientToken("root-token").build(), Optional.absent());
        server.enqueue(json(200, "{\"data\":{\"ttl\":0,\"renewable\":false}}"));

        assertThat(c.login(), is(Duration.ZERO));
        assertThat(c.isRenewable(), is(false));
        RecordedRequest lookup = server.takeRequest();
        assertThat(lookup.getPath(), is("/v1/auth/token/lookup-self"));
        assertThat(lookup.getHeader("X-Vault-Token"), is("root-token"));

        assertThrows(NonRenewableLeaseException.class, c::renew);
        assertThat(server.getRequestCount(), is(1));
    }

    @Test
    public void renewsToken()
            throws Exception
    {
        APIClient c = tokenClient();
        server.enqueue(json(200, "{\"auth\":{\"client_token\":\"root-token\",\"lease_duration\":1800,\"renewable\":true}}"));

        assertThat(c.renew(), is(Duration.ofMinutes(30)));
        RecordedRequest renew = server.takeRequest();
        assertThat(renew.getMethod(), is("POST"));
        assertThat(renew.getPath(), is("/v1/auth/token/renew-self"));
    }

    @Test
    public void notRenewableLeaseIsRemembered()
    {
        APIClient c = tokenClient();
        server.enqueue(json(400, "{\"errors\":[\"lease is not renewable\"]}"));

        assertThrows(NonRenewableLeaseException.class, c::renew);
        assertThat(c.isRenewable(), is(false));
        assertThrows(NonRenewableLeaseException.class, c::renew);
        assertThat(server.getRequestCount(), is(1));
    }

    @Test
    public void nonRenewableSignalSurvivesLogin()
            throws Exception
    {
        APIClient c = client(VaultAuthConfig.defaultBuilder().backend("approle").build(), Optional.absent());
        String issued = "{\"auth\":{\"client_token\":\"s.issued\",\"lease_duration\":3600,\"renewable\":true}}";
        server.enqueue(json(200, issued));
        server.enqueue(json(400, "{\"errors\":[\"lease is not renewable\"]}"));
        server.enqueue(json(200, issued));

        c.login();
        assertThrows(NonRenewableLeaseException.class, c::renew);
        c.login();

        assertThat(c.isRenewable(), is(false));
        assertThrows(NonRenewableLeaseException.class, c::renew);
        assertThat(server.getRequestCount(), is(3));
    }

    @Test
    public void unauthorizedWithoutChallengeIsNotTransient()
    {
        server.enqueue(json(401, "{\"errors\":[\"missing client token\"]}"));

        SecretBackendException ex = assertThrows(SecretBackendException.class,
                () -> tokenClient().read("/concourse/team/foo"));
        assertThat(ex, not(instanceOf(TransientBackendException.class)));
        assertThat(ex.getMessage(), containsString("missing client token"));
    }

    @Test
    public void sendsNamespaceHeader()
            throws Exception
    {
        APIClient c = client(VaultAuthConfig.defaultBuilder().clientToken("t").build(), Optional.of("ns1/"));
        c.setClient(VaultClient.withToken("t"));
        server.enqueue(json(404, "{\"errors\":[]}"));
        server.enqueue(json(404, "{\"errors\":[]}"));

        c.read("/concourse/foo");
        assertThat(server.takeRequest().getHeader("X-Vault-Namespace"), is("ns1/"));
    }

    @Test
    public void healthUsesUnauthenticatedRequest()
            throws Exception
    {
        APIClient c = tokenClient();
        server.enqueue(json(200, "{\"initialized\":true,\"sealed\":false,\"standby\":false,\"version\":\"1.15.0\"}"));

        Map<String, Object> health = c.health();

        assertThat(health.get("sealed"), is(false));
        RecordedRequest req = server.takeRequest();
        assertThat(req.getPath(), is("/v1/sys/health"));
        assertThat(req.getHeader("X-Vault-Token"), is(nullValue()));
    }
}
