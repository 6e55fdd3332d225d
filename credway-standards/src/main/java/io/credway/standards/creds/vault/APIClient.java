package io.credway.standards.creds.vault;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.cert.Certificate;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.spi.SecretBackendException;
import io.credway.spi.TransientBackendException;
import io.credway.spi.config.ConfigException;
import io.credway.util.PemFiles;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.WWWAuthenticationProtocolHandler;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.StringContentProvider;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * HTTP client of the Vault API.
 *
 * The token used for reads lives in a {@link VaultClient} published through an atomic
 * reference. Only the thread running {@link #login()} and {@link #renew()} replaces it;
 * readers never lock and always see the most recently completed publish.
 */
public class APIClient
        implements SecretReader, Auther, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(APIClient.class);

    private static final String TOKEN_HEADER = "X-Vault-Token";
    private static final String NAMESPACE_HEADER = "X-Vault-Namespace";

    private final String baseUrl;
    private final VaultConfig config;
    private final ObjectMapper mapper;
    private final HttpClient http;

    private final AtomicReference<VaultClient> client = new AtomicReference<>(VaultClient.UNAUTHENTICATED);
    private final AtomicBoolean renewable = new AtomicBoolean(true);

    public APIClient(VaultConfig config, ObjectMapper mapper)
    {
        this.config = config;
        this.mapper = mapper;
        this.baseUrl = stripTrailingSlash(config.getUrl().get());
        this.http = startClient(config.getTls());
    }

    private static HttpClient startClient(VaultTlsConfig tls)
    {
        HttpClient httpClient = new HttpClient(sslContextFactory(tls));
        httpClient.setFollowRedirects(true);
        try {
            httpClient.start();
        }
        catch (Exception e) {
            throw new ConfigException("Failed to start vault http client", e);
        }
        // vault answers 401 without a challenge; hand it back instead of failing the request
        httpClient.getProtocolHandlers().remove(WWWAuthenticationProtocolHandler.NAME);
        return httpClient;
    }

    @VisibleForTesting
    static SslContextFactory.Client sslContextFactory(VaultTlsConfig tls)
    {
        SslContextFactory.Client ssl = new SslContextFactory.Client(tls.getInsecureSkipVerify());

        ImmutableList.Builder<X509Certificate> trusted = ImmutableList.builder();
        if (tls.getCaCert().isPresent()) {
            trusted.addAll(PemFiles.readCertificates(Paths.get(tls.getCaCert().get())));
        }
        if (tls.getCaPath().isPresent()) {
            trusted.addAll(PemFiles.readCertificateDirectory(Paths.get(tls.getCaPath().get())));
        }
        List<X509Certificate> certs = trusted.build();
        if (!certs.isEmpty()) {
            ssl.setTrustStore(PemFiles.trustStore(certs));
        }

        if (tls.getClientCert().isPresent() && tls.getClientKey().isPresent()) {
            List<X509Certificate> chain = PemFiles.readCertificates(Paths.get(tls.getClientCert().get()));
            String key = readFile(tls.getClientKey().get());
            ssl.setKeyStore(PemFiles.keyStore(chain, PemFiles.parsePrivateKey(key)));
            ssl.setKeyStorePassword(new String(PemFiles.KEY_STORE_PASSWORD));
        }

        if (tls.getServerName().isPresent() && !tls.getInsecureSkipVerify()) {
            String serverName = tls.getServerName().get();
            ssl.setEndpointIdentificationAlgorithm(null);
            ssl.setHostnameVerifier((host, session) -> matchesServerName(serverName, session));
        }
        return ssl;
    }

    @Override
    public Optional<VaultSecret> read(String path)
    {
        String relative = stripLeadingSlash(path);
        Optional<String> v2Mount = kvVersion2Mount(relative);

        boolean v2 = v2Mount.isPresent() && relative.startsWith(v2Mount.get());
        String readPath = v2
            ? v2Mount.get() + "data/" + relative.substring(v2Mount.get().length())
            : relative;

        Request req = request(HttpMethod.GET, "/v1/" + readPath);
        ContentResponse res = execute(req);
        if (res.getStatus() == HttpStatus.NOT_FOUND_404) {
            return Optional.absent();
        }
        else if (!HttpStatus.isSuccess(res.getStatus())) {
            throw error(req, res);
        }
        JsonNode body = parse(res);

        JsonNode data = body.path("data");
        if (v2) {
            data = data.path("data");
        }
        if (!data.isObject()) {
            // v2 returns null data for a deleted version
            return Optional.absent();
        }
        Map<String, Object> fields = mapper.convertValue(data, new TypeReference<Map<String, Object>>() {});
        Duration lease = Duration.ofSeconds(body.path("lease_duration").asLong(0));
        return Optional.of(new VaultSecret(fields, lease));
    }

    private Optional<String> kvVersion2Mount(String relativePath)
    {
        Request req = request(HttpMethod.GET, "/v1/sys/internal/ui/mounts/" + relativePath);
        ContentResponse res = execute(req);
        if (res.getStatus() == HttpStatus.NOT_FOUND_404) {
            // older servers do not expose mount details; treat as a v1 mount
            return Optional.absent();
        }
        else if (!HttpStatus.isSuccess(res.getStatus())) {
            throw error(req, res);
        }
        JsonNode data = parse(res).path("data");
        if ("2".equals(data.path("options").path("version").asText()) && data.path("path").isTextual()) {
            return Optional.of(data.path("path").asText());
        }
        return Optional.absent();
    }

    @Override
    public Duration login()
            throws AuthException
    {
        VaultAuthConfig auth = config.getAuth();
        if (auth.getClientToken().isPresent()) {
            setClient(VaultClient.withToken(auth.getClientToken().get()));
            return lookupSelf();
        }

        String backend = auth.getBackend().get();
        JsonNode body;
        try {
            Request req = request(HttpMethod.POST, "/v1/auth/" + backend + "/login")
                .content(new StringContentProvider("application/json", mapper.writeValueAsString(auth.getParams()), UTF_8));
            body = parse(checkAuthResponse(execute(req), "login"));
        }
        catch (IOException | SecretBackendException ex) {
            throw new AuthException("Failed to log in to vault auth backend '" + backend + "'", ex);
        }

        JsonNode authNode = body.path("auth");
        if (!authNode.path("client_token").isTextual()) {
            throw new AuthException("Vault login response has no client token");
        }
        setClient(VaultClient.withToken(authNode.path("client_token").asText()));
        if (!authNode.path("renewable").asBoolean(true)) {
            renewable.set(false);
        }
        return Duration.ofSeconds(authNode.path("lease_duration").asLong(0));
    }

    private Duration lookupSelf()
            throws AuthException
    {
        JsonNode data;
        try {
            data = parse(checkAuthResponse(execute(request(HttpMethod.GET, "/v1/auth/token/lookup-self")), "token lookup")).path("data");
        }
        catch (SecretBackendException ex) {
            throw new AuthException("Failed to look up vault client token", ex);
        }
        if (!data.path("renewable").asBoolean(false)) {
            renewable.set(false);
        }
        return Duration.ofSeconds(data.path("ttl").asLong(0));
    }

    @Override
    public Duration renew()
            throws AuthException
    {
        if (!renewable.get()) {
            throw new NonRenewableLeaseException("Vault token is not renewable");
        }

        ContentResponse res;
        try {
            res = execute(request(HttpMethod.POST, "/v1/auth/token/renew-self")
                    .content(new StringContentProvider("application/json", "{}", UTF_8)));
        }
        catch (SecretBackendException ex) {
            throw new AuthException("Failed to renew vault token", ex);
        }

        if (res.getStatus() == HttpStatus.BAD_REQUEST_400
                && errorMessage(res).toLowerCase(Locale.ENGLISH).contains("not renewable")) {
            renewable.set(false);
            throw new NonRenewableLeaseException("Vault token is not renewable: " + errorMessage(res));
        }

        JsonNode authNode;
        try {
            authNode = parse(checkAuthResponse(res, "renew")).path("auth");
        }
        catch (SecretBackendException ex) {
            throw new AuthException("Failed to renew vault token", ex);
        }
        if (authNode.path("client_token").isTextual()) {
            setClient(VaultClient.withToken(authNode.path("client_token").asText()));
        }
        if (!authNode.path("renewable").asBoolean(true)) {
            renewable.set(false);
        }
        return Duration.ofSeconds(authNode.path("lease_duration").asLong(0));
    }

    public Map<String, Object> health()
    {
        // the probe must not depend on the state of the authenticated client
        HttpClient probe = startClient(config.getTls());
        try {
            Request req = probe.newRequest(baseUrl + "/v1/sys/health")
                .method(HttpMethod.GET)
                .timeout(config.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (config.getNamespace().isPresent()) {
                req.header(NAMESPACE_HEADER, config.getNamespace().get());
            }
            ContentResponse res = send(req);
            return mapper.convertValue(parse(res), new TypeReference<Map<String, Object>>() {});
        }
        finally {
            stop(probe);
        }
    }

    VaultClient getClient()
    {
        return client.get();
    }

    void setClient(VaultClient newClient)
    {
        client.set(newClient);
    }

    boolean isRenewable()
    {
        return renewable.get();
    }

    private Request request(HttpMethod method, String path)
    {
        Request req = http.newRequest(baseUrl + path)
            .method(method)
            .timeout(config.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        Optional<String> token = client.get().getToken();
        if (token.isPresent()) {
            req.header(TOKEN_HEADER, token.get());
        }
        if (config.getNamespace().isPresent()) {
            req.header(NAMESPACE_HEADER, config.getNamespace().get());
        }
        return req;
    }

    /**
     * Sends a request and maps failures the server may recover from to
     * {@link TransientBackendException}. 404 and 400 responses are returned to the caller.
     */
    private ContentResponse execute(Request req)
    {
        ContentResponse res = send(req);
        int status = res.getStatus();
        if (HttpStatus.isSuccess(status)
                || status == HttpStatus.NOT_FOUND_404
                || status == HttpStatus.BAD_REQUEST_400) {
            return res;
        }
        throw error(req, res);
    }

    private RuntimeException error(Request req, ContentResponse res)
    {
        String message = req.getMethod() + " " + req.getPath() + ": " + res.getStatus() + " "
            + HttpStatus.getMessage(res.getStatus()) + errorSuffix(res);
        if (HttpStatus.isClientError(res.getStatus())) {
            switch (res.getStatus()) {
                case HttpStatus.REQUEST_TIMEOUT_408:
                case HttpStatus.TOO_MANY_REQUESTS_429:
                    return new TransientBackendException("Vault request failed: " + message);
                default:
                    return new SecretBackendException("Vault rejected request: " + message);
            }
        }
        return new TransientBackendException("Vault server error: " + message);
    }

    private ContentResponse checkAuthResponse(ContentResponse res, String operation)
    {
        if (!HttpStatus.isSuccess(res.getStatus())) {
            throw new SecretBackendException("Vault " + operation + " failed: " + res.getStatus() + errorSuffix(res));
        }
        return res;
    }

    private ContentResponse send(Request req)
    {
        try {
            return req.send();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientBackendException("Vault request interrupted: " + req.getMethod() + " " + req.getPath(), e);
        }
        catch (TimeoutException e) {
            logger.debug("Vault request timeout: {} {}", req.getMethod(), req.getPath(), e);
            throw new TransientBackendException("Vault request timed out: " + req.getMethod() + " " + req.getPath(), e);
        }
        catch (ExecutionException e) {
            logger.debug("Vault request error: {} {}", req.getMethod(), req.getPath(), e);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransientBackendException("Vault request failed: " + req.getMethod() + " " + req.getPath() + ": " + cause, cause);
        }
    }

    private JsonNode parse(ContentResponse res)
    {
        try {
            return mapper.readTree(res.getContentAsString());
        }
        catch (IOException ex) {
            throw new SecretBackendException("Invalid JSON in vault response", ex);
        }
    }

    private String errorSuffix(ContentResponse res)
    {
        String message = errorMessage(res);
        return message.isEmpty() ? "" : " (" + message + ")";
    }

    private String errorMessage(ContentResponse res)
    {
        try {
            JsonNode errors = mapper.readTree(res.getContentAsString()).path("errors");
            if (errors.isArray()) {
                return String.join("; ", mapper.convertValue(errors, new TypeReference<List<String>>() {}));
            }
        }
        catch (IOException | IllegalArgumentException ex) {
            logger.trace("Vault error response is not JSON", ex);
        }
        return "";
    }

    @Override
    public void close()
    {
        stop(http);
    }

    private static void stop(HttpClient httpClient)
    {
        try {
            httpClient.stop();
        }
        catch (Exception e) {
            logger.warn("Failed to stop http client", e);
        }
    }

    static boolean matchesServerName(String serverName, SSLSession session)
    {
        Certificate[] peer;
        try {
            peer = session.getPeerCertificates();
        }
        catch (SSLPeerUnverifiedException ex) {
            return false;
        }
        if (peer.length == 0 || !(peer[0] instanceof X509Certificate)) {
            return false;
        }
        return certificateNames((X509Certificate) peer[0]).contains(serverName.toLowerCase(Locale.ENGLISH));
    }

    @VisibleForTesting
    static List<String> certificateNames(X509Certificate cert)
    {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        try {
            Collection<List<?>> alternatives = cert.getSubjectAlternativeNames();
            if (alternatives != null) {
                for (List<?> alt : alternatives) {
                    // 2 = dNSName, 7 = iPAddress
                    Integer type = (Integer) alt.get(0);
                    if (type == 2 || type == 7) {
                        names.add(alt.get(1).toString().toLowerCase(Locale.ENGLISH));
                    }
                }
            }
        }
        catch (CertificateParsingException ex) {
            logger.debug("Failed to read subject alternative names of {}", cert.getSubjectX500Principal(), ex);
        }
        try {
            for (Rdn rdn : new LdapName(cert.getSubjectX500Principal().getName()).getRdns()) {
                if ("CN".equalsIgnoreCase(rdn.getType())) {
                    names.add(rdn.getValue().toString().toLowerCase(Locale.ENGLISH));
                }
            }
        }
        catch (InvalidNameException ex) {
            logger.debug("Failed to parse certificate subject {}", cert.getSubjectX500Principal(), ex);
        }
        return names.build();
    }

    private static String readFile(String path)
    {
        try {
            return new String(Files.readAllBytes(Paths.get(path)), UTF_8);
        }
        catch (IOException ex) {
            throw new ConfigException("Failed to read " + path, ex);
        }
    }

    private static String stripTrailingSlash(String url)
    {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String stripLeadingSlash(String path)
    {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }

    @Override
    public String toString()
    {
        return "APIClient{" + baseUrl + "}";
    }
}
