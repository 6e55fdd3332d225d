package io.credway.standards.creds.conjur;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.net.UrlEscapers;
import io.credway.spi.SecretBackendException;
import io.credway.spi.TransientBackendException;
import io.credway.spi.config.ConfigException;
import io.credway.util.PemFiles;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.WWWAuthenticationProtocolHandler;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.StringContentProvider;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads variables from a Conjur appliance.
 *
 * Access tokens are valid for 8 minutes. A cached token is replaced once it is
 * older than {@link #TOKEN_REFRESH_AGE}, either by authenticating with the API key
 * or by reading the token file again.
 */
public class ConjurClient
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(ConjurClient.class);

    static final Duration TOKEN_REFRESH_AGE = Duration.ofMinutes(7);

    private final ConjurConfig config;
    private final String baseUrl;
    private final String account;
    private final HttpClient http;
    private final Clock clock;

    private String accessToken;
    private Instant accessTokenIssuedAt;

    public ConjurClient(ConjurConfig config)
    {
        this(config, Clock.systemUTC());
    }

    @VisibleForTesting
    ConjurClient(ConjurConfig config, Clock clock)
    {
        this.config = config;
        this.baseUrl = stripTrailingSlash(config.getApplianceUrl().get());
        this.account = config.getAccount().get();
        this.clock = clock;
        this.http = startClient(config);
    }

    private static HttpClient startClient(ConjurConfig config)
    {
        SslContextFactory.Client ssl = new SslContextFactory.Client();
        if (config.getCertFile().isPresent()) {
            ssl.setTrustStore(PemFiles.trustStore(PemFiles.readCertificates(Paths.get(config.getCertFile().get()))));
        }
        HttpClient httpClient = new HttpClient(ssl);
        try {
            httpClient.start();
        }
        catch (Exception e) {
            throw new ConfigException("Failed to start conjur http client", e);
        }
        // 401 responses carry no challenge; hand them back instead of failing the request
        httpClient.getProtocolHandlers().remove(WWWAuthenticationProtocolHandler.NAME);
        return httpClient;
    }

    /**
     * @return the variable value, or absent if the variable or its value does not exist
     */
    public Optional<String> retrieveSecret(String variableId)
    {
        String path = "/secrets/" + escape(account) + "/variable/" + escape(variableId);
        Request req = http.newRequest(baseUrl + path)
            .method(HttpMethod.GET)
            .timeout(config.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .header(HttpHeader.AUTHORIZATION, "Token token=\"" + accessToken() + "\"");

        ContentResponse res = send(req);
        int status = res.getStatus();
        if (HttpStatus.isSuccess(status)) {
            return Optional.of(res.getContentAsString());
        }
        if (status == HttpStatus.NOT_FOUND_404) {
            return Optional.absent();
        }
        if (status == HttpStatus.UNAUTHORIZED_401) {
            invalidateToken();
        }
        throw error(req, res);
    }

    public int ping()
    {
        Request req = http.newRequest(baseUrl + "/")
            .method(HttpMethod.GET)
            .timeout(config.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        return send(req).getStatus();
    }

    private synchronized String accessToken()
    {
        Instant now = clock.instant();
        if (accessToken == null || !now.isBefore(accessTokenIssuedAt.plus(TOKEN_REFRESH_AGE))) {
            String raw = config.getAuthnTokenFile().isPresent() ? readTokenFile() : authenticate();
            accessToken = Base64.getEncoder().encodeToString(raw.getBytes(UTF_8));
            accessTokenIssuedAt = now;
        }
        return accessToken;
    }

    private synchronized void invalidateToken()
    {
        accessToken = null;
    }

    private String authenticate()
    {
        String login = config.getAuthnLogin().get();
        String path = "/authn/" + escape(account) + "/" + escape(login) + "/authenticate";
        Request req = http.newRequest(baseUrl + path)
            .method(HttpMethod.POST)
            .timeout(config.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .content(new StringContentProvider("text/plain", config.getAuthnApiKey().get(), UTF_8));

        ContentResponse res = send(req);
        if (!HttpStatus.isSuccess(res.getStatus())) {
            throw error(req, res);
        }
        logger.debug("Authenticated to conjur as {}", login);
        return res.getContentAsString();
    }

    private String readTokenFile()
    {
        String file = config.getAuthnTokenFile().get();
        try {
            return new String(Files.readAllBytes(Paths.get(file)), UTF_8).trim();
        }
        catch (IOException ex) {
            throw new SecretBackendException("Failed to read conjur access token from " + file, ex);
        }
    }

    private RuntimeException error(Request req, ContentResponse res)
    {
        int status = res.getStatus();
        String message = req.getMethod() + " " + req.getPath() + ": " + status + " " + HttpStatus.getMessage(status);
        if (status == HttpStatus.REQUEST_TIMEOUT_408
                || status == HttpStatus.TOO_MANY_REQUESTS_429
                || HttpStatus.isServerError(status)) {
            return new TransientBackendException("Conjur request failed: " + message);
        }
        return new SecretBackendException("Conjur rejected request: " + message);
    }

    private ContentResponse send(Request req)
    {
        try {
            return req.send();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientBackendException("Conjur request interrupted: " + req.getMethod() + " " + req.getPath(), e);
        }
        catch (TimeoutException e) {
            throw new TransientBackendException("Conjur request timed out: " + req.getMethod() + " " + req.getPath(), e);
        }
        catch (ExecutionException e) {
            logger.debug("Conjur request error: {} {}", req.getMethod(), req.getPath(), e);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransientBackendException("Conjur request failed: " + req.getMethod() + " " + req.getPath() + ": " + cause, cause);
        }
    }

    private static String escape(String segment)
    {
        return UrlEscapers.urlPathSegmentEscaper().escape(segment);
    }

    private static String stripTrailingSlash(String url)
    {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public void close()
    {
        try {
            http.stop();
        }
        catch (Exception e) {
            logger.warn("Failed to stop http client", e);
        }
    }
}
