package io.credway.standards.creds.vault;

import java.time.Duration;
import java.util.List;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.spi.config.Config;
import io.credway.util.DurationParam;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableVaultConfig.class)
@JsonDeserialize(as = ImmutableVaultConfig.class)
public interface VaultConfig
{
    String DEFAULT_PATH_PREFIX = "/concourse";

    List<String> DEFAULT_LOOKUP_TEMPLATES = ImmutableList.of(
            "/{{.Team}}/{{.Pipeline}}/{{.Secret}}",
            "/{{.Team}}/{{.Secret}}");

    Optional<String> getUrl();

    String getPathPrefix();

    /**
     * Templates relative to {@link #getPathPrefix()}, most specific first.
     */
    List<String> getLookupTemplates();

    Optional<String> getSharedPath();

    Optional<String> getNamespace();

    Duration getLoginTimeout();

    Duration getQueryTimeout();

    VaultTlsConfig getTls();

    VaultAuthConfig getAuth();

    @JsonIgnore
    default boolean isConfigured()
    {
        return getUrl().isPresent();
    }

    static ImmutableVaultConfig.Builder defaultBuilder()
    {
        return ImmutableVaultConfig.builder()
            .pathPrefix(DEFAULT_PATH_PREFIX)
            .lookupTemplates(DEFAULT_LOOKUP_TEMPLATES)
            .loginTimeout(Duration.ofSeconds(5))
            .queryTimeout(Duration.ofSeconds(60))
            .tls(ImmutableVaultTlsConfig.builder().insecureSkipVerify(false).build())
            .auth(VaultAuthConfig.defaultBuilder().build());
    }

    static VaultConfig convertFrom(Config config)
    {
        List<String> templates = config.parseListOrGetEmpty("lookup_templates", String.class);
        return defaultBuilder()
            .url(config.getOptional("url", String.class))
            .pathPrefix(config.get("path_prefix", String.class, DEFAULT_PATH_PREFIX))
            .lookupTemplates(templates.isEmpty() ? DEFAULT_LOOKUP_TEMPLATES : templates)
            .sharedPath(config.getOptional("shared_path", String.class))
            .namespace(config.getOptional("namespace", String.class))
            .loginTimeout(config.get("login_timeout", DurationParam.class, DurationParam.of(Duration.ofSeconds(5))).getDuration())
            .queryTimeout(config.get("query_timeout", DurationParam.class, DurationParam.of(Duration.ofSeconds(60))).getDuration())
            .tls(VaultTlsConfig.convertFrom(config))
            .auth(VaultAuthConfig.convertFrom(config))
            .build();
    }
}
