package io.credway.standards.creds.vault;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.credway.spi.config.Config;
import io.credway.util.DurationParam;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableVaultAuthConfig.class)
@JsonDeserialize(as = ImmutableVaultAuthConfig.class)
public interface VaultAuthConfig
{
    Duration DEFAULT_RETRY_MAX = Duration.ofMinutes(5);
    Duration DEFAULT_RETRY_INITIAL = Duration.ofSeconds(1);

    /**
     * Static token used instead of logging in to an auth backend.
     */
    @Value.Redacted
    Optional<String> getClientToken();

    /**
     * Auth backend mount name such as {@code approle} or {@code cert}.
     */
    Optional<String> getBackend();

    /**
     * Maximum lifetime of a token before a fresh login is forced. Zero disables the limit.
     */
    Duration getBackendMaxTtl();

    Duration getRetryMax();

    Duration getRetryInitial();

    Map<String, String> getParams();

    static ImmutableVaultAuthConfig.Builder defaultBuilder()
    {
        return ImmutableVaultAuthConfig.builder()
            .backendMaxTtl(Duration.ZERO)
            .retryMax(DEFAULT_RETRY_MAX)
            .retryInitial(DEFAULT_RETRY_INITIAL);
    }

    static VaultAuthConfig convertFrom(Config config)
    {
        Map<String, String> params = new LinkedHashMap<>();
        Config nested = config.parseNestedOrGetEmpty("auth.params");
        for (String key : nested.getKeys()) {
            params.put(key, nested.get(key, String.class));
        }
        for (String key : config.getKeys()) {
            if (key.startsWith("auth.params.")) {
                params.put(key.substring("auth.params.".length()), config.get(key, String.class));
            }
        }

        return defaultBuilder()
            .clientToken(config.getOptional("auth.client_token", String.class))
            .backend(config.getOptional("auth.backend", String.class))
            .backendMaxTtl(duration(config, "auth.backend_max_ttl", Duration.ZERO))
            .retryMax(duration(config, "auth.retry_max", DEFAULT_RETRY_MAX))
            .retryInitial(duration(config, "auth.retry_initial", DEFAULT_RETRY_INITIAL))
            .params(params)
            .build();
    }

    static Duration duration(Config config, String key, Duration defaultValue)
    {
        return config.get(key, DurationParam.class, DurationParam.of(defaultValue)).getDuration();
    }
}
