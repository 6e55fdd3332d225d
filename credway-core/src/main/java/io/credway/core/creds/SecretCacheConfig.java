package io.credway.core.creds;

import java.time.Duration;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigException;
import io.credway.util.DurationParam;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableSecretCacheConfig.class)
@JsonDeserialize(as = ImmutableSecretCacheConfig.class)
public interface SecretCacheConfig
{
    Duration DEFAULT_DURATION = Duration.ofMinutes(1);
    Duration DEFAULT_DURATION_NOT_FOUND = Duration.ofSeconds(10);
    Duration DEFAULT_PURGE_INTERVAL = Duration.ofMinutes(10);

    boolean getEnabled();

    /**
     * How long a found secret is kept. A secret that expires earlier is kept until it expires.
     */
    Duration getDuration();

    Duration getDurationNotFound();

    Duration getPurgeInterval();

    @Value.Check
    default void check()
    {
        if (getPurgeInterval().isZero() || getPurgeInterval().isNegative()) {
            throw new ConfigException("credentials.cache.purge_interval must be positive");
        }
    }

    static ImmutableSecretCacheConfig.Builder defaultBuilder()
    {
        return ImmutableSecretCacheConfig.builder()
            .enabled(false)
            .duration(DEFAULT_DURATION)
            .durationNotFound(DEFAULT_DURATION_NOT_FOUND)
            .purgeInterval(DEFAULT_PURGE_INTERVAL);
    }

    static SecretCacheConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .enabled(config.get("credentials.cache.enabled", boolean.class, false))
            .duration(duration(config, "credentials.cache.duration", DEFAULT_DURATION))
            .durationNotFound(duration(config, "credentials.cache.duration_notfound", DEFAULT_DURATION_NOT_FOUND))
            .purgeInterval(duration(config, "credentials.cache.purge_interval", DEFAULT_PURGE_INTERVAL))
            .build();
    }

    static Duration duration(Config config, String key, Duration defaultValue)
    {
        return config.get(key, DurationParam.class, DurationParam.of(defaultValue)).getDuration();
    }
}
