package io.credway.core.creds;

import java.time.Duration;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigException;
import io.credway.util.DurationParam;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableSecretRetryConfig.class)
@JsonDeserialize(as = ImmutableSecretRetryConfig.class)
public interface SecretRetryConfig
{
    int DEFAULT_ATTEMPTS = 5;
    Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);
    Duration DEFAULT_MAX_INTERVAL = Duration.ofMinutes(1);
    double DEFAULT_WAIT_GROW_RATE = 1.0;

    /**
     * Total number of calls made for one lookup, including the first one.
     */
    int getAttempts();

    Duration getInterval();

    Duration getMaxInterval();

    double getWaitGrowRate();

    @Value.Check
    default void check()
    {
        if (getAttempts() < 1) {
            throw new ConfigException("credentials.retry.attempts must be 1 or larger: " + getAttempts());
        }
        if (getWaitGrowRate() < 1.0) {
            throw new ConfigException("credentials.retry.wait_grow_rate must be 1.0 or larger: " + getWaitGrowRate());
        }
        if (getMaxInterval().compareTo(getInterval()) < 0) {
            throw new ConfigException("credentials.retry.max_interval must not be shorter than credentials.retry.interval");
        }
    }

    static ImmutableSecretRetryConfig.Builder defaultBuilder()
    {
        return ImmutableSecretRetryConfig.builder()
            .attempts(DEFAULT_ATTEMPTS)
            .interval(DEFAULT_INTERVAL)
            .maxInterval(DEFAULT_MAX_INTERVAL)
            .waitGrowRate(DEFAULT_WAIT_GROW_RATE);
    }

    static SecretRetryConfig defaultConfig()
    {
        return defaultBuilder().build();
    }

    static SecretRetryConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .attempts(config.get("credentials.retry.attempts", int.class, DEFAULT_ATTEMPTS))
            .interval(config.get("credentials.retry.interval", DurationParam.class, DurationParam.of(DEFAULT_INTERVAL)).getDuration())
            .maxInterval(config.get("credentials.retry.max_interval", DurationParam.class, DurationParam.of(DEFAULT_MAX_INTERVAL)).getDuration())
            .waitGrowRate(config.get("credentials.retry.wait_grow_rate", double.class, DEFAULT_WAIT_GROW_RATE))
            .build();
    }
}
