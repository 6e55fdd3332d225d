package io.credway.core.creds;

import java.time.Clock;
import com.google.common.base.Optional;
import io.credway.spi.Secrets;

/**
 * Wraps backend secrets with the configured decorators.
 *
 * Retry always sits inside the cache so that only definitive results are cached,
 * whatever order the builder methods are called in.
 */
public class SecretsChain
{
    public static SecretsChain builder(Secrets backend)
    {
        return new SecretsChain(backend);
    }

    private final Secrets backend;
    private Optional<SecretRetryConfig> retry = Optional.absent();
    private Optional<SecretCacheConfig> cache = Optional.absent();
    private Clock clock = Clock.systemUTC();

    private SecretsChain(Secrets backend)
    {
        this.backend = backend;
    }

    public SecretsChain retry(SecretRetryConfig config)
    {
        this.retry = Optional.of(config);
        return this;
    }

    /**
     * Adds a cache when {@code config} is enabled.
     */
    public SecretsChain cache(SecretCacheConfig config)
    {
        this.cache = config.getEnabled() ? Optional.of(config) : Optional.absent();
        return this;
    }

    SecretsChain clock(Clock clock)
    {
        this.clock = clock;
        return this;
    }

    public Secrets build()
    {
        Secrets secrets = backend;
        if (retry.isPresent()) {
            secrets = new RetryableSecrets(secrets, retry.get());
        }
        if (cache.isPresent()) {
            secrets = new CachedSecrets(secrets, cache.get(), clock).startPurge();
        }
        return secrets;
    }
}
