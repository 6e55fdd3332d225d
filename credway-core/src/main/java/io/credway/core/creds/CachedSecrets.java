package io.credway.core.creds;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches lookup results by resolved secret path.
 *
 * Found secrets are kept for the configured duration, or until the secret expires if
 * that comes first. Not-found results are kept for the not-found duration. Errors are
 * not cached. Expired entries are dropped on access and by a background purge task.
 */
public class CachedSecrets
        implements Secrets, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(CachedSecrets.class);

    private static class Entry
    {
        final Optional<SecretValue> value;
        final Instant deadline;

        Entry(Optional<SecretValue> value, Instant deadline)
        {
            this.value = value;
            this.deadline = deadline;
        }
    }

    private final Secrets secrets;
    private final SecretCacheConfig config;
    private final Clock clock;
    private final Cache<String, Entry> cache;
    private ScheduledExecutorService purgeExecutor;

    public CachedSecrets(Secrets secrets, SecretCacheConfig config)
    {
        this(secrets, config, Clock.systemUTC());
    }

    CachedSecrets(Secrets secrets, SecretCacheConfig config, Clock clock)
    {
        this.secrets = secrets;
        this.config = config;
        this.clock = clock;
        this.cache = CacheBuilder.newBuilder().build();
    }

    public synchronized CachedSecrets startPurge()
    {
        if (purgeExecutor == null) {
            purgeExecutor = Executors.newSingleThreadScheduledExecutor(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("secret-cache-purge-%d")
                    .build());
            long interval = config.getPurgeInterval().toMillis();
            purgeExecutor.scheduleWithFixedDelay(this::purgeSafely, interval, interval, TimeUnit.MILLISECONDS);
        }
        return this;
    }

    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        return secrets.newSecretLookupPaths(team, pipeline, allowRootPath);
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        Instant now = clock.instant();
        Entry entry = cache.getIfPresent(secretPath);
        if (entry != null && now.isBefore(entry.deadline)) {
            return entry.value;
        }

        Optional<SecretValue> value = secrets.get(secretPath);
        Instant deadline = deadlineOf(value, now);
        if (deadline.isAfter(now)) {
            cache.put(secretPath, new Entry(value, deadline));
        }
        else {
            cache.invalidate(secretPath);
        }
        return value;
    }

    private Instant deadlineOf(Optional<SecretValue> value, Instant now)
    {
        if (!value.isPresent()) {
            return now.plus(config.getDurationNotFound());
        }
        Instant deadline = now.plus(config.getDuration());
        Optional<Instant> expiration = value.get().getExpiration();
        if (expiration.isPresent() && expiration.get().isBefore(deadline)) {
            return expiration.get();
        }
        return deadline;
    }

    private void purgeSafely()
    {
        try {
            purge();
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Cache purge will be retried.", t);
        }
    }

    @VisibleForTesting
    void purge()
    {
        Instant now = clock.instant();
        int before = cache.asMap().size();
        cache.asMap().values().removeIf(entry -> !now.isBefore(entry.deadline));
        logger.debug("Purged {} expired secret cache entries", before - cache.asMap().size());
    }

    @VisibleForTesting
    long size()
    {
        return cache.size();
    }

    @Override
    public synchronized void close()
    {
        if (purgeExecutor != null) {
            purgeExecutor.shutdownNow();
            purgeExecutor = null;
        }
        cache.invalidateAll();
    }
}
