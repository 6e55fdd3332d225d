package io.credway.core.creds;

import java.util.List;
import com.google.common.base.Optional;
import io.credway.commons.guava.ThrowablesUtil;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.spi.TransientBackendException;
import io.credway.util.RetryExecutor;
import io.credway.util.RetryExecutor.RetryGiveupException;
import io.credway.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.credway.util.RetryExecutor.retryExecutor;

/**
 * Retries lookups that failed with a {@link TransientBackendException}.
 * Not-found results and other errors are returned on the first call.
 */
public class RetryableSecrets
        implements Secrets
{
    private static final Logger logger = LoggerFactory.getLogger(RetryableSecrets.class);

    private final Secrets secrets;
    private final RetryExecutor retryExecutor;

    public RetryableSecrets(Secrets secrets, SecretRetryConfig config)
    {
        this(secrets, config, Sleeper.SYSTEM);
    }

    RetryableSecrets(Secrets secrets, SecretRetryConfig config, Sleeper sleeper)
    {
        this.secrets = secrets;
        this.retryExecutor = retryExecutor()
            .withRetryLimit(config.getAttempts() - 1)
            .withInitialRetryWait(config.getInterval())
            .withMaxRetryWait(config.getMaxInterval())
            .withWaitGrowRate(config.getWaitGrowRate())
            .withSleeper(sleeper)
            .retryIf(ex -> ex instanceof TransientBackendException)
            .onRetry((exception, retryCount, retryLimit, retryWait) ->
                    logger.warn("Secret lookup failed, retrying {}/{} in {} ms: {}",
                        retryCount, retryLimit, retryWait.toMillis(), exception.toString()))
            .onGiveup((first, last) -> {
                if (last instanceof TransientBackendException) {
                    logger.warn("Giving up secret lookup after {} attempts. First failure: {}",
                            config.getAttempts(), first.toString());
                }
            });
    }

    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        return secrets.newSecretLookupPaths(team, pipeline, allowRootPath);
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        try {
            return retryExecutor.run(() -> secrets.get(secretPath));
        }
        catch (RetryGiveupException ex) {
            throw ThrowablesUtil.propagate(ex.getCause());
        }
    }
}
