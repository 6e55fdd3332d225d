package io.credway.core.creds;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.credway.spi.CredentialManager;
import io.credway.spi.HealthResponse;
import io.credway.spi.Secrets;
import io.credway.spi.SecretsFactory;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the configured credential manager, brings it up and hands out decorated secrets.
 */
public class CredentialManagement
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(CredentialManagement.class);

    public enum State
    {
        UNCONFIGURED,
        INITIALIZED,
        VALIDATED,
        READY,
        CLOSED,
    }

    private final CredentialManagerRegistry registry;
    private final Config systemConfig;
    private final SecretRetryConfig retryConfig;
    private final SecretCacheConfig cacheConfig;

    private State state = State.UNCONFIGURED;
    private Optional<CredentialManager> manager = Optional.absent();
    private Secrets secrets;

    @Inject
    public CredentialManagement(CredentialManagerRegistry registry, Config systemConfig)
    {
        this.registry = registry;
        this.systemConfig = systemConfig;
        this.retryConfig = SecretRetryConfig.convertFrom(systemConfig);
        this.cacheConfig = SecretCacheConfig.convertFrom(systemConfig);
    }

    public synchronized State getState()
    {
        return state;
    }

    public synchronized Optional<CredentialManager> getManager()
    {
        return manager;
    }

    /**
     * @throws ConfigException if more than one manager is configured or the configured one is invalid
     */
    public synchronized Secrets start()
    {
        if (state != State.UNCONFIGURED) {
            throw new IllegalStateException("Credential management is already " + state);
        }

        manager = registry.configuredManager(systemConfig);
        SecretsFactory factory;
        if (manager.isPresent()) {
            CredentialManager m = manager.get();
            logger.info("Using credential manager '{}'", m.getName());
            try {
                m.init();
            }
            catch (RuntimeException ex) {
                m.close();
                state = State.CLOSED;
                throw ex;
            }
            state = State.INITIALIZED;
            try {
                m.validate();
            }
            catch (ConfigException ex) {
                m.close();
                state = State.CLOSED;
                throw new ConfigException("credential manager '" + m.getName() + "' misconfigured: " + ex.getMessage(), ex);
            }
            state = State.VALIDATED;
            factory = m.newSecretsFactory();
        }
        else {
            logger.info("No credential manager is configured. Secret lookups will always be not found.");
            factory = new NoopSecretsFactory();
        }

        secrets = SecretsChain.builder(factory.newSecrets())
            .retry(retryConfig)
            .cache(cacheConfig)
            .build();
        state = State.READY;
        return secrets;
    }

    public synchronized Secrets getSecrets()
    {
        if (state != State.READY) {
            throw new IllegalStateException("Credential management is not ready: " + state);
        }
        return secrets;
    }

    public HealthResponse health()
    {
        Optional<CredentialManager> m = getManager();
        if (!m.isPresent()) {
            return HealthResponse.ok("noop", "no credential manager configured");
        }
        try {
            return m.get().health();
        }
        catch (RuntimeException ex) {
            logger.warn("Health check of credential manager '{}' failed", m.get().getName(), ex);
            return HealthResponse.failed(m.get().getName(), ex.toString());
        }
    }

    @Override
    public synchronized void close()
    {
        if (state == State.CLOSED) {
            return;
        }
        if (secrets instanceof AutoCloseable) {
            try {
                ((AutoCloseable) secrets).close();
            }
            catch (Exception ex) {
                logger.warn("Failed to close secrets", ex);
            }
        }
        if (manager.isPresent()) {
            manager.get().close();
        }
        state = State.CLOSED;
    }
}
