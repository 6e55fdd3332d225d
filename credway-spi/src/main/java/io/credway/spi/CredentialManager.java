package io.credway.spi;

/**
 * Configuration and lifecycle of one secret backend.
 *
 * Callers invoke {@link #init()}, then {@link #validate()}, then {@link #newSecretsFactory()}.
 * {@link #close()} releases anything {@link #init()} started.
 */
public interface CredentialManager
        extends AutoCloseable
{
    String getName();

    /**
     * Returns the effective configuration as a value serializable by Jackson.
     */
    Object getConfig();

    /**
     * Returns true if the parameters required to use this backend are set.
     */
    boolean isConfigured();

    void init();

    /**
     * @throws io.credway.spi.config.ConfigException if parameters are missing or conflict
     */
    void validate();

    SecretsFactory newSecretsFactory();

    /**
     * Probes the backend. Failures are reported in {@link HealthResponse#getError()}.
     */
    HealthResponse health();

    @Override
    void close();
}
