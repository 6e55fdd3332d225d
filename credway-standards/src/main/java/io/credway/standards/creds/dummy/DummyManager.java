package io.credway.standards.creds.dummy;

import java.util.Map;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import io.credway.spi.CredentialManager;
import io.credway.spi.HealthResponse;
import io.credway.spi.SecretsFactory;

/**
 * Credential manager serving vars from the system config. For development and tests.
 */
public class DummyManager
        implements CredentialManager
{
    private final Map<String, Object> vars;

    public DummyManager(Map<String, Object> vars)
    {
        this.vars = ImmutableMap.copyOf(vars);
    }

    @Override
    public String getName()
    {
        return DummyManagerFactory.TYPE;
    }

    /**
     * Lists the configured var names without their values.
     */
    @Override
    public Object getConfig()
    {
        return ImmutableMap.of("vars", ImmutableSortedSet.copyOf(vars.keySet()));
    }

    @Override
    public boolean isConfigured()
    {
        return !vars.isEmpty();
    }

    @Override
    public void init()
    { }

    @Override
    public void validate()
    { }

    @Override
    public SecretsFactory newSecretsFactory()
    {
        return () -> new DummySecrets(vars);
    }

    @Override
    public HealthResponse health()
    {
        return HealthResponse.ok("noop", ImmutableMap.of());
    }

    @Override
    public void close()
    { }
}
