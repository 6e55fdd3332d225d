package io.credway.standards.creds.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import io.credway.spi.CredentialManager;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;

public class VaultManagerFactory
        implements CredentialManagerFactory
{
    public static final String TYPE = "vault";

    private final ObjectMapper mapper;

    @Inject
    public VaultManagerFactory(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    @Override
    public String getType()
    {
        return TYPE;
    }

    @Override
    public CredentialManager newManager(Config config)
    {
        return new VaultManager(VaultConfig.convertFrom(config), mapper);
    }
}
