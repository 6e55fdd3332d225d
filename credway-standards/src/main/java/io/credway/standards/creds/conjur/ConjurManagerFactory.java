package io.credway.standards.creds.conjur;

import io.credway.spi.CredentialManager;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;

public class ConjurManagerFactory
        implements CredentialManagerFactory
{
    public static final String TYPE = "conjur";

    @Override
    public String getType()
    {
        return TYPE;
    }

    @Override
    public CredentialManager newManager(Config config)
    {
        return new ConjurManager(ConjurConfig.convertFrom(config));
    }
}
