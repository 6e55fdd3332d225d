package io.credway.core.creds;

import io.credway.spi.Secrets;
import io.credway.spi.SecretsFactory;

public class NoopSecretsFactory
        implements SecretsFactory
{
    @Override
    public Secrets newSecrets()
    {
        return new NoopSecrets();
    }
}
