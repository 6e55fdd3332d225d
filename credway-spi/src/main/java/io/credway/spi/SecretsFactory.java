package io.credway.spi;

public interface SecretsFactory
{
    Secrets newSecrets();
}
