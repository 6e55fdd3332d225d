package io.credway.util;

import io.credway.spi.SecretLookupPath;

public class SecretLookupWithPrefix
        implements SecretLookupPath
{
    private final String prefix;

    public SecretLookupWithPrefix(String prefix)
    {
        this.prefix = prefix;
    }

    public String getPrefix()
    {
        return prefix;
    }

    @Override
    public String variableToSecretPath(String variable)
    {
        return prefix + variable;
    }

    @Override
    public String toString()
    {
        return "SecretLookupWithPrefix{" + prefix + "}";
    }
}
