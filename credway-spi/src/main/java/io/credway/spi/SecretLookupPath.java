package io.credway.spi;

/**
 * Turns a variable name into one concrete backend path to probe.
 */
public interface SecretLookupPath
{
    String variableToSecretPath(String variable);
}
