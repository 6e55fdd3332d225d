package io.credway.core.creds;

import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.util.SecretLookupWithPrefix;

/**
 * Used when no credential manager is configured. Every lookup is not-found.
 */
public class NoopSecrets
        implements Secrets
{
    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        return ImmutableList.of(new SecretLookupWithPrefix(""));
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        return Optional.absent();
    }
}
