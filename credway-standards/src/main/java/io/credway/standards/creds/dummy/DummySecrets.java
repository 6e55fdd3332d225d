package io.credway.standards.creds.dummy;

import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.util.SecretLookupWithPrefix;

/**
 * Secrets held in memory, keyed by {@code [team/[pipeline/]]name}.
 */
public class DummySecrets
        implements Secrets
{
    private final Map<String, Object> vars;

    public DummySecrets(Map<String, Object> vars)
    {
        this.vars = ImmutableMap.copyOf(vars);
    }

    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        ImmutableList.Builder<SecretLookupPath> paths = ImmutableList.builder();
        if (!Strings.isNullOrEmpty(pipeline)) {
            paths.add(new SecretLookupWithPrefix(team + "/" + pipeline + "/"));
        }
        paths.add(new SecretLookupWithPrefix(team + "/"));
        paths.add(new SecretLookupWithPrefix(""));
        return paths.build();
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        Object value = vars.get(secretPath);
        if (value == null) {
            return Optional.absent();
        }
        return Optional.of(SecretValue.of(value));
    }
}
