package io.credway.standards.creds.vault;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.util.SecretLookupWithPrefix;
import io.credway.util.SecretLookupWithTemplate;
import io.credway.util.SecretTemplate;

/**
 * Secrets stored in Vault.
 *
 * Lookup templates are already prefixed with the configured path prefix.
 */
public class Vault
        implements Secrets
{
    private final SecretReader reader;
    private final String prefix;
    private final List<SecretTemplate> lookupTemplates;
    private final Optional<String> sharedPath;
    private final Clock clock;

    public Vault(SecretReader reader, String prefix, List<SecretTemplate> lookupTemplates, Optional<String> sharedPath)
    {
        this(reader, prefix, lookupTemplates, sharedPath, Clock.systemUTC());
    }

    Vault(SecretReader reader, String prefix, List<SecretTemplate> lookupTemplates, Optional<String> sharedPath, Clock clock)
    {
        this.reader = reader;
        this.prefix = prefix;
        this.lookupTemplates = ImmutableList.copyOf(lookupTemplates);
        this.sharedPath = sharedPath;
        this.clock = clock;
    }

    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        ImmutableList.Builder<SecretLookupPath> paths = ImmutableList.builder();
        for (SecretTemplate template : lookupTemplates) {
            Optional<SecretLookupPath> path = SecretLookupWithTemplate.of(template, team, pipeline);
            if (path.isPresent()) {
                paths.add(path.get());
            }
        }
        if (sharedPath.isPresent() && !sharedPath.get().isEmpty()) {
            paths.add(new SecretLookupWithPrefix(joinPath(prefix, sharedPath.get()) + "/"));
        }
        if (allowRootPath) {
            paths.add(new SecretLookupWithPrefix(prefix + "/"));
        }
        return paths.build();
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        Optional<VaultSecret> secret = reader.read(secretPath);
        if (!secret.isPresent()) {
            return Optional.absent();
        }

        Map<String, Object> data = secret.get().getData();
        Object value = data.containsKey("value") ? data.get("value") : data;

        if (secret.get().getLease().isZero()) {
            return Optional.of(SecretValue.of(value));
        }
        // expire halfway through the lease
        Instant expiration = clock.instant().plus(secret.get().getLease().dividedBy(2));
        return Optional.of(SecretValue.of(value, expiration));
    }

    /**
     * Joins path segments with a single slash between them.
     */
    static String joinPath(String first, String second)
    {
        String joined = first + "/" + second;
        return joined.replaceAll("/{2,}", "/");
    }
}
