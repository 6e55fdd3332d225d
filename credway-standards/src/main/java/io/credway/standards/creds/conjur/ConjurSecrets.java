package io.credway.standards.creds.conjur;

import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.spi.SecretLookupPath;
import io.credway.spi.SecretValue;
import io.credway.spi.Secrets;
import io.credway.util.SecretLookupWithTemplate;
import io.credway.util.SecretTemplate;

public class ConjurSecrets
        implements Secrets
{
    private final ConjurClient client;
    private final List<SecretTemplate> templates;

    /**
     * @param templates pipeline, team and global templates, most specific first
     */
    public ConjurSecrets(ConjurClient client, List<SecretTemplate> templates)
    {
        this.client = client;
        this.templates = ImmutableList.copyOf(templates);
    }

    @Override
    public List<SecretLookupPath> newSecretLookupPaths(String team, String pipeline, boolean allowRootPath)
    {
        ImmutableList.Builder<SecretLookupPath> paths = ImmutableList.builder();
        for (SecretTemplate template : templates) {
            Optional<SecretLookupPath> path = SecretLookupWithTemplate.of(template, team, pipeline);
            if (path.isPresent()) {
                paths.add(path.get());
            }
        }
        return paths.build();
    }

    @Override
    public Optional<SecretValue> get(String secretPath)
    {
        Optional<String> value = client.retrieveSecret(secretPath);
        if (!value.isPresent()) {
            return Optional.absent();
        }
        return Optional.of(SecretValue.of(value.get()));
    }
}
