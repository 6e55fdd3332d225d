package io.credway.util;

import com.google.common.base.Optional;
import io.credway.spi.SecretLookupPath;

/**
 * Renders a {@link SecretTemplate} for one team and pipeline.
 */
public class SecretLookupWithTemplate
        implements SecretLookupPath
{
    /**
     * Returns absent when the template needs a pipeline and none is given,
     * so the caller produces one fewer candidate instead of a broken path.
     */
    public static Optional<SecretLookupPath> of(SecretTemplate template, String team, String pipeline)
    {
        if (template.hasPipeline() && (pipeline == null || pipeline.isEmpty())) {
            return Optional.absent();
        }
        return Optional.of(new SecretLookupWithTemplate(template, team, pipeline == null ? "" : pipeline));
    }

    private final SecretTemplate template;
    private final String team;
    private final String pipeline;

    private SecretLookupWithTemplate(SecretTemplate template, String team, String pipeline)
    {
        this.template = template;
        this.team = team;
        this.pipeline = pipeline;
    }

    @Override
    public String variableToSecretPath(String variable)
    {
        return template.render(team, pipeline, variable);
    }

    @Override
    public String toString()
    {
        return "SecretLookupWithTemplate{" + template + ", team=" + team + ", pipeline=" + pipeline + "}";
    }
}
