package io.credway.aws.creds;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigException;
import io.credway.util.SecretTemplate;
import org.immutables.value.Value;

/**
 * Parameters shared by the AWS Secrets Manager and SSM Parameter Store backends.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAwsCredentialsConfig.class)
@JsonDeserialize(as = ImmutableAwsCredentialsConfig.class)
public interface AwsCredentialsConfig
{
    String DEFAULT_PIPELINE_SECRET_TEMPLATE = "/concourse/{{.Team}}/{{.Pipeline}}/{{.Secret}}";
    String DEFAULT_TEAM_SECRET_TEMPLATE = "/concourse/{{.Team}}/{{.Secret}}";

    Optional<String> getAccessKey();

    @Value.Redacted
    Optional<String> getSecretKey();

    @Value.Redacted
    Optional<String> getSessionToken();

    Optional<String> getRegion();

    String getPipelineSecretTemplate();

    String getTeamSecretTemplate();

    Optional<String> getSharedSecretTemplate();

    @JsonIgnore
    default boolean isConfigured()
    {
        return getRegion().isPresent();
    }

    /**
     * Checks that credentials are complete and templates compile.
     *
     * @throws ConfigException on invalid parameters
     */
    default void validate()
    {
        if (getAccessKey().isPresent() != getSecretKey().isPresent()) {
            throw new ConfigException("must provide both access key and secret key, or neither");
        }
        if (getSessionToken().isPresent() && !getAccessKey().isPresent()) {
            throw new ConfigException("session token requires access key and secret key");
        }
        compileTemplates();
    }

    /**
     * Lookup templates, most specific first.
     */
    default List<SecretTemplate> compileTemplates()
    {
        ImmutableList.Builder<SecretTemplate> templates = ImmutableList.builder();
        templates.add(SecretTemplate.build("pipeline-secret-template", getPipelineSecretTemplate()));
        templates.add(SecretTemplate.build("team-secret-template", getTeamSecretTemplate()));
        if (getSharedSecretTemplate().isPresent()) {
            templates.add(SecretTemplate.build("shared-secret-template", getSharedSecretTemplate().get()));
        }
        return templates.build();
    }

    static AwsCredentialsConfig convertFrom(Config config)
    {
        return ImmutableAwsCredentialsConfig.builder()
            .accessKey(config.getOptional("access_key", String.class))
            .secretKey(config.getOptional("secret_key", String.class))
            .sessionToken(config.getOptional("session_token", String.class))
            .region(config.getOptional("region", String.class))
            .pipelineSecretTemplate(config.get("pipeline_secret_template", String.class, DEFAULT_PIPELINE_SECRET_TEMPLATE))
            .teamSecretTemplate(config.get("team_secret_template", String.class, DEFAULT_TEAM_SECRET_TEMPLATE))
            .sharedSecretTemplate(config.getOptional("shared_secret_template", String.class))
            .build();
    }
}
