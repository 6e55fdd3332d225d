package io.credway.standards.creds.conjur;

import java.time.Duration;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.credway.spi.config.Config;
import io.credway.util.DurationParam;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableConjurConfig.class)
@JsonDeserialize(as = ImmutableConjurConfig.class)
public interface ConjurConfig
{
    String DEFAULT_PIPELINE_SECRET_TEMPLATE = "concourse/{{.Team}}/{{.Pipeline}}/{{.Secret}}";
    String DEFAULT_TEAM_SECRET_TEMPLATE = "concourse/{{.Team}}/{{.Secret}}";
    String DEFAULT_SECRET_TEMPLATE = "vaultName/{{.Secret}}";

    Optional<String> getApplianceUrl();

    Optional<String> getAccount();

    /**
     * PEM file with the certificate of the appliance.
     */
    Optional<String> getCertFile();

    Optional<String> getAuthnLogin();

    @Value.Redacted
    Optional<String> getAuthnApiKey();

    /**
     * File holding an access token maintained by an external authenticator.
     */
    Optional<String> getAuthnTokenFile();

    String getPipelineSecretTemplate();

    String getTeamSecretTemplate();

    String getSecretTemplate();

    Duration getQueryTimeout();

    @JsonIgnore
    default boolean isConfigured()
    {
        return getApplianceUrl().isPresent();
    }

    static ImmutableConjurConfig.Builder defaultBuilder()
    {
        return ImmutableConjurConfig.builder()
            .pipelineSecretTemplate(DEFAULT_PIPELINE_SECRET_TEMPLATE)
            .teamSecretTemplate(DEFAULT_TEAM_SECRET_TEMPLATE)
            .secretTemplate(DEFAULT_SECRET_TEMPLATE)
            .queryTimeout(Duration.ofSeconds(60));
    }

    static ConjurConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .applianceUrl(config.getOptional("appliance_url", String.class))
            .account(config.getOptional("account", String.class))
            .certFile(config.getOptional("cert_file", String.class))
            .authnLogin(config.getOptional("authn_login", String.class))
            .authnApiKey(config.getOptional("authn_api_key", String.class))
            .authnTokenFile(config.getOptional("authn_token_file", String.class))
            .pipelineSecretTemplate(config.get("pipeline_secret_template", String.class, DEFAULT_PIPELINE_SECRET_TEMPLATE))
            .teamSecretTemplate(config.get("team_secret_template", String.class, DEFAULT_TEAM_SECRET_TEMPLATE))
            .secretTemplate(config.get("secret_template", String.class, DEFAULT_SECRET_TEMPLATE))
            .queryTimeout(config.get("query_timeout", DurationParam.class, DurationParam.of(Duration.ofSeconds(60))).getDuration())
            .build();
    }
}
