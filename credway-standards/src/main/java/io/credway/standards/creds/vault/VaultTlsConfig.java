package io.credway.standards.creds.vault;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.credway.spi.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableVaultTlsConfig.class)
@JsonDeserialize(as = ImmutableVaultTlsConfig.class)
public interface VaultTlsConfig
{
    /**
     * PEM file with CA certificates to trust.
     */
    Optional<String> getCaCert();

    /**
     * Directory of PEM files with CA certificates to trust.
     */
    Optional<String> getCaPath();

    Optional<String> getClientCert();

    Optional<String> getClientKey();

    /**
     * Host name expected in the server certificate when it differs from the URL host.
     */
    Optional<String> getServerName();

    boolean getInsecureSkipVerify();

    static VaultTlsConfig convertFrom(Config config)
    {
        return ImmutableVaultTlsConfig.builder()
            .caCert(config.getOptional("ca_cert", String.class))
            .caPath(config.getOptional("ca_path", String.class))
            .clientCert(config.getOptional("client_cert", String.class))
            .clientKey(config.getOptional("client_key", String.class))
            .serverName(config.getOptional("server_name", String.class))
            .insecureSkipVerify(config.get("insecure_skip_verify", boolean.class, false))
            .build();
    }
}
