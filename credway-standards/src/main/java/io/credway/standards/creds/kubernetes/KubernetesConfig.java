package io.credway.standards.creds.kubernetes;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.credway.spi.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableKubernetesConfig.class)
@JsonDeserialize(as = ImmutableKubernetesConfig.class)
public interface KubernetesConfig
{
    String DEFAULT_NAMESPACE_PREFIX = "concourse-";

    /**
     * Use the service account of the pod this process runs in.
     */
    boolean getInCluster();

    /**
     * Path to a kubeconfig file.
     */
    Optional<String> getConfigPath();

    String getNamespacePrefix();

    @JsonIgnore
    default boolean isConfigured()
    {
        return getInCluster() || getConfigPath().isPresent();
    }

    static KubernetesConfig convertFrom(Config config)
    {
        return ImmutableKubernetesConfig.builder()
            .inCluster(config.get("in_cluster", boolean.class, false))
            .configPath(config.getOptional("config_path", String.class))
            .namespacePrefix(config.get("namespace_prefix", String.class, DEFAULT_NAMESPACE_PREFIX))
            .build();
    }
}
