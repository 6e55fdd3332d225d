package io.credway.core.creds;

import java.util.Map;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.inject.Inject;
import io.credway.spi.CredentialManager;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;
import io.credway.spi.config.ConfigException;

/**
 * Credential manager factories by type, built from the factories bound by extensions.
 */
public class CredentialManagerRegistry
{
    public static final String CONFIG_KEY_PREFIX = "credentials.";

    private final Map<String, CredentialManagerFactory> registry;

    @Inject
    public CredentialManagerRegistry(Set<CredentialManagerFactory> factories)
    {
        ImmutableMap.Builder<String, CredentialManagerFactory> builder = ImmutableMap.builder();
        for (CredentialManagerFactory factory : factories) {
            builder.put(factory.getType(), factory);
        }
        this.registry = builder.build();
    }

    public Set<String> getTypes()
    {
        return ImmutableSortedSet.copyOf(registry.keySet());
    }

    public CredentialManager create(String type, Config systemConfig)
    {
        CredentialManagerFactory factory = registry.get(type);
        if (factory == null) {
            throw new ConfigException("Unknown credential manager type: " + type);
        }
        return factory.newManager(extractKeyPrefix(systemConfig, CONFIG_KEY_PREFIX + type + "."));
    }

    public List<CredentialManager> createAll(Config systemConfig)
    {
        ImmutableList.Builder<CredentialManager> managers = ImmutableList.builder();
        for (String type : getTypes()) {
            managers.add(create(type, systemConfig));
        }
        return managers.build();
    }

    /**
     * Returns the one manager whose required parameters are set.
     *
     * @throws ConfigException if more than one manager is configured
     */
    public Optional<CredentialManager> configuredManager(Config systemConfig)
    {
        List<CredentialManager> configured = createAll(systemConfig).stream()
            .filter(CredentialManager::isConfigured)
            .collect(Collectors.toList());
        if (configured.size() > 1) {
            throw new ConfigException("Multiple credential managers configured: " +
                    configured.stream().map(CredentialManager::getName).collect(Collectors.joining(", ")));
        }
        if (configured.isEmpty()) {
            return Optional.absent();
        }
        return Optional.of(configured.get(0));
    }

    public static Config extractKeyPrefix(Config config, String configKeyPrefix)
    {
        Config extracted = config.getFactory().create();
        for (String key : config.getKeys()) {
            if (key.startsWith(configKeyPrefix)) {
                extracted.set(
                        key.substring(configKeyPrefix.length()),
                        config.get(key, JsonNode.class).deepCopy());
            }
        }
        return extracted;
    }
}
