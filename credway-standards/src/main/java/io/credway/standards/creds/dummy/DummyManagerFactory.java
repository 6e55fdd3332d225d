package io.credway.standards.creds.dummy;

import java.util.LinkedHashMap;
import java.util.Map;
import io.credway.spi.CredentialManager;
import io.credway.spi.CredentialManagerFactory;
import io.credway.spi.config.Config;

public class DummyManagerFactory
        implements CredentialManagerFactory
{
    public static final String TYPE = "dummy";

    private static final String VARS_PREFIX = "vars.";

    @Override
    public String getType()
    {
        return TYPE;
    }

    /**
     * Vars are read from a {@code vars} object, or a JSON string of one, and from
     * flat {@code vars.<name>} keys.
     */
    @Override
    public CredentialManager newManager(Config config)
    {
        Map<String, Object> vars = new LinkedHashMap<>();
        Config nested = config.parseNestedOrGetEmpty("vars");
        for (String key : nested.getKeys()) {
            putIfSet(vars, key, nested.get(key, Object.class, null));
        }
        for (String key : config.getKeys()) {
            if (key.startsWith(VARS_PREFIX)) {
                putIfSet(vars, key.substring(VARS_PREFIX.length()), config.get(key, Object.class, null));
            }
        }
        return new DummyManager(vars);
    }

    private static void putIfSet(Map<String, Object> vars, String name, Object value)
    {
        if (value != null) {
            vars.put(name, value);
        }
    }
}
