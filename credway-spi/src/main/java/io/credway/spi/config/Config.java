package io.credway.spi.config;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.credway.commons.guava.ThrowablesUtil;

import static java.util.Locale.ENGLISH;

/**
 * Mutable tree of configuration parameters backed by a Jackson {@link ObjectNode}.
 *
 * Typed getters convert values with the mapper the config was created with.
 * Conversion failures and missing required keys are reported as {@link ConfigException}.
 */
public class Config
{
    private final ObjectMapper mapper;
    private final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new ConfigException("Expected object but got " + object);
        }
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    @JsonValue
    public ObjectNode getInternalObjectNode()
    {
        return object;
    }

    public ConfigFactory getFactory()
    {
        return new ConfigFactory(mapper);
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            object.remove(key);
        }
        else {
            object.set(key, mapper.valueToTree(v));
        }
        return this;
    }

    public Config setNested(String key, Config v)
    {
        object.set(key, v.object);
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public Config deepCopy()
    {
        return new Config(mapper, object.deepCopy());
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean isEmpty()
    {
        return object.size() == 0;
    }

    public boolean has(String key)
    {
        JsonNode node = object.get(key);
        return node != null && !node.isNull();
    }

    public <E> E convert(Class<E> type)
    {
        return readObject(mapper.constructType(type), object, null);
    }

    public <E> E get(String key, Class<E> type)
    {
        return readObject(mapper.constructType(type), getRequiredNode(key), key);
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readObject(mapper.constructType(type), value, key);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        return Optional.fromNullable(get(key, type, null));
    }

    public <E> List<E> getListOrEmpty(String key, Class<E> elementType)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return ImmutableList.of();
        }
        return readObject(listType(elementType), value, key);
    }

    /**
     * Same as {@link #getListOrEmpty} but also accepts a JSON array encoded
     * in a string, which is how lists arrive from flat property files.
     */
    public <E> List<E> parseListOrGetEmpty(String key, Class<E> elementType)
    {
        JsonNode parsed = tryParseTextual(key);
        if (parsed == null) {
            return getListOrEmpty(key, elementType);
        }
        return readObject(listType(elementType), parsed, key);
    }

    public <K, V> Map<K, V> getMapOrEmpty(String key, Class<K> keyType, Class<V> valueType)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return ImmutableMap.of();
        }
        return readObject(mapType(keyType, valueType), value, key);
    }

    public Config getNested(String key)
    {
        JsonNode value = getRequiredNode(key);
        if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, value);
    }

    public Config getNestedOrGetEmpty(String key)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return new Config(mapper);
        }
        else if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, value);
    }

    public Config parseNestedOrGetEmpty(String key)
    {
        JsonNode parsed = tryParseTextual(key);
        if (parsed == null) {
            return getNestedOrGetEmpty(key);
        }
        if (!parsed.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, parsed);
    }

    private JsonNode tryParseTextual(String key)
    {
        JsonNode node = object.get(key);
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return mapper.readTree(node.textValue());
        }
        catch (IOException ex) {
            throw new ConfigException("Parameter '" + key + "' is not valid JSON", ex);
        }
    }

    private JsonNode getRequiredNode(String key)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        else if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return value;
    }

    private JavaType listType(Class<?> elementType)
    {
        return mapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    private JavaType mapType(Class<?> keyType, Class<?> valueType)
    {
        return mapper.getTypeFactory().constructMapType(Map.class, keyType, valueType);
    }

    private <E> E readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(mapper.treeAsTokens(value), type);
        }
        catch (Exception ex) {
            ThrowablesUtil.propagateIfInstanceOf(ex, ConfigException.class);
            String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                    typeNameOf(type), key, sample(value), value.getNodeType().toString().toLowerCase(ENGLISH));
            throw new ConfigException(message, ex);
        }
    }

    private static String typeNameOf(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (List.class.isAssignableFrom(raw)) {
            return "array type";
        }
        else if (Map.class.isAssignableFrom(raw)) {
            return "object type";
        }
        else if (raw.equals(String.class)) {
            return "string type";
        }
        else if (raw.equals(int.class) || raw.equals(Integer.class)
                || raw.equals(long.class) || raw.equals(Long.class)) {
            return "integer type";
        }
        else if (raw.equals(boolean.class) || raw.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        return raw.getSimpleName();
    }

    private static String sample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        return json.substring(0, 97) + "...";
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof Config)) {
            return false;
        }
        return object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
