package io.pipesched.core.config;

import java.util.List;
import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static java.util.Locale.ENGLISH;

/**
 * Flat key-value configuration with typed accessors.
 *
 * Values are stored as JSON nodes and converted on read, so a property
 * value "10" can be read as an int and "true" as a boolean.
 */
public class Config
{
    protected final ObjectMapper mapper;
    protected final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, new ObjectNode(JsonNodeFactory.instance));
    }

    Config(ObjectMapper mapper, ObjectNode object)
    {
        this.mapper = mapper;
        this.object = object;
    }

    public Config set(String key, Object v)
    {
        if (v == null) {
            remove(key);
        }
        else {
            object.set(key, mapper.valueToTree(v));
        }
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public <E> E get(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '"+key+"' is required but not set");
        }
        else if (value.isNull()) {
            throw new ConfigException("Parameter '"+key+"' is required but null");
        }
        return readObject(mapper.getTypeFactory().constructType(type), value, key);
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readObject(mapper.getTypeFactory().constructType(type), value, key);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        return Optional.fromNullable(get(key, type, null));
    }

    @SuppressWarnings("unchecked")
    private <E> E readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return (E) mapper.readValue(value.traverse(), type);
        }
        catch (Exception ex) {
            Throwables.throwIfInstanceOf(ex, ConfigException.class);
            String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s",
                    typeNameOf(type.getRawClass()), key, value);
            throw new ConfigException(message, ex);
        }
    }

    private static String typeNameOf(Class<?> type)
    {
        if (type.equals(String.class)) {
            return "string type";
        }
        else if (type.equals(int.class) || type.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (type.equals(long.class) || type.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (type.equals(boolean.class) || type.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        return type.toString();
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
