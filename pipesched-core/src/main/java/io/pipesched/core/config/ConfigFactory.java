package io.pipesched.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.google.inject.Inject;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper typeConverter)
    {
        this.objectMapper = typeConverter;
    }

    public static ObjectMapper objectMapper()
    {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new GuavaModule());
        return mapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }
}
