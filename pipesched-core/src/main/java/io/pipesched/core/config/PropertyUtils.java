package io.pipesched.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    public static Config toConfig(ConfigFactory cf, Properties props)
    {
        Config config = cf.create();
        for (String key : props.stringPropertyNames()) {
            config.set(key, props.getProperty(key).trim());
        }
        return config;
    }

    public static Map<String, String> toMap(Config config, String prefix)
    {
        Map<String, String> map = new HashMap<>();
        for (String key : config.getKeys()) {
            if (key.startsWith(prefix)) {
                map.put(key.substring(prefix.length()), config.get(key, String.class));
            }
        }
        return map;
    }
}
