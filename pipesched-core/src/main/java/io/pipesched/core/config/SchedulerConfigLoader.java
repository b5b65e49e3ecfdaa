package io.pipesched.core.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import com.google.common.base.Optional;
import io.pipesched.core.host.HostDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the scheduler properties file.
 *
 * Kept by the scheduler so that a reload re-reads the same file.
 */
public class SchedulerConfigLoader
{
    private static final Logger logger = LoggerFactory.getLogger(SchedulerConfigLoader.class);

    private static final String HOST_PREFIX = "host.";

    private final ConfigFactory cf;
    private final Optional<Path> configPath;
    private final Properties overrides;

    public SchedulerConfigLoader(ConfigFactory cf, Optional<Path> configPath, Properties overrides)
    {
        this.cf = cf;
        this.configPath = configPath;
        this.overrides = overrides;
    }

    public Optional<Path> getConfigPath()
    {
        return configPath;
    }

    public SchedulerConfig load()
        throws IOException
    {
        Properties props = new Properties();
        if (configPath.isPresent()) {
            props.putAll(PropertyUtils.loadFile(configPath.get()));
        }
        props.putAll(overrides);
        return convert(PropertyUtils.toConfig(cf, props));
    }

    public static SchedulerConfig convert(Config config)
    {
        ImmutableSchedulerConfig.Builder builder = SchedulerConfig.builderFrom(config);
        Path localAgentDirectory = builder.build().getAgentDirectory();

        // Properties has no order. Hosts are registered sorted by name.
        Map<String, String> hosts = new TreeMap<>(PropertyUtils.toMap(config, HOST_PREFIX));
        for (Map.Entry<String, String> pair : hosts.entrySet()) {
            try {
                HostDefinition host = HostDefinition.parse(pair.getKey(), pair.getValue(), localAgentDirectory);
                builder.addHosts(host);
                logger.debug("Added host {}: address={} directory={} max={}",
                        host.getName(), host.getAddress(), host.getDirectory(), host.getMaxAgents());
            }
            catch (ConfigException ex) {
                logger.error("Skipping host entry: {}", ex.getMessage());
            }
        }
        return builder.build();
    }
}
