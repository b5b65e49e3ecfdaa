package io.pipesched.core.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import com.google.common.base.Optional;
import io.pipesched.core.host.HostDefinition;
import org.immutables.value.Value;

@Value.Immutable
public interface SchedulerConfig
{
    int DEFAULT_PORT = 24693;
    int DEFAULT_CHECK_INTERVAL = 10;
    String DEFAULT_AGENT_DIR = "/usr/local/lib/pipesched/agents";
    String DEFAULT_AGENT_CONFIG_DIR = "/usr/local/etc/pipesched/mods-enabled";
    String DEFAULT_DATA_DIR = "/var/lib/pipesched";
    String SHARED_MEMORY_DIR = "/dev/shm";

    int getPort();

    /**
     * Seconds between two alarms.
     */
    int getCheckInterval();

    Path getAgentDirectory();

    Path getAgentConfigDirectory();

    Path getDataDirectory();

    Path getLockDirectory();

    Optional<String> getUser();

    Optional<String> getGroup();

    List<HostDefinition> getHosts();

    @Value.Check
    default void check()
    {
        if (getCheckInterval() <= 0) {
            throw new ConfigException("scheduler.check-interval must be positive but got " + getCheckInterval());
        }
    }

    static ImmutableSchedulerConfig.Builder defaultBuilder()
    {
        return ImmutableSchedulerConfig.builder()
            .port(DEFAULT_PORT)
            .checkInterval(DEFAULT_CHECK_INTERVAL)
            .agentDirectory(Paths.get(DEFAULT_AGENT_DIR))
            .agentConfigDirectory(Paths.get(DEFAULT_AGENT_CONFIG_DIR))
            .dataDirectory(Paths.get(DEFAULT_DATA_DIR))
            .lockDirectory(defaultLockDirectory());
    }

    /**
     * Reads every scheduler.* setting. Hosts are added by the caller.
     */
    static ImmutableSchedulerConfig.Builder builderFrom(Config config)
    {
        return defaultBuilder()
            .port(config.get("scheduler.port", int.class, DEFAULT_PORT))
            .checkInterval(config.get("scheduler.check-interval", int.class, DEFAULT_CHECK_INTERVAL))
            .agentDirectory(Paths.get(config.get("scheduler.agent-dir", String.class, DEFAULT_AGENT_DIR)))
            .agentConfigDirectory(Paths.get(config.get("scheduler.agent-config-dir", String.class, DEFAULT_AGENT_CONFIG_DIR)))
            .dataDirectory(Paths.get(config.get("scheduler.data-dir", String.class, DEFAULT_DATA_DIR)))
            .lockDirectory(config.getOptional("scheduler.lock-dir", String.class)
                    .transform(dir -> Paths.get(dir))
                    .or(defaultLockDirectory()))
            .user(config.getOptional("scheduler.user", String.class))
            .group(config.getOptional("scheduler.group", String.class));
    }

    static Path defaultLockDirectory()
    {
        Path shm = Paths.get(SHARED_MEMORY_DIR);
        if (Files.isDirectory(shm)) {
            return shm;
        }
        return Paths.get(System.getProperty("java.io.tmpdir"));
    }
}
