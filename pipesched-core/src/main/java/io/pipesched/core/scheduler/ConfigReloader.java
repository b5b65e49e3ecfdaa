package io.pipesched.core.scheduler;

import java.io.IOException;
import java.util.List;
import com.google.inject.Inject;
import io.pipesched.core.agent.AgentTemplate;
import io.pipesched.core.agent.AgentTemplateLoader;
import io.pipesched.core.agent.AgentTemplateRegistry;
import io.pipesched.core.config.ConfigException;
import io.pipesched.core.config.SchedulerConfig;
import io.pipesched.core.config.SchedulerConfigLoader;
import io.pipesched.core.host.HostRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads hosts and agent templates into the registries.
 */
public class ConfigReloader
{
    private static final Logger logger = LoggerFactory.getLogger(ConfigReloader.class);

    private final SchedulerConfigLoader configLoader;
    private final AgentTemplateLoader templateLoader;
    private final HostRegistry hosts;
    private final AgentTemplateRegistry templates;

    @Inject
    public ConfigReloader(SchedulerConfigLoader configLoader, AgentTemplateLoader templateLoader,
            HostRegistry hosts, AgentTemplateRegistry templates)
    {
        this.configLoader = configLoader;
        this.templateLoader = templateLoader;
        this.hosts = hosts;
        this.templates = templates;
    }

    /**
     * Initial load. A missing agent config directory is thrown as
     * ConfigException.
     */
    public void load(SchedulerConfig config)
    {
        apply(config, templateLoader.load(config.getAgentConfigDirectory()));
    }

    /**
     * Re-reads the config file and the agent templates. On failure the
     * current hosts and templates are kept.
     *
     * Port and check interval changes take effect at the next start.
     */
    public boolean reload()
    {
        SchedulerConfig config;
        List<AgentTemplate> loaded;
        try {
            config = configLoader.load();
            loaded = templateLoader.load(config.getAgentConfigDirectory());
        }
        catch (IOException | ConfigException ex) {
            logger.error("Failed to reload configuration, keeping the current one", ex);
            return false;
        }
        apply(config, loaded);
        return true;
    }

    private void apply(SchedulerConfig config, List<AgentTemplate> loaded)
    {
        hosts.reload(config.getHosts());
        templates.reload(loaded);
        logger.info("Loaded {} hosts ({} agent slots) and {} agent templates",
                hosts.count(), hosts.totalCapacity(), templates.count());
        if (hosts.count() == 0) {
            logger.warn("No host is configured. Jobs will stay pending");
        }
    }
}
