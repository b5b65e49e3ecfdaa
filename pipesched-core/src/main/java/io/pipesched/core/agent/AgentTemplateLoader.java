package io.pipesched.core.agent;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.inject.Inject;
import io.pipesched.core.config.Config;
import io.pipesched.core.config.ConfigException;
import io.pipesched.core.config.ConfigFactory;
import io.pipesched.core.config.PropertyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads agent templates from {@code <dir>/<name>/<name>.conf} files.
 *
 * A broken file only skips its own template.
 */
public class AgentTemplateLoader
{
    private static final Logger logger = LoggerFactory.getLogger(AgentTemplateLoader.class);

    private final ConfigFactory cf;

    @Inject
    public AgentTemplateLoader(ConfigFactory cf)
    {
        this.cf = cf;
    }

    public List<AgentTemplate> load(Path configDirectory)
    {
        if (!Files.isDirectory(configDirectory)) {
            throw new ConfigException("Could not open agent config directory: " + configDirectory);
        }

        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(configDirectory)) {
            for (Path entry : ds) {
                if (!entry.getFileName().toString().startsWith(".")) {
                    entries.add(entry);
                }
            }
        }
        catch (IOException ex) {
            throw new ConfigException("Could not list agent config directory: " + configDirectory, ex);
        }

        ImmutableList.Builder<AgentTemplate> templates = ImmutableList.builder();
        for (Path entry : Ordering.natural().sortedCopy(entries)) {
            String name = entry.getFileName().toString();
            Path file = entry.resolve(name + ".conf");
            if (!Files.exists(file)) {
                logger.trace("Could not find {}", file);
                continue;
            }
            try {
                AgentTemplate template = loadFile(file);
                templates.add(template);
                logger.debug("Added agent template {}: command={} max={} exclusive={}",
                        template.getName(), template.getCommand(), template.getMaxAgents(), template.isExclusive());
            }
            catch (IOException | IllegalArgumentException | ConfigException ex) {
                logger.error("Skipping agent config {}: {}", file, ex.getMessage());
            }
        }
        return templates.build();
    }

    AgentTemplate loadFile(Path file)
        throws IOException
    {
        Properties props = PropertyUtils.loadFile(file);
        Config config = PropertyUtils.toConfig(cf, props);

        boolean exclusive = false;
        for (String special : Splitter.on(',').omitEmptyStrings().trimResults()
                .split(config.get("special", String.class, ""))) {
            if (AgentTemplate.EXCLUSIVE.equals(special)) {
                exclusive = true;
            }
            else {
                logger.warn("Unknown special flag '{}' in {}", special, file);
            }
        }

        return AgentTemplate.builder()
            .name(config.get("name", String.class))
            .command(config.get("command", String.class))
            .maxAgents(config.get("max", int.class))
            .isExclusive(exclusive)
            .build();
    }
}
