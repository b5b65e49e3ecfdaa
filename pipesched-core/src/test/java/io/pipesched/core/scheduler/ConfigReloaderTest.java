package io.pipesched.core.scheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import com.google.common.base.Optional;
import io.pipesched.core.agent.AgentTemplateLoader;
import io.pipesched.core.agent.AgentTemplateRegistry;
import io.pipesched.core.config.ConfigException;
import io.pipesched.core.config.ConfigFactory;
import io.pipesched.core.config.SchedulerConfigLoader;
import io.pipesched.core.host.Host;
import io.pipesched.core.host.HostRegistry;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class ConfigReloaderTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ConfigFactory cf = new ConfigFactory(ConfigFactory.objectMapper());
    private final HostRegistry hosts = new HostRegistry();
    private final AgentTemplateRegistry templates = new AgentTemplateRegistry();
    private Path configFile;
    private Path templateDir;
    private SchedulerConfigLoader loader;
    private ConfigReloader reloader;

    @Before
    public void setUp()
        throws Exception
    {
        configFile = folder.getRoot().toPath().resolve("config");
        templateDir = folder.newFolder("mods").toPath();
        loader = new SchedulerConfigLoader(cf, Optional.of(configFile), new Properties());
        reloader = new ConfigReloader(loader, new AgentTemplateLoader(cf), hosts, templates);
    }

    private void writeConfig(String hostsPart)
        throws Exception
    {
        Files.write(configFile, ("scheduler.agent-config-dir = " + templateDir + "\n" + hostsPart).getBytes(UTF_8));
    }

    private void writeTemplate(String name)
        throws Exception
    {
        Path dir = templateDir.resolve(name);
        Files.createDirectories(dir);
        Files.write(dir.resolve(name + ".conf"), ("name = " + name + "\ncommand = run\nmax = 1\n").getBytes(UTF_8));
    }

    @Test
    public void initialLoadFillsRegistries()
        throws Exception
    {
        writeConfig("host.h1 = 10.0.0.1 /srv 2\n");
        writeTemplate("a");

        reloader.load(loader.load());

        assertThat(hosts.count(), is(1));
        assertThat(templates.get("a").isPresent(), is(true));
    }

    @Test(expected = ConfigException.class)
    public void initialLoadFailsWithoutTemplateDirectory()
        throws Exception
    {
        Files.write(configFile, "scheduler.agent-config-dir = /nonexistent/pipesched\n".getBytes(UTF_8));

        reloader.load(loader.load());
    }

    @Test
    public void reloadUpdatesHostsAndTemplates()
        throws Exception
    {
        writeConfig("host.h1 = 10.0.0.1 /srv 2\n");
        writeTemplate("a");
        reloader.load(loader.load());
        Host h1 = hosts.get("h1").get();
        h1.increase();

        writeConfig("host.h1 = 10.0.0.1 /srv 5\nhost.h2 = 10.0.0.2 /srv 1\n");
        writeTemplate("b");

        assertThat(reloader.reload(), is(true));
        assertThat(hosts.count(), is(2));
        assertThat(hosts.get("h1").get(), is(sameInstance(h1)));
        assertThat(h1.getMaxAgents(), is(5));
        assertThat(h1.getRunningAgents(), is(1));
        assertThat(templates.count(), is(2));
    }

    @Test
    public void failedReloadKeepsCurrentConfiguration()
        throws Exception
    {
        writeConfig("host.h1 = 10.0.0.1 /srv 2\n");
        writeTemplate("a");
        reloader.load(loader.load());

        Files.write(configFile, ("scheduler.agent-config-dir = " + templateDir.resolve("gone") + "\nhost.h9 = x /y 1\n").getBytes(UTF_8));

        assertThat(reloader.reload(), is(false));
        assertThat(hosts.get("h1").isPresent(), is(true));
        assertThat(hosts.get("h9").isPresent(), is(false));
        assertThat(templates.get("a").isPresent(), is(true));
    }
}
