package io.pipesched.core.host;

import java.nio.file.Paths;
import com.google.common.collect.ImmutableList;
import io.pipesched.core.config.ConfigException;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class HostRegistryTest
{
    private final HostRegistry registry = new HostRegistry();

    @Test
    public void parseHostEntry()
    {
        HostDefinition def = HostDefinition.parse("node1", " 10.0.0.5  /srv/agents 4 ", Paths.get("/local"));

        assertThat(def.getAddress(), is("10.0.0.5"));
        assertThat(def.getDirectory(), is("/srv/agents"));
        assertThat(def.getMaxAgents(), is(4));
    }

    @Test
    public void localhostUsesLocalAgentDirectory()
    {
        HostDefinition def = HostDefinition.parse("local", "localhost /ignored 2", Paths.get("/local/agents"));

        assertThat(def.getDirectory(), is("/local/agents"));
    }

    @Test(expected = ConfigException.class)
    public void rejectMissingFields()
    {
        HostDefinition.parse("node1", "10.0.0.5 4", Paths.get("/local"));
    }

    @Test(expected = ConfigException.class)
    public void rejectInvalidMax()
    {
        HostDefinition.parse("node1", "10.0.0.5 /srv many", Paths.get("/local"));
    }

    @Test(expected = ConfigException.class)
    public void rejectNegativeMax()
    {
        HostDefinition.parse("node1", "10.0.0.5 /srv -1", Paths.get("/local"));
    }

    @Test
    public void selectLeastLoadedHost()
    {
        Host big = registry.add(HostDefinition.of("big", "a", "/d", 10));
        Host small = registry.add(HostDefinition.of("small", "b", "/d", 2));

        assertThat(registry.selectHost().get(), is(sameInstance(big)));

        big.increase();
        assertThat(registry.selectHost().get(), is(sameInstance(small)));

        small.increase();
        // big 1/10 vs small 1/2
        assertThat(registry.selectHost().get(), is(sameInstance(big)));
    }

    @Test
    public void fullHostsAreNeverSelected()
    {
        Host only = registry.add(HostDefinition.of("only", "a", "/d", 1));
        only.increase();

        assertThat(registry.selectHost().isPresent(), is(false));
    }

    @Test(expected = IllegalStateException.class)
    public void increaseBeyondMaxFails()
    {
        Host only = registry.add(HostDefinition.of("only", "a", "/d", 1));
        only.increase();
        only.increase();
    }

    @Test(expected = IllegalStateException.class)
    public void decreaseBelowZeroFails()
    {
        registry.add(HostDefinition.of("only", "a", "/d", 1)).decrease();
    }

    @Test
    public void reloadKeepsRunningCounts()
    {
        Host kept = registry.add(HostDefinition.of("kept", "a", "/d", 4));
        registry.add(HostDefinition.of("removed", "b", "/d", 4));
        kept.increase();
        kept.increase();

        registry.reload(ImmutableList.of(
                    HostDefinition.of("kept", "a2", "/d2", 1),
                    HostDefinition.of("added", "c", "/d", 3)));

        assertThat(registry.count(), is(2));
        assertThat(registry.get("removed").isPresent(), is(false));
        Host reloaded = registry.get("kept").get();
        assertThat(reloaded, is(sameInstance(kept)));
        assertThat(reloaded.getAddress(), is("a2"));
        assertThat(reloaded.getRunningAgents(), is(2));
        assertThat(reloaded.hasCapacity(), is(false));
        assertThat(registry.selectHost().get().getName(), is("added"));
        assertThat(registry.totalCapacity(), is(4));

        // draining below the lowered max works
        reloaded.decrease();
        reloaded.decrease();
        assertThat(reloaded.hasCapacity(), is(true));
    }
}
