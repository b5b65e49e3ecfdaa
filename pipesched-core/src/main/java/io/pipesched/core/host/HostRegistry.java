package io.pipesched.core.host;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HostRegistry
{
    private static final Logger logger = LoggerFactory.getLogger(HostRegistry.class);

    // least loaded first; ties go to the host with fewer agents, then to the
    // host registered first (the stream below is stable)
    private static final Comparator<Host> LOAD_ORDER =
        Comparator.<Host>comparingDouble(h -> (double) h.getRunningAgents() / h.getMaxAgents())
        .thenComparingInt(Host::getRunningAgents);

    private final Map<String, Host> hosts = new LinkedHashMap<>();

    @Inject
    public HostRegistry()
    { }

    public Host add(HostDefinition def)
    {
        Host host = new Host(def);
        hosts.put(def.getName(), host);
        return host;
    }

    public Optional<Host> get(String name)
    {
        return Optional.fromNullable(hosts.get(name));
    }

    public int count()
    {
        return hosts.size();
    }

    public Collection<Host> getAll()
    {
        return ImmutableList.copyOf(hosts.values());
    }

    public void clear()
    {
        hosts.clear();
    }

    /**
     * Replaces the host set. Hosts kept by name are updated in place so
     * their running agent counts survive. Removed hosts disappear from
     * the registry but agents running on them keep their reference.
     */
    public void reload(List<HostDefinition> defs)
    {
        Set<String> names = defs.stream().map(HostDefinition::getName).collect(Collectors.toSet());
        hosts.keySet().removeIf(name -> {
            if (!names.contains(name)) {
                logger.info("Host {} removed from configuration", name);
                return true;
            }
            return false;
        });
        for (HostDefinition def : defs) {
            Host host = hosts.get(def.getName());
            if (host == null) {
                add(def);
            }
            else {
                host.update(def);
                if (host.getRunningAgents() > host.getMaxAgents()) {
                    logger.warn("Host {} runs {} agents, above its new max {}. No agent will start there until it drains.",
                            host.getName(), host.getRunningAgents(), host.getMaxAgents());
                }
            }
        }
    }

    /**
     * Returns the least loaded host that can take one more agent.
     */
    public Optional<Host> selectHost()
    {
        return Optional.fromJavaUtil(hosts.values().stream()
                .filter(Host::hasCapacity)
                .min(LOAD_ORDER));
    }

    public int totalCapacity()
    {
        return hosts.values().stream().mapToInt(Host::getMaxAgents).sum();
    }
}
