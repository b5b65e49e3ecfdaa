package io.pipesched.core.agent;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

/**
 * Live agents keyed by process id.
 */
public class AgentRegistry
{
    private final Map<Long, Agent> agents = new LinkedHashMap<>();

    @Inject
    public AgentRegistry()
    { }

    public void add(Agent agent)
    {
        agents.put(agent.getPid(), agent);
    }

    public Optional<Agent> get(long pid)
    {
        return Optional.fromNullable(agents.get(pid));
    }

    public Optional<Agent> remove(long pid)
    {
        return Optional.fromNullable(agents.remove(pid));
    }

    public int count()
    {
        return agents.size();
    }

    public int countOfType(String templateName)
    {
        return (int) agents.values().stream()
            .filter(agent -> agent.getTemplate().getName().equals(templateName))
            .count();
    }

    public Collection<Agent> getAll()
    {
        return ImmutableList.copyOf(agents.values());
    }

    public void clear()
    {
        agents.clear();
    }
}
