package io.pipesched.core.agent;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

public class AgentTemplateRegistry
{
    private final Map<String, AgentTemplate> templates = new LinkedHashMap<>();

    @Inject
    public AgentTemplateRegistry()
    { }

    public void add(AgentTemplate template)
    {
        templates.put(template.getName(), template);
    }

    public Optional<AgentTemplate> get(String name)
    {
        return Optional.fromNullable(templates.get(name));
    }

    public boolean isExclusive(String name)
    {
        return get(name).transform(AgentTemplate::isExclusive).or(false);
    }

    public Collection<AgentTemplate> getAll()
    {
        return ImmutableList.copyOf(templates.values());
    }

    public int count()
    {
        return templates.size();
    }

    public void reload(List<AgentTemplate> newTemplates)
    {
        templates.clear();
        newTemplates.forEach(this::add);
    }

    public void clear()
    {
        templates.clear();
    }
}
