package io.pipesched.core.agent;

import org.immutables.value.Value;

/**
 * A kind of agent that jobs can request by type.
 */
@Value.Immutable
public interface AgentTemplate
{
    String EXCLUSIVE = "EXCLUSIVE";

    String getName();

    String getCommand();

    /**
     * Maximum number of agents of this kind running at once. Zero or
     * negative means no limit.
     */
    int getMaxAgents();

    /**
     * An exclusive agent runs alone in the whole system.
     */
    @Value.Default
    default boolean isExclusive()
    {
        return false;
    }

    static ImmutableAgentTemplate.Builder builder()
    {
        return ImmutableAgentTemplate.builder();
    }
}
