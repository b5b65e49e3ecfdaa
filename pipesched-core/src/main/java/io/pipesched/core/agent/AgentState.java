package io.pipesched.core.agent;

public enum AgentState
{
    SPAWNING,
    RUNNING,
    REAPED;
}
