package io.pipesched.core.agent;

import com.google.common.base.MoreObjects;
import io.pipesched.core.host.Host;
import io.pipesched.core.job.Job;

/**
 * A running worker process serving one job on one host.
 */
public class Agent
{
    private final Process process;
    private final long pid;
    private final Host host;
    private final Job job;
    private final AgentTemplate template;
    private AgentState state = AgentState.SPAWNING;

    public Agent(Process process, Host host, Job job, AgentTemplate template)
    {
        this.process = process;
        this.pid = process.pid();
        this.host = host;
        this.job = job;
        this.template = template;
    }

    public long getPid()
    {
        return pid;
    }

    public Process getProcess()
    {
        return process;
    }

    public Host getHost()
    {
        return host;
    }

    public Job getJob()
    {
        return job;
    }

    public AgentTemplate getTemplate()
    {
        return template;
    }

    public AgentState getState()
    {
        return state;
    }

    void setState(AgentState state)
    {
        this.state = state;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("pid", pid)
            .add("type", template.getName())
            .add("host", host.getName())
            .add("job", job.getId())
            .add("state", state)
            .toString();
    }
}
