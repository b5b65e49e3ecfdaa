package io.pipesched.core.host;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A machine agents run on. Mutated only by the host registry and the agent
 * supervisor on the scheduler thread.
 */
public class Host
{
    private final String name;
    private String address;
    private String directory;
    private int maxAgents;
    private int runningAgents = 0;

    public Host(HostDefinition def)
    {
        this.name = def.getName();
        update(def);
    }

    void update(HostDefinition def)
    {
        Preconditions.checkArgument(name.equals(def.getName()), "host name mismatch");
        this.address = def.getAddress();
        this.directory = def.getDirectory();
        this.maxAgents = def.getMaxAgents();
    }

    public String getName()
    {
        return name;
    }

    public String getAddress()
    {
        return address;
    }

    public String getDirectory()
    {
        return directory;
    }

    public int getMaxAgents()
    {
        return maxAgents;
    }

    public int getRunningAgents()
    {
        return runningAgents;
    }

    public boolean hasCapacity()
    {
        return runningAgents < maxAgents;
    }

    public void increase()
    {
        Preconditions.checkState(hasCapacity(), "host %s is full (%s agents)", name, maxAgents);
        runningAgents++;
    }

    public void decrease()
    {
        Preconditions.checkState(runningAgents > 0, "host %s has no running agent", name);
        runningAgents--;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("address", address)
            .add("running", runningAgents)
            .add("max", maxAgents)
            .toString();
    }
}
