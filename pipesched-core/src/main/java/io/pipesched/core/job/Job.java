package io.pipesched.core.job;

import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import io.pipesched.spi.JobRequest;

public class Job
{
    private final JobRequest request;
    private JobState state = JobState.PENDING;
    private Optional<Long> agentPid = Optional.absent();

    public Job(JobRequest request)
    {
        this.request = request;
    }

    public long getId()
    {
        return request.getId();
    }

    public String getType()
    {
        return request.getType();
    }

    public JobRequest getRequest()
    {
        return request;
    }

    public JobState getState()
    {
        return state;
    }

    public Optional<Long> getAgentPid()
    {
        return agentPid;
    }

    void assign(long pid)
    {
        Preconditions.checkState(state == JobState.PENDING, "job %s is %s", getId(), state);
        this.state = JobState.ASSIGNED;
        this.agentPid = Optional.of(pid);
    }

    void finish()
    {
        Preconditions.checkState(state == JobState.ASSIGNED, "job %s is %s", getId(), state);
        this.state = JobState.FINISHED;
    }

    void fail()
    {
        Preconditions.checkState(!state.isDone(), "job %s is %s", getId(), state);
        this.state = JobState.FAILED;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
            .add("id", getId())
            .add("type", getType())
            .add("state", state)
            .toString();
    }
}
