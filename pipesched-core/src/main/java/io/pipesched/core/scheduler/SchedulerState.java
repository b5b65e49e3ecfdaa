package io.pipesched.core.scheduler;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import io.pipesched.core.job.Job;

/**
 * Global flags of the scheduler. Read and written on the scheduler thread
 * only.
 */
public class SchedulerState
{
    private boolean closing = false;
    private boolean lockout = false;
    private Optional<Job> held = Optional.absent();

    @Inject
    public SchedulerState()
    { }

    public boolean isClosing()
    {
        return closing;
    }

    /**
     * Starts closing.
     *
     * @return false if the scheduler was already closing.
     */
    public boolean close()
    {
        if (closing) {
            return false;
        }
        closing = true;
        return true;
    }

    /**
     * True while an exclusive agent runs. Nothing else is dispatched.
     */
    public boolean isLockout()
    {
        return lockout;
    }

    public void setLockout(boolean lockout)
    {
        this.lockout = lockout;
    }

    /**
     * The exclusive job waiting for the system to drain.
     */
    public Optional<Job> getHeld()
    {
        return held;
    }

    public void hold(Job job)
    {
        Preconditions.checkState(!held.isPresent(), "job %s is already held", held.orNull());
        held = Optional.of(job);
    }

    public Job release()
    {
        Preconditions.checkState(held.isPresent(), "no job is held");
        Job job = held.get();
        held = Optional.absent();
        return job;
    }
}
