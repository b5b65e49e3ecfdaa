package io.pipesched.core.job;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.pipesched.spi.JobRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pending jobs in submission order and jobs assigned to an agent.
 */
public class JobQueue
{
    private static final Logger logger = LoggerFactory.getLogger(JobQueue.class);

    private final Deque<Job> pending = new ArrayDeque<>();
    private final Map<Long, Job> active = new LinkedHashMap<>();

    @Inject
    public JobQueue()
    { }

    public Job submit(JobRequest request)
    {
        Job job = new Job(request);
        pending.addLast(job);
        logger.debug("Queued job {} of type {}", job.getId(), job.getType());
        return job;
    }

    /**
     * Pending jobs, oldest first. The returned list is a copy.
     */
    public List<Job> getPending()
    {
        return ImmutableList.copyOf(pending);
    }

    public int pendingCount()
    {
        return pending.size();
    }

    /**
     * Number of jobs assigned to a running agent.
     */
    public int activeCount()
    {
        return active.size();
    }

    /**
     * Takes a pending job out of the queue without changing its state.
     * Used to hold an exclusive job aside.
     */
    public void take(Job job)
    {
        Preconditions.checkState(pending.remove(job), "job %s is not pending", job.getId());
    }

    public void assign(Job job, long pid)
    {
        pending.remove(job);
        job.assign(pid);
        active.put(job.getId(), job);
    }

    public void finish(Job job)
    {
        active.remove(job.getId());
        job.finish();
    }

    public void fail(Job job)
    {
        pending.remove(job);
        active.remove(job.getId());
        job.fail();
    }

    public void clear()
    {
        pending.clear();
        active.clear();
    }
}
