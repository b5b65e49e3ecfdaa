package io.pipesched.core.agent;

import java.io.IOException;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.pipesched.core.host.Host;
import io.pipesched.core.job.Job;
import io.pipesched.core.job.JobQueue;
import io.pipesched.core.signal.ExitedChild;
import io.pipesched.core.signal.SignalBridge;
import io.pipesched.spi.JobStore;
import io.pipesched.spi.LaunchRequest;
import io.pipesched.spi.WorkerLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts agents and accounts for their deaths. Runs on the scheduler
 * thread only.
 */
public class AgentSupervisor
{
    private static final Logger logger = LoggerFactory.getLogger(AgentSupervisor.class);

    public static final int FAILED_EXIT_STATUS = -1;

    private final AgentRegistry agents;
    private final JobQueue jobs;
    private final JobStore store;
    private final WorkerLauncher launcher;
    private final SignalBridge bridge;

    @Inject
    public AgentSupervisor(AgentRegistry agents, JobQueue jobs, JobStore store,
            WorkerLauncher launcher, SignalBridge bridge)
    {
        this.agents = agents;
        this.jobs = jobs;
        this.store = store;
        this.launcher = launcher;
        this.bridge = bridge;
    }

    /**
     * Starts an agent for the job on the host. The caller has checked the
     * host capacity and the template limit.
     *
     * @return the new agent, or absent if the process could not be started.
     * In that case the job is failed.
     */
    public Optional<Agent> spawn(Host host, Job job, AgentTemplate template)
    {
        LaunchRequest request = LaunchRequest.builder()
            .jobId(job.getId())
            .jobType(template.getName())
            .command(template.getCommand())
            .hostName(host.getName())
            .hostAddress(host.getAddress())
            .directory(host.getDirectory())
            .build();

        Process process;
        try {
            process = launcher.launch(request);
        }
        catch (IOException | IllegalArgumentException ex) {
            logger.error("Failed to start {} agent on {} for job {}", template.getName(), host.getName(), job.getId(), ex);
            jobs.fail(job);
            finishInStore(job, FAILED_EXIT_STATUS);
            return Optional.absent();
        }

        long pid = process.pid();
        Agent agent = new Agent(process, host, job, template);
        agents.add(agent);
        host.increase();
        jobs.assign(job, pid);
        agent.setState(AgentState.RUNNING);
        logger.info("Started {} agent (pid {}) on {} for job {}", template.getName(), pid, host.getName(), job.getId());

        try {
            store.jobStarted(job.getRequest(), pid);
        }
        catch (IOException ex) {
            logger.error("Failed to record start of job {}", job.getId(), ex);
        }

        process.onExit().thenAccept(p -> bridge.childExited(pid, p.exitValue()));
        return Optional.of(agent);
    }

    /**
     * Fails a job that can't run.
     */
    public void reject(Job job, String reason)
    {
        logger.error("Job {} failed: {}", job.getId(), reason);
        jobs.fail(job);
        finishInStore(job, FAILED_EXIT_STATUS);
    }

    /**
     * Handles one batch of exited children. Every agent in the batch is
     * released before the next tick runs.
     */
    public void handleDeaths(List<ExitedChild> batch)
    {
        for (ExitedChild child : batch) {
            Optional<Agent> removed = agents.remove(child.getPid());
            if (!removed.isPresent()) {
                logger.debug("Ignoring exit of unknown process {}", child.getPid());
                continue;
            }
            Agent agent = removed.get();
            agent.setState(AgentState.REAPED);
            agent.getHost().decrease();
            jobs.finish(agent.getJob());
            logger.info("Agent {} (pid {}) for job {} exited with status {}",
                    agent.getTemplate().getName(), child.getPid(), agent.getJob().getId(), child.getExitStatus());
            finishInStore(agent.getJob(), child.getExitStatus());
        }
    }

    /**
     * Asks every running agent to terminate. Deaths are accounted for when
     * their exit events arrive.
     */
    public void killAll()
    {
        for (Agent agent : agents.getAll()) {
            logger.info("Killing agent {} (pid {})", agent.getTemplate().getName(), agent.getPid());
            agent.getProcess().destroy();
        }
    }

    public void logStatus()
    {
        if (logger.isTraceEnabled()) {
            for (Agent agent : agents.getAll()) {
                logger.trace("Running: {}", agent);
            }
        }
    }

    private void finishInStore(Job job, int exitStatus)
    {
        try {
            store.jobFinished(job.getRequest(), exitStatus);
        }
        catch (IOException ex) {
            logger.error("Failed to record end of job {}", job.getId(), ex);
        }
    }
}
