package io.pipesched.core.scheduler;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.pipesched.core.agent.AgentRegistry;
import io.pipesched.core.agent.AgentSupervisor;
import io.pipesched.core.agent.AgentTemplate;
import io.pipesched.core.agent.AgentTemplateRegistry;
import io.pipesched.core.event.EventBus;
import io.pipesched.core.host.Host;
import io.pipesched.core.host.HostRegistry;
import io.pipesched.core.job.Job;
import io.pipesched.core.job.JobQueue;
import io.pipesched.core.server.AgentStatus;
import io.pipesched.core.server.HostStatus;
import io.pipesched.core.server.SchedulerStatus;
import io.pipesched.core.server.StatusBoard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what runs next. {@link #update()} is the tick handler of the
 * event loop and runs after every processed event.
 *
 * Exclusive jobs are held aside until nothing else runs, then dispatched
 * alone. While an exclusive agent runs (lockout), nothing else starts.
 * While closing, nothing starts at all and the loop ends once every agent
 * is gone.
 */
public class SchedulerCore
{
    private static final Logger logger = LoggerFactory.getLogger(SchedulerCore.class);

    private final SchedulerState state;
    private final EventBus bus;
    private final HostRegistry hosts;
    private final AgentRegistry agents;
    private final AgentTemplateRegistry templates;
    private final JobQueue jobs;
    private final AgentSupervisor supervisor;
    private final StatusBoard board;

    @Inject
    public SchedulerCore(SchedulerState state, EventBus bus,
            HostRegistry hosts, AgentRegistry agents, AgentTemplateRegistry templates,
            JobQueue jobs, AgentSupervisor supervisor, StatusBoard board)
    {
        this.state = state;
        this.bus = bus;
        this.hosts = hosts;
        this.agents = agents;
        this.templates = templates;
        this.jobs = jobs;
        this.supervisor = supervisor;
        this.board = board;
    }

    public SchedulerState getState()
    {
        return state;
    }

    public void update()
    {
        if (state.isClosing() && isDrained()) {
            logger.info("All agents exited, scheduler is terminating");
            bus.terminate();
            publishStatus();
            return;
        }

        if (state.isLockout() && isDrained()) {
            logger.info("Exclusive agent finished, releasing lockout");
            state.setLockout(false);
        }

        if (!state.isClosing()) {
            if (!state.getHeld().isPresent() && !state.isLockout()) {
                pullPending();
            }
            // counts are live again here, so an exclusive job never starts
            // in the same tick as other work
            if (state.getHeld().isPresent() && isDrained()) {
                dispatchHeld();
            }
        }

        publishStatus();
    }

    /**
     * Requests the scheduler to stop. Dispatch stops immediately and the
     * loop terminates once running agents have exited.
     */
    public void close()
    {
        if (state.close()) {
            logger.info("Closing scheduler. Waiting for {} agents to exit", agents.count());
        }
        else {
            logger.debug("Scheduler is already closing");
        }
    }

    private boolean isDrained()
    {
        return agents.count() == 0 && jobs.activeCount() == 0;
    }

    private void pullPending()
    {
        // templates at their max; their jobs wait while later jobs of other types go ahead
        Set<String> saturated = new HashSet<>();
        for (Job job : jobs.getPending()) {
            Optional<AgentTemplate> template = templates.get(job.getType());
            if (!template.isPresent()) {
                supervisor.reject(job, "no agent template named " + job.getType());
                continue;
            }

            if (template.get().isExclusive()) {
                if (!state.getHeld().isPresent()) {
                    logger.debug("Holding exclusive job {} until running agents exit", job.getId());
                    jobs.take(job);
                    state.hold(job);
                }
                continue;
            }

            String name = template.get().getName();
            if (saturated.contains(name)) {
                continue;
            }
            int max = template.get().getMaxAgents();
            if (max > 0 && agents.countOfType(name) >= max) {
                logger.trace("Agent {} is at its max {}", name, max);
                saturated.add(name);
                continue;
            }

            Optional<Host> host = hosts.selectHost();
            if (!host.isPresent()) {
                logger.trace("No host has capacity for job {}", job.getId());
                break;
            }
            supervisor.spawn(host.get(), job, template.get());
        }
    }

    private void dispatchHeld()
    {
        Job job = state.getHeld().get();
        Optional<AgentTemplate> template = templates.get(job.getType());
        if (!template.isPresent()) {
            state.release();
            supervisor.reject(job, "agent template " + job.getType() + " was removed");
            return;
        }
        Optional<Host> host = hosts.selectHost();
        if (!host.isPresent()) {
            logger.debug("No host available for exclusive job {}", job.getId());
            return;
        }
        state.release();
        if (supervisor.spawn(host.get(), job, template.get()).isPresent()) {
            logger.info("Exclusive job {} started, locking out other jobs", job.getId());
            state.setLockout(true);
        }
    }

    private void publishStatus()
    {
        board.publish(SchedulerStatus.builder()
                .isClosing(state.isClosing())
                .isLockout(state.isLockout())
                .heldJobId(state.getHeld().transform(Job::getId))
                .pendingJobs(jobs.pendingCount())
                .activeJobs(jobs.activeCount())
                .hosts(hosts.getAll().stream().map(HostStatus::of).collect(Collectors.toList()))
                .agents(agents.getAll().stream().map(AgentStatus::of).collect(Collectors.toList()))
                .build());
    }
}
