package io.pipesched.core.scheduler;

import java.io.IOException;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.pipesched.core.agent.AgentRegistry;
import io.pipesched.core.agent.AgentSupervisor;
import io.pipesched.core.agent.AgentTemplateRegistry;
import io.pipesched.core.config.SchedulerConfig;
import io.pipesched.core.event.EventBus;
import io.pipesched.core.event.Events;
import io.pipesched.core.host.HostRegistry;
import io.pipesched.core.job.DatabaseSync;
import io.pipesched.core.job.JobQueue;
import io.pipesched.core.server.StatusServer;
import io.pipesched.core.signal.SignalBridge;
import io.pipesched.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the event handlers and runs the event loop until the scheduler is
 * closed and drained.
 */
public class SchedulerDaemon
{
    private static final Logger logger = LoggerFactory.getLogger(SchedulerDaemon.class);

    private final SchedulerConfig config;
    private final EventBus bus;
    private final SignalBridge bridge;
    private final SchedulerCore core;
    private final AgentSupervisor supervisor;
    private final DatabaseSync databaseSync;
    private final ConfigReloader reloader;
    private final JobStore store;
    private final StatusServer server;
    private final HostRegistry hosts;
    private final AgentRegistry agents;
    private final AgentTemplateRegistry templates;
    private final JobQueue jobs;
    private boolean handlersRegistered = false;

    @Inject
    public SchedulerDaemon(SchedulerConfig config, EventBus bus, SignalBridge bridge,
            SchedulerCore core, AgentSupervisor supervisor, DatabaseSync databaseSync,
            ConfigReloader reloader, JobStore store, StatusServer server,
            HostRegistry hosts, AgentRegistry agents, AgentTemplateRegistry templates, JobQueue jobs)
    {
        this.config = config;
        this.bus = bus;
        this.bridge = bridge;
        this.core = core;
        this.supervisor = supervisor;
        this.databaseSync = databaseSync;
        this.reloader = reloader;
        this.store = store;
        this.server = server;
        this.hosts = hosts;
        this.agents = agents;
        this.templates = templates;
        this.jobs = jobs;
    }

    public synchronized void registerHandlers()
    {
        if (handlersRegistered) {
            return;
        }
        bus.register(Events.AGENT_DEATH, supervisor::handleDeaths);
        bus.register(Events.SCHEDULER_TICK, payload -> supervisor.logStatus());
        bus.register(Events.DATABASE_SYNC, payload -> databaseSync.sync());
        bus.register(Events.SCHEDULER_CLOSE, payload -> core.close());
        bus.register(Events.CONFIG_RELOAD, payload -> reloader.reload());
        bus.register(Events.KILL_AGENTS, payload -> supervisor.killAll());
        handlersRegistered = true;
    }

    /**
     * Runs the scheduler. Returns once it was closed and every agent has
     * exited.
     *
     * @param reset drop queued jobs before starting
     * @param testMode start everything, then close immediately
     * @param port status server port overriding the configured one
     */
    public void run(boolean reset, boolean testMode, Optional<Integer> port)
        throws IOException, InterruptedException
    {
        store.open();
        reloader.load(config);
        try {
            server.start(port.or(config.getPort()));
            registerHandlers();
            bridge.install();

            if (reset) {
                store.reset();
            }

            if (testMode) {
                logger.info("Test mode, closing right after startup");
                core.close();
            }
            else {
                bridge.alarm();
            }
            bus.post(Events.DATABASE_SYNC, null);

            logger.info("Scheduler started with pid {}", ProcessHandle.current().pid());
            bus.enterLoop(core::update);
            logger.info("Scheduler stopped");
        }
        finally {
            bridge.close();
            server.stop();
            store.close();
            jobs.clear();
            agents.clear();
            templates.clear();
            hosts.clear();
        }
    }
}
