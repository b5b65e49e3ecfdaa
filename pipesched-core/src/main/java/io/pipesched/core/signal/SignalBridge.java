package io.pipesched.core.signal;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.pipesched.core.config.SchedulerConfig;
import io.pipesched.core.event.EventBus;
import io.pipesched.core.event.Events;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns asynchronous notifications into event bus activations.
 *
 * Every method here may run on a signal handler thread, the alarm thread or
 * a process exit callback thread. They only read immutable state and post
 * fully built payloads. Registries and scheduler state are never touched.
 */
public class SignalBridge
{
    private static final Logger logger = LoggerFactory.getLogger(SignalBridge.class);

    public static final List<String> CLOSE_SIGNALS = ImmutableList.of("TERM", "QUIT", "INT");
    public static final String RELOAD_SIGNAL = "HUP";

    private final EventBus bus;
    private final ChildReaper reaper;
    private final SignalRegistrar registrar;
    private final long checkIntervalSeconds;
    private ScheduledExecutorService alarmExecutor;

    @Inject
    public SignalBridge(EventBus bus, ChildReaper reaper, SignalRegistrar registrar, SchedulerConfig config)
    {
        this.bus = bus;
        this.reaper = reaper;
        this.registrar = registrar;
        this.checkIntervalSeconds = config.getCheckInterval();
    }

    public synchronized void install()
    {
        for (String name : CLOSE_SIGNALS) {
            registrar.register(name, () -> handleSignal(name));
        }
        registrar.register(RELOAD_SIGNAL, () -> handleSignal(RELOAD_SIGNAL));

        if (alarmExecutor == null) {
            alarmExecutor = Executors.newSingleThreadScheduledExecutor(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("scheduler-alarm-%d")
                    .build());
        }
    }

    @VisibleForTesting
    void handleSignal(String name)
    {
        switch (name) {
        case "TERM":
        case "QUIT":
        case "INT":
            logger.info("Received SIG{}, shutting down scheduler", name);
            bus.post(Events.SCHEDULER_CLOSE, null);
            break;
        case RELOAD_SIGNAL:
            logger.info("Received SIG{}, reloading configuration", name);
            bus.post(Events.CONFIG_RELOAD, null);
            break;
        default:
            logger.warn("Ignoring unexpected signal SIG{}", name);
        }
    }

    /**
     * Records the exit of a worker process and notifies the loop.
     */
    public void childExited(long pid, int exitStatus)
    {
        logger.trace("Received exit notification for pid {}", pid);
        reaper.exited(pid, exitStatus);
        childSignal();
    }

    /**
     * Collects every exited child recorded so far and posts them as one
     * agent_death event. Exits that arrive together are never split into
     * one event each. Batches are posted in the order they were reaped.
     */
    public synchronized void childSignal()
    {
        ImmutableList<ExitedChild> batch = reaper.reapAll();
        if (!batch.isEmpty()) {
            bus.post(Events.AGENT_DEATH, batch);
        }
    }

    /**
     * Arms the next alarm. Each alarm posts a tick and a database sync,
     * then re-arms itself.
     */
    public synchronized void alarm()
    {
        if (alarmExecutor == null || alarmExecutor.isShutdown()) {
            return;
        }
        alarmExecutor.schedule(this::onAlarm, checkIntervalSeconds, TimeUnit.SECONDS);
    }

    @VisibleForTesting
    void onAlarm()
    {
        logger.debug("Alarm, checking job states");
        bus.post(Events.SCHEDULER_TICK, null);
        bus.post(Events.DATABASE_SYNC, null);
        alarm();
    }

    public synchronized void close()
    {
        if (alarmExecutor != null) {
            alarmExecutor.shutdownNow();
            alarmExecutor = null;
        }
    }
}
