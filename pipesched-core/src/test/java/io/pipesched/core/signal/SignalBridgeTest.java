package io.pipesched.core.signal;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import io.pipesched.core.config.SchedulerConfig;
import io.pipesched.core.event.EventBus;
import io.pipesched.core.event.Events;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class SignalBridgeTest
{
    private final Map<String, Runnable> installed = new HashMap<>();
    private final EventBus bus = new EventBus();
    private final ChildReaper reaper = new ChildReaper();
    private final List<String> fired = new ArrayList<>();
    private final List<List<ExitedChild>> deaths = new ArrayList<>();
    private SignalBridge bridge;

    @Before
    public void setUp()
    {
        SignalRegistrar registrar = (name, handler) -> {
            installed.put(name, handler);
            return true;
        };
        bridge = new SignalBridge(bus, reaper, registrar, SchedulerConfig.defaultBuilder().build());

        bus.register(Events.SCHEDULER_CLOSE, payload -> fired.add("close"));
        bus.register(Events.CONFIG_RELOAD, payload -> fired.add("reload"));
        bus.register(Events.SCHEDULER_TICK, payload -> fired.add("tick"));
        bus.register(Events.DATABASE_SYNC, payload -> fired.add("sync"));
        bus.register(Events.AGENT_DEATH, deaths::add);
    }

    @After
    public void tearDown()
    {
        bridge.close();
    }

    @Test
    public void installsCloseAndReloadSignals()
    {
        bridge.install();

        assertThat(installed.keySet(), containsInAnyOrder("TERM", "QUIT", "INT", "HUP"));

        installed.get("TERM").run();
        installed.get("HUP").run();
        installed.get("INT").run();
        bus.dispatchPending(() -> { });

        assertThat(fired, contains("close", "reload", "close"));
    }

    @Test
    public void alarmPostsTickAndSync()
    {
        bridge.onAlarm();
        bus.dispatchPending(() -> { });

        assertThat(fired, contains("tick", "sync"));
    }

    @Test
    public void concurrentExitsArriveInRecordedOrder()
        throws Exception
    {
        List<Long> recorded = new ArrayList<>();
        ChildReaper orderedReaper = new ChildReaper()
        {
            @Override
            public void exited(long pid, int exitStatus)
            {
                synchronized (recorded) {
                    recorded.add(pid);
                    super.exited(pid, exitStatus);
                }
            }
        };
        SignalBridge concurrent = new SignalBridge(bus, orderedReaper, (name, handler) -> true,
                SchedulerConfig.defaultBuilder().build());

        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            long base = 1000 * (t + 1);
            threads.add(new Thread(() -> {
                for (int i = 0; i < 50; i++) {
                    concurrent.childExited(base + i, 0);
                }
            }));
        }
        for (Thread thread : threads) {
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        bus.dispatchPending(() -> { });

        List<Long> delivered = new ArrayList<>();
        for (List<ExitedChild> batch : deaths) {
            for (ExitedChild child : batch) {
                delivered.add(child.getPid());
            }
        }
        assertThat(delivered.size(), is(400));
        assertThat(delivered, is(recorded));
    }

    @Test
    public void exitsRecordedTogetherArriveAsOneBatch()
    {
        reaper.exited(101, 0);
        reaper.exited(102, 1);
        reaper.exited(103, 2);

        bridge.childSignal();

        assertThat(bus.pendingCount(), is(1));
        bus.dispatchPending(() -> { });
        assertThat(deaths.size(), is(1));
        assertThat(deaths.get(0), contains(
                    ExitedChild.of(101, 0),
                    ExitedChild.of(102, 1),
                    ExitedChild.of(103, 2)));
        assertThat(reaper.isEmpty(), is(true));
    }

    @Test
    public void childSignalWithoutExitsPostsNothing()
    {
        bridge.childSignal();

        assertThat(bus.pendingCount(), is(0));
    }

    @Test
    public void childExitedPostsDeath()
    {
        bridge.childExited(42, 7);
        bus.dispatchPending(() -> { });

        assertThat(deaths.size(), is(1));
        assertThat(deaths.get(0), contains(ExitedChild.of(42, 7)));
        assertThat(fired, is(empty()));
    }
}
