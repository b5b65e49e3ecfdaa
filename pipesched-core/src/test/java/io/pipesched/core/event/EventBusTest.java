package io.pipesched.core.event;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class EventBusTest
{
    private static final Event<String> MESSAGE = Event.named("message");

    private final EventBus bus = new EventBus();

    @Test
    public void handlersRunInRegistrationOrder()
    {
        List<String> calls = new ArrayList<>();
        bus.register(MESSAGE, payload -> calls.add("first:" + payload));
        bus.register(MESSAGE, payload -> calls.add("second:" + payload));

        bus.signal(MESSAGE, "x");

        assertThat(calls, contains("first:x", "second:x"));
        assertThat(bus.handlerCount(MESSAGE), is(2));
    }

    @Test
    public void failingHandlerDoesNotStopOthers()
    {
        List<String> calls = new ArrayList<>();
        bus.register(MESSAGE, payload -> {
            throw new IllegalStateException("broken");
        });
        bus.register(MESSAGE, calls::add);

        bus.signal(MESSAGE, "x");

        assertThat(calls, contains("x"));
    }

    @Test
    public void signalWithoutHandlersIsNoop()
    {
        bus.signal(Events.SCHEDULER_TICK, null);
        assertThat(bus.handlerCount(Events.SCHEDULER_TICK), is(0));
    }

    @Test
    public void tickRunsAfterEveryActivation()
    {
        List<String> calls = new ArrayList<>();
        bus.register(MESSAGE, payload -> calls.add(payload));
        bus.post(MESSAGE, "a");
        bus.post(MESSAGE, "b");

        int count = bus.dispatchPending(() -> calls.add("tick"));

        assertThat(count, is(2));
        assertThat(calls, contains("a", "tick", "b", "tick"));
        assertThat(bus.pendingCount(), is(0));
    }

    @Test
    public void terminateStopsBeforeTick()
    {
        AtomicInteger ticks = new AtomicInteger();
        bus.register(Events.SCHEDULER_CLOSE, payload -> bus.terminate());
        bus.post(Events.SCHEDULER_CLOSE, null);
        bus.post(MESSAGE, "left");

        bus.dispatchPending(ticks::incrementAndGet);

        assertThat(bus.isTerminated(), is(true));
        assertThat(ticks.get(), is(0));
        assertThat(bus.pendingCount(), is(1));
    }

    @Test(timeout = 10000)
    public void loopProcessesEventsPostedFromOtherThreads()
        throws Exception
    {
        AtomicInteger received = new AtomicInteger();
        bus.register(MESSAGE, payload -> received.incrementAndGet());
        bus.register(Events.SCHEDULER_CLOSE, payload -> bus.terminate());

        Thread producer = new Thread(() -> {
            for (int i = 0; i < 100; i++) {
                bus.post(MESSAGE, "m" + i);
            }
            bus.post(Events.SCHEDULER_CLOSE, null);
        });
        producer.start();

        bus.enterLoop(() -> { });
        producer.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(received.get(), is(100));
        assertThat(bus.isTerminated(), is(true));
    }
}
