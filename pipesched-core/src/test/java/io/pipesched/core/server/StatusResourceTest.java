package io.pipesched.core.server;

import java.util.ArrayList;
import java.util.List;
import io.pipesched.core.event.EventBus;
import io.pipesched.core.event.Events;
import org.junit.Test;

import javax.ws.rs.core.Response;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class StatusResourceTest
{
    private final EventBus bus = new EventBus();
    private final StatusBoard board = new StatusBoard();
    private final StatusResource resource = new StatusResource(board, bus);

    @Test
    public void statusIsTheBoardSnapshot()
    {
        SchedulerStatus status = SchedulerStatus.builder()
            .isClosing(true)
            .isLockout(false)
            .pendingJobs(2)
            .activeJobs(0)
            .build();
        board.publish(status);

        assertThat(resource.getStatus(), is(sameInstance(status)));
    }

    @Test
    public void requestsOnlyPostEvents()
    {
        List<String> fired = new ArrayList<>();
        bus.register(Events.SCHEDULER_CLOSE, payload -> fired.add("close"));
        bus.register(Events.KILL_AGENTS, payload -> fired.add("kill"));

        Response kill = resource.killAgents();
        Response close = resource.close();

        assertThat(kill.getStatus(), is(202));
        assertThat(close.getStatus(), is(202));
        assertThat(fired.isEmpty(), is(true));

        bus.dispatchPending(() -> { });
        assertThat(fired, contains("kill", "close"));
    }
}
