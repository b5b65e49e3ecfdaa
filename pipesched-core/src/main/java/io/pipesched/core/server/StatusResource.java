package io.pipesched.core.server;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.pipesched.core.event.Event;
import io.pipesched.core.event.EventBus;
import io.pipesched.core.event.Events;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.Response;

/**
 * Requests never touch scheduler state. They read the status board or
 * post events to the bus.
 */
@Path("/api")
@Produces("application/json")
public class StatusResource
{
    private static final Logger logger = LoggerFactory.getLogger(StatusResource.class);

    private final StatusBoard board;
    private final EventBus bus;

    @Inject
    public StatusResource(StatusBoard board, EventBus bus)
    {
        this.board = board;
        this.bus = bus;
    }

    @GET
    @Path("/status")
    public SchedulerStatus getStatus()
    {
        return board.get();
    }

    @POST
    @Path("/close")
    public Response close()
    {
        return accept(Events.SCHEDULER_CLOSE);
    }

    @POST
    @Path("/agents/kill")
    public Response killAgents()
    {
        return accept(Events.KILL_AGENTS);
    }

    private Response accept(Event<Void> event)
    {
        logger.info("Received {} request", event.getName());
        bus.post(event, null);
        return Response.accepted(ImmutableMap.of("accepted", event.getName())).build();
    }
}
