package io.pipesched.core.event;

import java.util.List;
import io.pipesched.core.signal.ExitedChild;

public final class Events
{
    private Events()
    { }

    public static final Event<List<ExitedChild>> AGENT_DEATH = Event.named("agent_death");

    public static final Event<Void> SCHEDULER_TICK = Event.named("scheduler_tick");

    public static final Event<Void> DATABASE_SYNC = Event.named("database_sync");

    public static final Event<Void> SCHEDULER_CLOSE = Event.named("scheduler_close");

    public static final Event<Void> CONFIG_RELOAD = Event.named("config_reload");

    public static final Event<Void> KILL_AGENTS = Event.named("kill_agents");
}
