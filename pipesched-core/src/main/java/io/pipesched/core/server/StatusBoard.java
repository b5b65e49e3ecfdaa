package io.pipesched.core.server;

import java.util.concurrent.atomic.AtomicReference;
import com.google.inject.Inject;

/**
 * Hands the latest status snapshot from the scheduler thread to the
 * status server threads.
 */
public class StatusBoard
{
    private final AtomicReference<SchedulerStatus> current = new AtomicReference<>(SchedulerStatus.empty());

    @Inject
    public StatusBoard()
    { }

    public void publish(SchedulerStatus status)
    {
        current.set(status);
    }

    public SchedulerStatus get()
    {
        return current.get();
    }
}
