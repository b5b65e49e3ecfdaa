package io.pipesched.core.signal;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

/**
 * Exited worker processes that the scheduler has not collected yet.
 *
 * Exit callbacks add to it from arbitrary threads; {@link #reapAll()}
 * removes everything present in one non-blocking pass.
 */
public class ChildReaper
{
    private final Queue<ExitedChild> exited = new ConcurrentLinkedQueue<>();

    @Inject
    public ChildReaper()
    { }

    public void exited(long pid, int exitStatus)
    {
        exited.add(ExitedChild.of(pid, exitStatus));
    }

    public ImmutableList<ExitedChild> reapAll()
    {
        ImmutableList.Builder<ExitedChild> builder = ImmutableList.builder();
        ExitedChild child;
        while ((child = exited.poll()) != null) {
            builder.add(child);
        }
        return builder.build();
    }

    public boolean isEmpty()
    {
        return exited.isEmpty();
    }
}
