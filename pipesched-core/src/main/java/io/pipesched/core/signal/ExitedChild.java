package io.pipesched.core.signal;

import org.immutables.value.Value;

/**
 * A worker process that has exited, with its exit status.
 */
@Value.Immutable
public interface ExitedChild
{
    @Value.Parameter
    long getPid();

    @Value.Parameter
    int getExitStatus();

    static ExitedChild of(long pid, int exitStatus)
    {
        return ImmutableExitedChild.of(pid, exitStatus);
    }
}
