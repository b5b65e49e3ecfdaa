package io.pipesched.spi;

import java.io.IOException;

public interface WorkerLauncher
{
    /**
     * Starts a worker process for a job and returns immediately.
     *
     * The scheduler only observes the returned process through its pid
     * and {@link Process#onExit()}.
     */
    Process launch(LaunchRequest request)
        throws IOException;
}
