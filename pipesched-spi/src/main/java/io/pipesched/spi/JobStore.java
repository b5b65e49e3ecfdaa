package io.pipesched.spi;

import java.io.IOException;
import java.util.List;

/**
 * Persistent job queue consumed by the scheduler.
 *
 * The scheduler calls every method from its single control thread.
 */
public interface JobStore
{
    /**
     * Creates the backing storage if it doesn't exist.
     */
    void init()
        throws IOException;

    /**
     * Verifies the backing storage is usable. Failure is fatal at startup.
     */
    void open()
        throws IOException;

    /**
     * Drops queued and running jobs.
     */
    void reset()
        throws IOException;

    /**
     * Returns jobs queued since the last call, in submission order.
     * A job is returned only once per scheduler process.
     */
    List<JobRequest> sync()
        throws IOException;

    void jobStarted(JobRequest job, long pid)
        throws IOException;

    void jobFinished(JobRequest job, int exitStatus)
        throws IOException;

    default void close()
    { }
}
