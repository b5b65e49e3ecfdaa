package io.pipesched.core.job;

import java.io.IOException;
import java.util.List;
import com.google.inject.Inject;
import io.pipesched.spi.JobRequest;
import io.pipesched.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves newly submitted jobs from the job store into the job queue.
 */
public class DatabaseSync
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseSync.class);

    private final JobStore store;
    private final JobQueue queue;

    @Inject
    public DatabaseSync(JobStore store, JobQueue queue)
    {
        this.store = store;
        this.queue = queue;
    }

    public int sync()
    {
        List<JobRequest> requests;
        try {
            requests = store.sync();
        }
        catch (IOException ex) {
            logger.error("Failed to read the job queue. Will retry at the next alarm.", ex);
            return 0;
        }
        for (JobRequest request : requests) {
            queue.submit(request);
        }
        if (!requests.isEmpty()) {
            logger.info("Received {} new jobs", requests.size());
        }
        return requests.size();
    }
}
