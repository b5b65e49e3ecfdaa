package io.pipesched.core.database;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.pipesched.core.config.SchedulerConfig;
import io.pipesched.spi.JobRequest;
import io.pipesched.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Job store kept as JSON files under the data directory.
 *
 * <pre>
 * queue/&lt;id&gt;.json    submitted jobs
 * running/&lt;id&gt;.json  jobs handed to an agent
 * done/&lt;id&gt;.json     finished jobs with their exit status
 * </pre>
 */
public class FileJobStore
        implements JobStore
{
    private static final Logger logger = LoggerFactory.getLogger(FileJobStore.class);

    private static final String JSON_SUFFIX = ".json";

    private final ObjectMapper mapper;
    private final Path queueDir;
    private final Path runningDir;
    private final Path doneDir;
    private final Set<Long> seen = new HashSet<>();

    @Inject
    public FileJobStore(ObjectMapper mapper, SchedulerConfig config)
    {
        this(mapper, config.getDataDirectory());
    }

    public FileJobStore(ObjectMapper mapper, Path dataDirectory)
    {
        this.mapper = mapper;
        this.queueDir = dataDirectory.resolve("queue");
        this.runningDir = dataDirectory.resolve("running");
        this.doneDir = dataDirectory.resolve("done");
    }

    @Override
    public void init()
        throws IOException
    {
        for (Path dir : directories()) {
            Files.createDirectories(dir);
        }
        logger.info("Initialized job store at {}", queueDir.getParent());
    }

    @Override
    public void open()
        throws IOException
    {
        for (Path dir : directories()) {
            if (!Files.isDirectory(dir)) {
                throw new NoSuchFileException(dir.toString(), null, "job store directory does not exist. Run with --database to create it");
            }
            if (!Files.isWritable(dir)) {
                throw new IOException("Job store directory is not writable: " + dir);
            }
        }
    }

    @Override
    public synchronized void reset()
        throws IOException
    {
        int count = deleteAll(queueDir) + deleteAll(runningDir);
        seen.clear();
        logger.info("Removed {} queued or running jobs", count);
    }

    @Override
    public synchronized List<JobRequest> sync()
        throws IOException
    {
        List<JobRequest> found = new ArrayList<>();
        for (Path file : listJson(queueDir)) {
            JobRequest request;
            try {
                request = mapper.readValue(Files.readAllBytes(file), JobRequest.class);
            }
            catch (JsonProcessingException ex) {
                logger.warn("Skipping invalid job file {}: {}", file, ex.getOriginalMessage());
                continue;
            }
            catch (NoSuchFileException ex) {
                // removed by another tool after listing
                continue;
            }
            if (seen.add(request.getId())) {
                found.add(request);
            }
        }
        found.sort(Comparator.comparingLong(JobRequest::getId));
        return ImmutableList.copyOf(found);
    }

    @Override
    public synchronized void jobStarted(JobRequest job, long pid)
        throws IOException
    {
        ObjectNode record = toRecord(job).put("pid", pid);
        Path queued = queueDir.resolve(fileName(job));
        Path running = runningDir.resolve(fileName(job));
        mapper.writeValue(running.toFile(), record);
        Files.deleteIfExists(queued);
    }

    @Override
    public synchronized void jobFinished(JobRequest job, int exitStatus)
        throws IOException
    {
        ObjectNode record = toRecord(job).put("exitStatus", exitStatus);
        Path tmp = doneDir.resolve("." + fileName(job) + ".tmp");
        mapper.writeValue(tmp.toFile(), record);
        Files.move(tmp, doneDir.resolve(fileName(job)), StandardCopyOption.REPLACE_EXISTING);
        Files.deleteIfExists(runningDir.resolve(fileName(job)));
        Files.deleteIfExists(queueDir.resolve(fileName(job)));
        seen.remove(job.getId());
    }

    private ObjectNode toRecord(JobRequest job)
    {
        return mapper.createObjectNode()
            .put("id", job.getId())
            .put("type", job.getType());
    }

    private List<Path> directories()
    {
        return ImmutableList.of(queueDir, runningDir, doneDir);
    }

    private static String fileName(JobRequest job)
    {
        return job.getId() + JSON_SUFFIX;
    }

    private static List<Path> listJson(Path dir)
        throws IOException
    {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + JSON_SUFFIX)) {
            for (Path file : ds) {
                files.add(file);
            }
        }
        return files;
    }

    private static int deleteAll(Path dir)
        throws IOException
    {
        int count = 0;
        for (Path file : listJson(dir)) {
            if (Files.deleteIfExists(file)) {
                count++;
            }
        }
        return count;
    }
}
