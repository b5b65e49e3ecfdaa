package io.pipesched.core.agent;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.pipesched.core.config.SchedulerConfig;
import io.pipesched.spi.LaunchRequest;
import io.pipesched.spi.WorkerLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts agents as child processes. Agents on a remote host are started
 * through ssh.
 */
public class LocalWorkerLauncher
        implements WorkerLauncher
{
    private static final Logger logger = LoggerFactory.getLogger(LocalWorkerLauncher.class);

    public static final String JOB_ID_ENV = "PIPESCHED_JOB_ID";
    public static final String JOB_TYPE_ENV = "PIPESCHED_JOB_TYPE";

    private final Path logDirectory;

    @Inject
    public LocalWorkerLauncher(SchedulerConfig config)
    {
        this.logDirectory = config.getDataDirectory().resolve("logs");
    }

    @Override
    public Process launch(LaunchRequest request)
        throws IOException
    {
        ProcessBuilder pb = new ProcessBuilder(buildCommandLine(request));
        Map<String, String> env = environment(request);
        if (request.isLocal()) {
            pb.directory(Paths.get(request.getDirectory()).toFile());
            pb.environment().putAll(env);
        }

        Files.createDirectories(logDirectory);
        Path logFile = logDirectory.resolve(request.getJobType() + "." + request.getJobId() + ".log");
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));

        logger.debug("Starting {} on {}: {}", request.getJobType(), request.getHostName(), pb.command());
        Process p = pb.start();
        p.getOutputStream().close();
        return p;
    }

    static List<String> buildCommandLine(LaunchRequest request)
    {
        List<String> words = Splitter.on(' ').omitEmptyStrings().splitToList(request.getCommand());
        if (words.isEmpty()) {
            throw new IllegalArgumentException("Empty command for agent " + request.getJobType());
        }
        String program = request.getDirectory() + "/" + request.getJobType() + "/agent/" + words.get(0);
        List<String> args = words.subList(1, words.size());

        ImmutableList.Builder<String> cmdline = ImmutableList.builder();
        if (!request.isLocal()) {
            cmdline.add("ssh", request.getHostAddress(), "env");
            for (Map.Entry<String, String> pair : environment(request).entrySet()) {
                cmdline.add(pair.getKey() + "=" + pair.getValue());
            }
        }
        cmdline.add(program);
        cmdline.addAll(args);
        return cmdline.build();
    }

    private static Map<String, String> environment(LaunchRequest request)
    {
        return ImmutableMap.of(
                JOB_ID_ENV, Long.toString(request.getJobId()),
                JOB_TYPE_ENV, request.getJobType());
    }
}
