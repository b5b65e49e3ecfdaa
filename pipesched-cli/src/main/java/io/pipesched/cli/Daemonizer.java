package io.pipesched.cli;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Paths;
import java.util.List;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the scheduler again in a detached JVM.
 */
class Daemonizer
{
    private static final Logger logger = LoggerFactory.getLogger(Daemonizer.class);

    static List<String> childArguments(String... args)
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String arg : args) {
            if (!arg.equals("-d") && !arg.equals("--daemon")) {
                builder.add(arg);
            }
        }
        return builder.build();
    }

    /**
     * System properties and -X settings of this JVM, passed on to the
     * background JVM. Agents and debugger options are not.
     */
    static List<String> jvmOptions(List<String> inputArguments)
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String arg : inputArguments) {
            if (arg.startsWith("-D") || arg.startsWith("-X")) {
                builder.add(arg);
            }
        }
        return builder.build();
    }

    static List<String> commandLine(List<String> jvmOptions, String... args)
    {
        String java = ProcessHandle.current().info().command()
            .orElse(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        return ImmutableList.<String>builder()
            .add(java)
            .addAll(jvmOptions)
            .add("-cp", System.getProperty("java.class.path"))
            .add(Main.class.getName())
            .addAll(childArguments(args))
            .build();
    }

    long start(String... args)
        throws IOException
    {
        List<String> jvmOptions = jvmOptions(ManagementFactory.getRuntimeMXBean().getInputArguments());
        ProcessBuilder pb = new ProcessBuilder(commandLine(jvmOptions, args));
        pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process p = pb.start();
        logger.info("Scheduler started in background with pid {}", p.pid());
        return p.pid();
    }
}
