package io.pipesched.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;

public class SchedulerOptions
{
    @Parameter()
    List<String> args = new ArrayList<>();

    @Parameter(names = {"-d", "--daemon"})
    boolean daemon = false;

    @Parameter(names = {"-i", "--database"})
    boolean initDatabase = false;

    @Parameter(names = {"-k", "--kill"})
    boolean kill = false;

    @Parameter(names = {"-L", "--log"})
    String logPath = "-";

    @Parameter(names = {"-p", "--port"})
    Integer port = null;

    @Parameter(names = {"-R", "--reset"})
    boolean reset = false;

    @Parameter(names = {"-t", "--test"})
    boolean test = false;

    @Parameter(names = {"-v", "--verbose"})
    int verbose = 0;

    @Parameter(names = {"-c", "--config"})
    String configPath = null;

    @DynamicParameter(names = "-X")
    Map<String, String> configOverrides = new HashMap<>();

    @Parameter(names = {"-h", "-help", "--help"}, help = true)
    boolean help = false;

    String logLevel()
    {
        if (verbose <= 0) {
            return "info";
        }
        else if (verbose == 1) {
            return "debug";
        }
        else {
            return "trace";
        }
    }
}
