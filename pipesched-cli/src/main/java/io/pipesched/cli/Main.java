package io.pipesched.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.pipesched.core.config.ConfigException;
import io.pipesched.core.config.ConfigFactory;
import io.pipesched.core.config.SchedulerConfig;
import io.pipesched.core.config.SchedulerConfigLoader;
import io.pipesched.core.lock.ProcessLock;
import io.pipesched.core.scheduler.SchedulerDaemon;
import io.pipesched.core.scheduler.SchedulerModule;
import io.pipesched.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.pipesched.cli.ConfigUtil.defaultConfigPath;
import static io.pipesched.cli.SystemExitException.fatal;
import static io.pipesched.cli.SystemExitException.systemExit;

public class Main
{
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String DEFAULT_PROGRAM_NAME = "pipesched";

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(Map<String, String> env, PrintStream out, PrintStream err)
    {
        this.env = env;
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.pipesched.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static void main(String... args)
    {
        int code = new Main(System.getenv(), System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    public int cli(String... args)
    {
        SchedulerOptions opts = new SchedulerOptions();
        JCommander jc = new JCommander(opts);
        jc.setProgramName(programName);
        jc.setExpandAtSign(false);

        try {
            jc.parse(args);
            if (opts.help) {
                throw usage(null);
            }
            if (!opts.args.isEmpty()) {
                throw usage("Unexpected arguments: " + opts.args);
            }
            configureLogging(opts.logLevel(), opts.logPath);
            return run(opts, args);
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return SystemExitException.USAGE;
        }
        catch (SystemExitException ex) {
            if (ex.getMessage() != null) {
                err.println("error: " + ex.getMessage());
                if (ex.getCode() == SystemExitException.FATAL) {
                    logger.error("{}", ex.getMessage(), ex.getCause());
                }
            }
            return ex.getCode();
        }
        catch (RuntimeException ex) {
            logger.error("Unexpected error", ex);
            err.println("error: " + ex);
            return SystemExitException.FATAL;
        }
    }

    private int run(SchedulerOptions opts, String... args)
        throws SystemExitException
    {
        SchedulerConfigLoader loader = newConfigLoader(opts);
        SchedulerConfig config;
        try {
            config = loader.load();
        }
        catch (IOException | ConfigException ex) {
            throw fatal("Failed to load configuration " + loader.getConfigPath().orNull() + ": " + ex.getMessage(), ex);
        }

        Injector injector = Guice.createInjector(new SchedulerModule(loader, config));

        if (opts.initDatabase) {
            return initDatabase(injector.getInstance(JobStore.class), config);
        }

        if (opts.kill) {
            return kill(injector.getInstance(ProcessLock.class));
        }

        // checked here so that a mismatch is reported before detaching
        newProcessUser().check(config);

        if (opts.daemon) {
            try {
                newDaemonizer().start(args);
            }
            catch (IOException ex) {
                throw fatal("Failed to start scheduler in background", ex);
            }
            return 0;
        }

        ProcessLock lock = injector.getInstance(ProcessLock.class);
        long owner;
        try {
            owner = lock.acquire();
        }
        catch (IOException ex) {
            throw fatal("Failed to create scheduler lock " + lock.getTokenPath(), ex);
        }
        if (owner != lock.getSelfPid()) {
            throw fatal("Scheduler is already running with pid " + owner);
        }

        try {
            injector.getInstance(SchedulerDaemon.class)
                .run(opts.reset, opts.test, Optional.fromNullable(opts.port));
            return 0;
        }
        catch (IOException | ConfigException ex) {
            throw fatal("Scheduler failed: " + ex.getMessage(), ex);
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw fatal("Scheduler was interrupted", ex);
        }
        finally {
            try {
                lock.release();
            }
            catch (IOException ex) {
                logger.warn("Failed to release scheduler lock {}", lock.getTokenPath(), ex);
            }
        }
    }

    @VisibleForTesting
    SchedulerConfigLoader newConfigLoader(SchedulerOptions opts)
    {
        Optional<Path> configPath;
        if (opts.configPath != null) {
            configPath = Optional.of(Paths.get(opts.configPath));
        }
        else {
            Path path = defaultConfigPath(env);
            if (Files.exists(path)) {
                configPath = Optional.of(path);
            }
            else {
                logger.debug("Configuration file not found: {}", path);
                configPath = Optional.absent();
            }
        }

        Properties overrides = new Properties();
        overrides.putAll(opts.configOverrides);
        return new SchedulerConfigLoader(new ConfigFactory(ConfigFactory.objectMapper()), configPath, overrides);
    }

    @VisibleForTesting
    ProcessUser newProcessUser()
    {
        return new ProcessUser();
    }

    @VisibleForTesting
    Daemonizer newDaemonizer()
    {
        return new Daemonizer();
    }

    private int initDatabase(JobStore store, SchedulerConfig config)
        throws SystemExitException
    {
        try {
            store.init();
        }
        catch (IOException ex) {
            throw fatal("Failed to initialize job store in " + config.getDataDirectory(), ex);
        }
        out.println("Initialized job store in " + config.getDataDirectory());
        return 0;
    }

    @VisibleForTesting
    int kill(ProcessLock lock)
        throws SystemExitException
    {
        try {
            long owner = lock.queryOwner();
            if (owner == 0) {
                logger.info("No scheduler is running");
                return 0;
            }
            boolean requested = ProcessHandle.of(owner).map(ProcessHandle::destroy).orElse(false);
            if (requested) {
                logger.info("Sent termination request to scheduler (pid {})", owner);
            }
            else {
                logger.warn("Could not signal scheduler (pid {})", owner);
            }
            lock.forceRelease();
            return 0;
        }
        catch (IOException ex) {
            throw fatal("Failed to read scheduler lock " + lock.getTokenPath(), ex);
        }
    }

    private static void configureLogging(String level, String logPath)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // logback uses system property to embed variables in XML file
        Level lv = Level.toLevel(level.toUpperCase(), Level.INFO);
        System.setProperty("pipesched.log.level", lv.toString());

        String name;
        if (logPath.equals("-")) {
            name = "/io/pipesched/cli/logback-console.xml";
        }
        else {
            System.setProperty("pipesched.log.path", logPath);
            name = "/io/pipesched/cli/logback-file.xml";
        }
        try {
            configurator.doConfigure(Main.class.getResource(name));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " [options...]");
        err.println("  Options:");
        err.println("    -c, --config PATH                scheduler configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("    -d, --daemon                     run in background");
        err.println("    -i, --database                   initialize the job store and exit");
        err.println("    -k, --kill                       stop the running scheduler and exit");
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -p, --port PORT                  status server port");
        err.println("    -R, --reset                      drop queued jobs at startup");
        err.println("    -t, --test                       start and close immediately");
        err.println("    -v, --verbose N                  0: info, 1: debug, 2: trace");
        err.println("    -X KEY=VALUE                     override a configuration key");
        err.println("");
        return systemExit(error);
    }
}
