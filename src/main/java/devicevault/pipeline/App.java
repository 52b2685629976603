package devicevault.pipeline;

import devicevault.pipeline.config.Dependencies;
import devicevault.pipeline.config.PipelineConfig;
import devicevault.pipeline.scheduler.LockReport;
import devicevault.pipeline.scheduler.SchedulerDaemon;
import devicevault.pipeline.scheduler.SchedulerLock;
import devicevault.pipeline.server.PipelineHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Command line entry point. One process runs one role:
 *
 * <pre>
 * scheduler [--check-lock | --clear-lock]
 * collector-worker [queue...]
 * storage-worker backend...
 * collection-consumer
 * storage-consumer
 * api
 * </pre>
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_LOCK_FAILED = SchedulerDaemon.EXIT_LOCK_FAILED;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_STARTUP = 3;

    private static final long STOP_JOIN_MILLIS = 30_000;

    private static final String USAGE = String.join(System.lineSeparator(),
            "usage: devicevault <role> [args]",
            "  scheduler [--check-lock | --clear-lock]",
            "  collector-worker [queue...]",
            "  storage-worker <backend...>",
            "  collection-consumer",
            "  storage-consumer",
            "  api");

    private final PrintStream out;
    private final PrintStream err;
    private final Function<PipelineConfig, Dependencies> dependencyFactory;

    App(PrintStream out, PrintStream err, Function<PipelineConfig, Dependencies> dependencyFactory) {
        this.out = out;
        this.err = err;
        this.dependencyFactory = dependencyFactory;
    }

    public static void main(String[] args) {
        int code = new App(System.out, System.err, Dependencies::create).run(args, PipelineConfig::fromEnv);
        // a normal return lets shutdown hooks run; exit() only reports failure
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    int run(String[] args, Supplier<PipelineConfig> configSource) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String role = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);

        String usageError = validate(role, rest);
        if (usageError != null) {
            err.println(usageError);
            err.println(USAGE);
            return EXIT_USAGE;
        }

        PipelineConfig config;
        try {
            config = configSource.get();
        } catch (RuntimeException e) {
            log.error("Invalid configuration", e);
            return EXIT_STARTUP;
        }

        if (role.equals("scheduler") && rest.isEmpty() && !config.schedulerEnabled()) {
            log.info("Scheduler disabled by configuration; exiting");
            return EXIT_OK;
        }

        Dependencies deps;
        try {
            deps = dependencyFactory.apply(config);
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            return EXIT_STARTUP;
        }

        try {
            switch (role) {
                case "scheduler":
                    return runScheduler(deps, rest);
                case "collector-worker": {
                    var worker = deps.collectorWorker(rest);
                    return runUntilStopped(worker, worker::stop);
                }
                case "storage-worker": {
                    var worker = deps.storageWorker(rest);
                    return runUntilStopped(worker, worker::stop);
                }
                case "collection-consumer": {
                    var consumer = deps.collectionResultConsumer();
                    return runUntilStopped(consumer, consumer::stop);
                }
                case "storage-consumer": {
                    var consumer = deps.storageResultConsumer();
                    return runUntilStopped(consumer, consumer::stop);
                }
                case "api":
                    return runApi(deps);
                default:
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (RuntimeException e) {
            log.error("Unrecoverable error in {}", role, e);
            return EXIT_STARTUP;
        } finally {
            deps.close();
        }
    }

    /**
     * @return an error message, or null when the arguments are acceptable
     */
    static String validate(String role, List<String> rest) {
        switch (role) {
            case "scheduler":
                if (rest.size() > 1 || (rest.size() == 1
                        && !rest.get(0).equals("--check-lock") && !rest.get(0).equals("--clear-lock"))) {
                    return "scheduler accepts only --check-lock or --clear-lock";
                }
                return null;
            case "collector-worker":
                return null;
            case "storage-worker":
                return rest.isEmpty() ? "storage-worker needs at least one backend kind" : null;
            case "collection-consumer":
            case "storage-consumer":
            case "api":
                return rest.isEmpty() ? null : role + " takes no arguments";
            default:
                return "unknown role: " + role;
        }
    }

    private int runScheduler(Dependencies deps, List<String> rest) {
        if (!rest.isEmpty()) {
            SchedulerLock lock = deps.schedulerLock();
            if (rest.get(0).equals("--check-lock")) {
                out.println(lock.check().describe());
            } else {
                LockReport before = lock.clear();
                out.println("cleared lock (was " + before.describe() + ")");
            }
            return EXIT_OK;
        }

        SchedulerDaemon daemon = deps.schedulerDaemon();
        Thread hook = new Thread(daemon::shutdown, "devicevault-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return daemon.run();
    }

    private int runApi(Dependencies deps) {
        PipelineHttpServer server = deps.httpServer();
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "devicevault-shutdown"));
        try {
            server.awaitClose();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            server.stop();
        }
        return EXIT_OK;
    }

    /**
     * Run a loop in the calling thread; a shutdown hook asks it to stop and
     * waits for the current message to finish.
     */
    private int runUntilStopped(Runnable loop, Runnable stop) {
        Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            stop.run();
            try {
                main.join(STOP_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "devicevault-shutdown"));
        loop.run();
        return EXIT_OK;
    }
}
