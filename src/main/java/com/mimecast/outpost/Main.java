package com.mimecast.outpost;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.config.ConfigError;
import com.mimecast.outpost.main.Config;
import com.mimecast.outpost.main.Factories;
import com.mimecast.outpost.queue.dispatch.QueueManager;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/**
 * Main runnable.
 *
 * <p>This implements the commandline --check and --run options.
 * <p>Both take the queue configuration file with --config.
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "outpost.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Outbound delivery queue";

    private final String[] args;
    private int exitCode = 0;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        Main main = new Main(args);
        if (main.getExitCode() != 0) {
            System.exit(main.getExitCode());
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            exitCode = 2;
            return;
        }

        CommandLine cmd = opt.get();
        if (!cmd.hasOption("config") || !(cmd.hasOption("check") || cmd.hasOption("run"))) {
            optionsUsage(options());
            exitCode = 2;
            return;
        }

        try {
            Config.initQueue(cmd.getOptionValue("config"));
        } catch (IOException e) {
            log("Unable to read config: " + e.getMessage());
            exitCode = 1;
            return;
        }

        // Check config.
        if (cmd.hasOption("check")) {
            exitCode = check();
        }

        // Run housekeeper.
        else {
            run();
        }
    }

    /**
     * Prints configuration errors.
     *
     * @return Exit code, 1 if any errors were found.
     */
    int check() {
        List<ConfigError> errors = Config.getCatalog().getErrors();
        for (ConfigError error : errors) {
            log(error.toString());
        }
        log(errors.isEmpty() ? "Configuration OK" : "Configuration errors: " + errors.size());
        return errors.isEmpty() ? 0 : 1;
    }

    /**
     * Starts the queue housekeeper and blocks until shutdown.
     */
    private void run() {
        BasicConfig housekeeper = Config.getQueue().getSection("queue").getSection("housekeeper");
        QueueManager manager = new QueueManager(Config.getCatalog(), Config.getResolver(),
                Factories.getQueueStore(), Factories.getCounterStore(), Factories.getTransport())
                .setMaxEventsPerTick(Math.toIntExact(housekeeper.getLongProperty("batch", 100L)));

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            manager.shutdown(housekeeper.getLongProperty("shutdown-timeout", 30L));
            latch.countDown();
        }, "outpost-shutdown"));

        manager.start(housekeeper.getLongProperty("initial-delay", 10L), housekeeper.getLongProperty("interval", 1L));

        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for shutdown");
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(null, "check", false, "Validate configuration and exit");
        options.addOption(null, "config", true, "Queue configuration file path");
        options.addOption(null, "run", false, "Run queue housekeeper");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        StringWriter writer = new StringWriter();
        new HelpFormatter().printHelp(new PrintWriter(writer), HelpFormatter.DEFAULT_WIDTH, " ", "", options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, "", true);

        log(writer.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Gets exit code.
     *
     * @return Integer.
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
