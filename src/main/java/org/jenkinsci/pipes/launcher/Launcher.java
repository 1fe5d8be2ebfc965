package org.jenkinsci.pipes.launcher;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.jenkinsci.pipes.registry.PipeRegistry;
import org.jenkinsci.pipes.registry.PipeRegistryConfig;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Entry point that hosts a {@link PipeRegistry} for the lifetime of the JVM.
 *
 * <p>
 * The pipes are created when the launcher starts and destroyed by a shutdown hook.
 */
public class Launcher {

    @Option(
            name = "-pipes",
            metaVar = "N",
            handler = PositiveIntOptionHandler.class,
            usage = "Number of pipes to create")
    public int pipeCount = PipeRegistryConfig.DEFAULT_PIPE_COUNT;

    @Option(
            name = "-size",
            metaVar = "BYTES",
            handler = PositiveIntOptionHandler.class,
            usage = "Ring buffer capacity of every pipe, in bytes")
    public int capacity = PipeRegistryConfig.DEFAULT_CAPACITY;

    @Option(name = "-firstId", metaVar = "ID", usage = "Identifier of the first pipe; the others follow consecutively")
    public int firstId = PipeRegistryConfig.DEFAULT_FIRST_ID;

    /**
     * Path to the JUL property file.
     * If not set, the {@code java.util.logging.config.file} system property applies as usual.
     */
    @CheckForNull
    @Option(name = "-loggingConfig", usage = "Path to the property file with java.util.logging settings")
    public File loggingConfigFilePath = null;

    @Option(name = "-help", usage = "Show this help message")
    public boolean showHelp = false;

    public static void main(String... args) throws IOException, InterruptedException {
        Launcher launcher = new Launcher();
        CmdLineParser parser = new CmdLineParser(launcher);
        try {
            parser.parseArgument(args);
            if (launcher.showHelp) {
                parser.printUsage(System.out);
                return;
            }
            try {
                launcher.toConfig();
            } catch (IllegalArgumentException e) {
                throw new CmdLineException(parser, e.getMessage(), e);
            }
            launcher.run();
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            System.err.println("java -jar pipe-buffer.jar [options...]");
            parser.printUsage(System.err);
            System.err.println();
        }
    }

    /**
     * Creates the pipes and blocks until the JVM shuts down.
     */
    public void run() throws IOException, InterruptedException {
        setupLogging();
        PipeRegistry registry = createRegistry();
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.log(Level.INFO, "Shutting down {0} pipe(s)", registry.size());
            registry.close();
            shutdown.countDown();
        }, "Pipe registry shutdown"));
        shutdown.await();
    }

    /**
     * Configuration described by the command line.
     *
     * @throws IllegalArgumentException if the values do not form a valid configuration.
     */
    @NonNull
    public PipeRegistryConfig toConfig() {
        return new PipeRegistryConfig(pipeCount, capacity, firstId);
    }

    @NonNull
    public PipeRegistry createRegistry() {
        PipeRegistry registry = new PipeRegistry(toConfig());
        if (LOGGER.isLoggable(Level.INFO)) {
            LOGGER.log(
                    Level.INFO,
                    "Created {0} pipe(s) of {1} bytes each with identifiers {2}",
                    new Object[] {registry.size(), registry.getCapacity(), registry.getIds()});
        }
        return registry;
    }

    /**
     * Reads {@link #loggingConfigFilePath}, if set, into the {@link LogManager}.
     */
    @SuppressFBWarnings(
            value = "PATH_TRAVERSAL_IN",
            justification = "The logging configuration path is provided by the user who launches the process.")
    public void setupLogging() throws IOException {
        if (loggingConfigFilePath == null) {
            return;
        }
        try (FileInputStream fis = new FileInputStream(loggingConfigFilePath)) {
            LogManager.getLogManager().readConfiguration(fis);
        }
        LOGGER.log(Level.FINE, "Read logging configuration from file: {0}", loggingConfigFilePath);
    }

    private static final Logger LOGGER = Logger.getLogger(Launcher.class.getName());
}
