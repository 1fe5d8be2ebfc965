package org.jenkinsci.pipes.launcher;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.jenkinsci.pipes.registry.PipeRegistry;
import org.jenkinsci.pipes.registry.PipeRegistryConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

class LauncherTest {

    @AfterEach
    void restoreLogging() throws Exception {
        LogManager.getLogManager().readConfiguration();
    }

    private static Launcher parse(String... args) throws CmdLineException {
        Launcher launcher = new Launcher();
        new CmdLineParser(launcher).parseArgument(args);
        return launcher;
    }

    @Test
    void defaults() throws Exception {
        PipeRegistryConfig config = parse().toConfig();
        assertThat(config.getPipeCount(), is(PipeRegistryConfig.DEFAULT_PIPE_COUNT));
        assertThat(config.getCapacity(), is(PipeRegistryConfig.DEFAULT_CAPACITY));
        assertThat(config.getFirstId(), is(PipeRegistryConfig.DEFAULT_FIRST_ID));
    }

    @Test
    void options() throws Exception {
        Launcher launcher = parse("-pipes", "4", "-size", "128", "-firstId", "10");
        try (PipeRegistry registry = launcher.createRegistry()) {
            assertThat(registry.getIds(), contains(10, 11, 12, 13));
            assertThat(registry.getCapacity(), is(128));
        }
    }

    @Test
    void rejectsNonPositiveCount() {
        CmdLineException e = assertThrows(CmdLineException.class, () -> parse("-pipes", "0"));
        assertThat(e.getMessage(), containsString("-pipes"));
    }

    @Test
    void rejectsNonNumericSize() {
        CmdLineException e = assertThrows(CmdLineException.class, () -> parse("-size", "lots"));
        assertThat(e.getMessage(), containsString("lots"));
    }

    @Test
    void negativeFirstIdIsInvalidConfig() {
        Launcher launcher = new Launcher();
        launcher.firstId = -3;
        assertThrows(IllegalArgumentException.class, launcher::toConfig);
    }

    @Test
    void readsLoggingConfig() throws Exception {
        Launcher launcher = parse(
                "-loggingConfig",
                new File(getClass().getResource("logging.properties").toURI()).getPath());
        launcher.setupLogging();
        assertThat(Logger.getLogger("org.jenkinsci.pipes").getLevel(), is(Level.FINEST));
    }

    @Test
    void missingLoggingConfig() throws Exception {
        Launcher launcher = parse("-loggingConfig", "does-not-exist.properties");
        assertThrows(FileNotFoundException.class, launcher::setupLogging);
    }
}
