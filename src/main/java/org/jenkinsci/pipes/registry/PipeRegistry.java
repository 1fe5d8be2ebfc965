package org.jenkinsci.pipes.registry;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jenkinsci.pipes.OpenMode;
import org.jenkinsci.pipes.PipeBuffer;
import org.jenkinsci.pipes.PipeClosedException;
import org.jenkinsci.pipes.PipeException;
import org.jenkinsci.pipes.PipeSession;

/**
 * Owns a fixed set of {@link PipeBuffer}s sharing one capacity, and hands out sessions on them by identifier.
 *
 * <p>
 * All pipes are created up front, unallocated, when the registry is constructed. Identifiers are
 * consecutive, starting at {@link PipeRegistryConfig#getFirstId()}. {@link #close()} destroys every pipe;
 * the registry cannot be reopened.
 *
 * <p>
 * Pass the registry to whatever serves open requests; there is no global instance.
 */
public class PipeRegistry implements Closeable {

    @NonNull
    private final PipeRegistryConfig config;

    /**
     * Identifier to pipe, in identifier order. Never modified after construction.
     */
    @NonNull
    private final Map<Integer, PipeBuffer> pipes;

    private volatile boolean closed;

    public PipeRegistry(@NonNull PipeRegistryConfig config) {
        this.config = config;
        Map<Integer, PipeBuffer> m = new LinkedHashMap<>();
        for (int i = 0; i < config.getPipeCount(); i++) {
            int id = config.getFirstId() + i;
            m.put(id, new PipeBuffer(nameOf(id), config.getCapacity()));
        }
        this.pipes = Collections.unmodifiableMap(m);
        LOGGER.log(Level.FINE, "Created {0}", config);
    }

    static String nameOf(int id) {
        return "pipe" + id;
    }

    @NonNull
    public PipeRegistryConfig getConfig() {
        return config;
    }

    public int getCapacity() {
        return config.getCapacity();
    }

    public int size() {
        return pipes.size();
    }

    /**
     * Identifiers of all pipes, in ascending order.
     */
    @NonNull
    public List<Integer> getIds() {
        return new ArrayList<>(pipes.keySet());
    }

    /**
     * Resolves an identifier.
     *
     * @throws NoSuchPipeException if the identifier is not mapped.
     */
    @NonNull
    public PipeBuffer get(int id) throws NoSuchPipeException {
        PipeBuffer pipe = pipes.get(id);
        if (pipe == null) {
            throw new NoSuchPipeException(id);
        }
        return pipe;
    }

    /**
     * Opens a blocking session on the pipe with the given identifier.
     */
    @NonNull
    public PipeSession open(int id, @NonNull OpenMode mode) throws InterruptedException, PipeException {
        return open(id, mode, false);
    }

    /**
     * Opens a session on the pipe with the given identifier.
     *
     * @throws NoSuchPipeException if the identifier is not mapped.
     * @throws IllegalStateException if the registry has been closed, including by a
     *      {@link #close()} that runs concurrently with this call.
     * @see PipeBuffer#open(OpenMode, boolean)
     */
    @NonNull
    public PipeSession open(int id, @NonNull OpenMode mode, boolean nonBlocking)
            throws InterruptedException, PipeException {
        checkOpen(null);
        PipeBuffer pipe = get(id);
        PipeSession session;
        try {
            session = pipe.open(mode, nonBlocking);
        } catch (PipeClosedException e) {
            // close() destroyed the pipe after the check above
            checkOpen(e);
            throw e;
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Opened " + session);
        }
        return session;
    }

    private void checkOpen(@CheckForNull PipeClosedException cause) {
        if (closed) {
            throw new IllegalStateException("Pipe registry is already closed", cause);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Destroys every pipe. Threads blocked on any of them fail with
     * {@link org.jenkinsci.pipes.PipeClosedException}. Calling this again does nothing.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        for (PipeBuffer pipe : pipes.values()) {
            pipe.destroy();
        }
        LOGGER.log(Level.FINE, "Closed pipe registry of {0} pipe(s)", pipes.size());
    }

    private static final Logger LOGGER = Logger.getLogger(PipeRegistry.class.getName());
}
