package org.jenkinsci.pipes;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Indicates that the ring storage could not be allocated on first open.
 * The pipe stays unallocated.
 */
public class PipeAllocationException extends PipeException {

    private static final long serialVersionUID = 1L;

    public PipeAllocationException(@NonNull String pipeName, int capacity, @NonNull Throwable cause) {
        super(pipeName, "could not allocate " + capacity + " bytes of ring storage", cause);
    }
}
