package org.jenkinsci.pipes;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Indicates that the session is already closed, or that the pipe itself was destroyed
 * while the call was in progress.
 */
public class PipeClosedException extends PipeException {

    private static final long serialVersionUID = 1L;

    public PipeClosedException(@NonNull String pipeName, @NonNull String message) {
        super(pipeName, message);
    }
}
