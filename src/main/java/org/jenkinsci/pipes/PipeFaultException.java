package org.jenkinsci.pipes;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Indicates that the caller-supplied source or destination could not be accessed while
 * bytes were being copied. The pipe has not been modified.
 */
public class PipeFaultException extends PipeException {

    private static final long serialVersionUID = 1L;

    public PipeFaultException(@NonNull String pipeName, @NonNull String message, @NonNull Throwable cause) {
        super(pipeName, message, cause);
    }
}
