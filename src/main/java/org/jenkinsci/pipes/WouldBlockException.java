package org.jenkinsci.pipes;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Indicates that a non-blocking session found no data to read or no space to write.
 *
 * Nothing was transferred; the caller may retry later.
 */
public class WouldBlockException extends PipeException {

    private static final long serialVersionUID = 1L;

    public WouldBlockException(@NonNull String pipeName, @NonNull String message) {
        super(pipeName, message);
    }
}
