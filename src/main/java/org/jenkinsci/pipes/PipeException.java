package org.jenkinsci.pipes;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;

/**
 * Base class for failures reported by a {@link PipeBuffer}.
 *
 * The exception carries the name of the pipe it was raised for, so the message stays
 * meaningful after the session that triggered it is gone.
 */
public class PipeException extends IOException {

    private static final long serialVersionUID = 1L;

    @NonNull
    private final String pipeName;

    public PipeException(@CheckForNull String pipeName, @NonNull String message) {
        this(pipeName, message, null);
    }

    public PipeException(@CheckForNull String pipeName, @NonNull String message, @CheckForNull Throwable cause) {
        super(message, cause);
        this.pipeName = pipeName != null ? pipeName : "unknown";
    }

    /**
     * Gets the pipe name.
     * @return Pipe name or {@code unknown} if it is not known.
     */
    @NonNull
    public String getPipeName() {
        return pipeName;
    }

    @Override
    public String getMessage() {
        return String.format("Pipe \"%s\": %s", pipeName, super.getMessage());
    }
}
