package org.jenkinsci.pipes;

/**
 * Access requested when a {@link PipeSession} is opened.
 */
public enum OpenMode {
    READ(true, false),
    WRITE(false, true),
    READ_WRITE(true, true);

    private final boolean readable;
    private final boolean writable;

    OpenMode(boolean readable, boolean writable) {
        this.readable = readable;
        this.writable = writable;
    }

    public boolean isReadable() {
        return readable;
    }

    public boolean isWritable() {
        return writable;
    }
}
