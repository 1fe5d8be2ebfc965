package org.jenkinsci.pipes.registry;

import org.jenkinsci.pipes.PipeException;

/**
 * Indicates that no pipe is registered under the requested identifier.
 */
public class NoSuchPipeException extends PipeException {

    private static final long serialVersionUID = 1L;

    private final int id;

    public NoSuchPipeException(int id) {
        super(PipeRegistry.nameOf(id), "no such pipe");
        this.id = id;
    }

    public int getId() {
        return id;
    }
}
