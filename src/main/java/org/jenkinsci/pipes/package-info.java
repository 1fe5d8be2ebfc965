/**
 * Bounded ring buffer shared between reader and writer sessions.
 *
 * <p>
 * A {@link org.jenkinsci.pipes.PipeBuffer} holds a fixed-capacity byte ring. Callers open
 * {@link org.jenkinsci.pipes.PipeSession}s on it for reading, writing or both, in blocking or non-blocking mode.
 * Bytes come out in the order they went in, possibly split differently across calls. The ring is allocated
 * by the first open and discarded once the last session is closed.
 */
package org.jenkinsci.pipes;
