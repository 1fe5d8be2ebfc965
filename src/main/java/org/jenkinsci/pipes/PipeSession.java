package org.jenkinsci.pipes;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A caller's handle to a {@link PipeBuffer}, obtained from {@link PipeBuffer#open(OpenMode, boolean)}.
 *
 * <p>
 * The session only remembers how it was opened; all the state it operates on lives in the pipe.
 * Reads and writes may transfer fewer bytes than requested, and a non-blocking session reports an empty
 * (for reads) or full (for writes) pipe with {@link WouldBlockException}. There is no positioning: the
 * stream is consumed strictly in order.
 *
 * <p>
 * {@link #close()} gives the reference back to the pipe. Closing twice is harmless.
 *
 * @since 1.0
 */
public class PipeSession implements Closeable {

    @NonNull
    private final PipeBuffer pipe;

    @NonNull
    private final OpenMode mode;

    private final boolean nonBlocking;

    private final AtomicBoolean closed = new AtomicBoolean();

    PipeSession(@NonNull PipeBuffer pipe, @NonNull OpenMode mode, boolean nonBlocking) {
        this.pipe = pipe;
        this.mode = mode;
        this.nonBlocking = nonBlocking;
    }

    @NonNull
    public PipeBuffer getPipe() {
        return pipe;
    }

    @NonNull
    public OpenMode getMode() {
        return mode;
    }

    public boolean isNonBlocking() {
        return nonBlocking;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Reads as many bytes as are available, up to {@code dst.remaining()}.
     *
     * @return
     *      Number of bytes transferred into {@code dst}. 0 only if {@code dst} has no room.
     * @throws WouldBlockException
     *      The session is non-blocking and the pipe is empty.
     * @throws PipeFaultException
     *      {@code dst} could not be written to. Nothing was consumed from the pipe.
     * @throws PipeClosedException
     *      The session or the pipe is closed.
     * @throws InterruptedException
     *      The thread was interrupted while waiting. Nothing was consumed from the pipe.
     * @throws java.nio.channels.NonReadableChannelException
     *      The session was not opened for reading.
     */
    public int read(@NonNull ByteBuffer dst) throws InterruptedException, PipeException {
        ensureOpen();
        return pipe.read(this, dst);
    }

    public int read(@NonNull byte[] buf) throws InterruptedException, PipeException {
        return read(buf, 0, buf.length);
    }

    /**
     * @see InputStream#read(byte[], int, int)
     */
    public int read(@NonNull byte[] buf, int start, int len) throws InterruptedException, PipeException {
        return read(ByteBuffer.wrap(buf, start, len));
    }

    /**
     * Reads up to {@code maxLen} bytes.
     *
     * @return
     *      Exactly the bytes that were read, which may be fewer than {@code maxLen}.
     */
    @NonNull
    public byte[] read(int maxLen) throws InterruptedException, PipeException {
        if (maxLen < 0) {
            throw new IllegalArgumentException("Negative length: " + maxLen);
        }
        byte[] buf = new byte[maxLen];
        int n = read(buf);
        return n == maxLen ? buf : Arrays.copyOf(buf, n);
    }

    /**
     * Writes as many bytes as fit, up to {@code src.remaining()}.
     *
     * @return
     *      Number of bytes taken from {@code src}. 0 only if {@code src} is empty.
     *      The caller is responsible for writing the rest.
     * @throws WouldBlockException
     *      The session is non-blocking and the pipe is full.
     * @throws PipeClosedException
     *      The session or the pipe is closed.
     * @throws InterruptedException
     *      The thread was interrupted while waiting. Nothing was committed to the pipe.
     * @throws java.nio.channels.NonWritableChannelException
     *      The session was not opened for writing.
     */
    public int write(@NonNull ByteBuffer src) throws InterruptedException, PipeException {
        ensureOpen();
        return pipe.write(this, src);
    }

    public int write(@NonNull byte[] buf) throws InterruptedException, PipeException {
        return write(buf, 0, buf.length);
    }

    public int write(@NonNull byte[] buf, int start, int len) throws InterruptedException, PipeException {
        return write(ByteBuffer.wrap(buf, start, len));
    }

    private void ensureOpen() throws PipeClosedException {
        if (closed.get()) {
            throw new PipeClosedException(pipe.getName(), "session is already closed");
        }
    }

    /**
     * Releases this session's reference on the pipe. Never fails.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            pipe.release(this);
        }
    }

    /**
     * Wraps the reader end of this session to {@link InputStream}.
     *
     * A blocking session's stream waits for data; a non-blocking one fails with {@link WouldBlockException}.
     * Closing the stream closes the session.
     */
    @NonNull
    public InputStream getInputStream() {
        return new InputStream() {
            @Override
            public int read() throws IOException {
                byte[] b = new byte[1];
                int n = read(b, 0, 1);
                if (n == 0) {
                    throw new AssertionError();
                }
                return ((int) b[0]) & 0xFF;
            }

            @Override
            public int read(@NonNull byte[] b, int off, int len) throws IOException {
                try {
                    return PipeSession.this.read(b, off, len);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw (InterruptedIOException) new InterruptedIOException().initCause(e);
                }
            }

            @Override
            public int available() {
                return pipe.readable();
            }

            @Override
            public void close() {
                PipeSession.this.close();
            }
        };
    }

    /**
     * Wraps the writer end of this session to {@link OutputStream}.
     *
     * Unlike {@link #write(byte[], int, int)}, the stream keeps writing until every byte has been accepted.
     * Closing the stream closes the session.
     */
    @NonNull
    public OutputStream getOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                write(new byte[] {(byte) b}, 0, 1);
            }

            @Override
            public void write(@NonNull byte[] b, int off, int len) throws IOException {
                try {
                    while (len > 0) {
                        int n = PipeSession.this.write(b, off, len);
                        off += n;
                        len -= n;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw (InterruptedIOException) new InterruptedIOException().initCause(e);
                }
            }

            @Override
            public void close() {
                PipeSession.this.close();
            }
        };
    }

    @Override
    public String toString() {
        return "PipeSession[" + pipe.getName() + ", " + mode + (nonBlocking ? ", non-blocking" : "")
                + (closed.get() ? ", closed" : "") + "]";
    }
}
