package org.jenkinsci.pipes;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.Test;

class PipeSessionTest {

    private final PipeBuffer pipe = new PipeBuffer("streams", 64);

    /**
     * The output stream keeps writing across many fills of a small ring.
     */
    @Test
    void streamsCarryMoreThanCapacity() throws Exception {
        byte[] data = new byte[10000];
        new Random(1).nextBytes(data);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        PipeSession r = pipe.open(OpenMode.READ);
        PipeSession w = pipe.open(OpenMode.WRITE);
        Thread writer = new Thread(() -> {
            try (OutputStream out = w.getOutputStream()) {
                out.write(data);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        writer.start();

        byte[] got = new byte[data.length];
        try (InputStream in = r.getInputStream()) {
            IOUtils.readFully(in, got);
        }
        writer.join(10000);

        assertThat(failure.get(), nullValue());
        assertThat(got, is(data));
        assertThat(w.isClosed(), is(true));
        assertThat(r.isClosed(), is(true));
        assertThat(pipe.isAllocated(), is(false));
    }

    @Test
    void singleBytes() throws Exception {
        try (PipeSession rw = pipe.open(OpenMode.READ_WRITE)) {
            OutputStream out = rw.getOutputStream();
            InputStream in = rw.getInputStream();
            out.write(0xFF);
            out.write('a');
            assertThat(in.available(), is(2));
            assertThat(in.read(), is(0xFF));
            assertThat(in.read(), is((int) 'a'));
            assertThat(in.available(), is(0));
        }
    }

    @Test
    void nonBlockingStreamReportsWouldBlock() throws Exception {
        try (PipeSession r = pipe.open(OpenMode.READ, true)) {
            assertThrows(WouldBlockException.class, () -> r.getInputStream().read());
        }
    }

    @Test
    void interruptedStreamRestoresFlag() throws Exception {
        try (PipeSession r = pipe.open(OpenMode.READ)) {
            AtomicReference<Object> result = new AtomicReference<>();
            Thread reader = new Thread(() -> {
                try {
                    r.getInputStream().read();
                } catch (Exception e) {
                    result.set(Thread.currentThread().isInterrupted() ? e : "interrupt flag was cleared");
                }
            });
            reader.start();
            Threads.awaitWaiting(reader);
            reader.interrupt();
            reader.join(10000);
            assertThat(result.get(), instanceOf(InterruptedIOException.class));
        }
    }

    @Test
    void describesItself() throws Exception {
        PipeSession s = pipe.open(OpenMode.WRITE, true);
        assertThat(s.toString(), is("PipeSession[streams, WRITE, non-blocking]"));
        assertThat(pipe.toString(), containsString("readers=0, writers=1"));
        s.close();
        assertThat(s.toString(), containsString("closed"));
        assertThat(pipe.toString(), containsString("unallocated"));
    }

    @Test
    void negativeLengthIsRejected() throws Exception {
        try (PipeSession r = pipe.open(OpenMode.READ)) {
            assertThrows(IllegalArgumentException.class, () -> r.read(-1));
            assertThrows(IndexOutOfBoundsException.class, () -> r.read(new byte[4], 2, 4));
        }
    }
}
