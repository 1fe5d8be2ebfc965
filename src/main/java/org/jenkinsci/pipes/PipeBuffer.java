package org.jenkinsci.pipes;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.nio.channels.NonReadableChannelException;
import java.nio.channels.NonWritableChannelException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.jcip.annotations.GuardedBy;

/**
 * Bounded ring buffer shared by any number of reader and writer {@link PipeSession}s.
 *
 * <p>
 * The storage is a single fixed {@code byte[]} of {@link #getCapacity()} bytes, reused cyclically
 * through a read cursor and a write cursor. The storage only exists while at least one
 * session is open: the first {@link #open(OpenMode, boolean)} allocates it, and the release of the last
 * session drops it, so nothing written before a complete drain-and-reopen cycle can be read afterwards.
 *
 * <p>
 * Every field is guarded by one {@link ReentrantLock}. Readers wait on {@code dataAvailable} while the buffer
 * is empty, writers wait on {@code spaceAvailable} while it is full. A wait always re-tests its predicate after
 * waking up, since several waiters may race for the same bytes. Reads and writes transfer as much as they can
 * and report the amount; they never retry internally.
 *
 * <p>
 * All blocking is interruptible and an interrupted call leaves the buffer untouched.
 *
 * @since 1.0
 */
public class PipeBuffer {

    @NonNull
    private final String name;

    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Signalled whenever bytes are committed by a writer.
     */
    private final Condition dataAvailable = lock.newCondition();

    /**
     * Signalled whenever bytes are consumed by a reader.
     */
    private final Condition spaceAvailable = lock.newCondition();

    /**
     * Ring storage, {@code null} while no session is open.
     */
    @GuardedBy("lock")
    @CheckForNull
    private byte[] storage;

    /**
     * Next place to read from, [0,capacity)
     */
    @GuardedBy("lock")
    private int readCursor;

    /**
     * Next place to write to, [0,capacity)
     */
    @GuardedBy("lock")
    private int writeCursor;

    /**
     * Number of valid unread bytes in {@link #storage}.
     */
    @GuardedBy("lock")
    private int filledCount;

    @GuardedBy("lock")
    private int readerCount;

    @GuardedBy("lock")
    private int writerCount;

    /**
     * Set once by {@link #destroy()}. A destroyed pipe never allocates storage again.
     */
    @GuardedBy("lock")
    private boolean destroyed;

    public PipeBuffer(@NonNull String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pipe capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
    }

    @NonNull
    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Opens a blocking session.
     *
     * @see #open(OpenMode, boolean)
     */
    @NonNull
    public PipeSession open(@NonNull OpenMode mode) throws InterruptedException, PipeException {
        return open(mode, false);
    }

    /**
     * Opens a new session on this pipe.
     *
     * The first open allocates the ring storage and resets both cursors and the fill count.
     * Later opens only add to the reader and writer counts.
     *
     * @param mode
     *      Which ends of the pipe the session may use.
     * @param nonBlocking
     *      If true, reads and writes of the session fail with {@link WouldBlockException} instead of waiting.
     * @throws InterruptedException
     *      If the thread was interrupted while acquiring the lock.
     * @throws PipeAllocationException
     *      If the ring storage could not be allocated. The pipe stays unallocated.
     * @throws PipeClosedException
     *      If the pipe has been destroyed.
     */
    @NonNull
    public PipeSession open(@NonNull OpenMode mode, boolean nonBlocking) throws InterruptedException, PipeException {
        lock.lockInterruptibly();
        try {
            assert invariantsHold();
            if (destroyed) {
                throw new PipeClosedException(name, "pipe has been destroyed");
            }
            if (storage == null) {
                try {
                    storage = new byte[capacity];
                } catch (OutOfMemoryError e) {
                    LOGGER.log(Level.WARNING, e, () -> "Could not allocate ring storage for " + name);
                    throw new PipeAllocationException(name, capacity, e);
                }
                readCursor = 0;
                writeCursor = 0;
                filledCount = 0;
                LOGGER.log(Level.FINE, "Allocated {0} bytes of ring storage for {1}", new Object[] {capacity, name});
            }
            if (mode.isReadable()) {
                readerCount++;
            }
            if (mode.isWritable()) {
                writerCount++;
            }
            assert invariantsHold();
        } finally {
            lock.unlock();
        }
        return new PipeSession(this, mode, nonBlocking);
    }

    /**
     * Moves up to {@code dst.remaining()} bytes from the pipe into {@code dst}.
     *
     * @return
     *      Number of bytes read, at least 1 unless {@code dst} has no room.
     *      May be less than {@code dst.remaining()}.
     */
    int read(@NonNull PipeSession session, @NonNull ByteBuffer dst) throws InterruptedException, PipeException {
        if (!session.getMode().isReadable()) {
            throw new NonReadableChannelException();
        }
        int maxLen = dst.remaining();
        if (maxLen == 0) {
            return 0;
        }

        lock.lockInterruptibly();
        try {
            assert invariantsHold();
            while (true) {
                checkUsable(session);
                if (filledCount > 0) {
                    break;
                }
                if (session.isNonBlocking()) {
                    throw new WouldBlockException(name, "no data available");
                }
                // wait until a writer gives us something
                dataAvailable.await();
            }

            byte[] buf = storage;
            assert buf != null;
            int n = Math.min(maxLen, filledCount);
            int top = Math.min(n, capacity - readCursor);
            int start = dst.position();
            try {
                dst.put(buf, readCursor, top);
                if (n > top) {
                    dst.put(buf, 0, n - top);
                }
            } catch (ReadOnlyBufferException | BufferOverflowException | IndexOutOfBoundsException e) {
                dst.position(start);
                throw new PipeFaultException(name, "could not copy " + n + " bytes to the destination", e);
            }

            readCursor = (readCursor + n) % capacity;
            filledCount -= n;
            assert invariantsHold();

            spaceAvailable.signalAll();
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer(String.format("read(%s,%d)->%d", name, maxLen, n));
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves up to {@code src.remaining()} bytes from {@code src} into the pipe.
     * The amount is bounded by the free space in the ring, never by its fill level.
     *
     * @return
     *      Number of bytes written, at least 1 unless {@code src} is empty.
     *      May be less than {@code src.remaining()}; the caller retries for the remainder.
     *
     * Unlike {@link #read(PipeSession, ByteBuffer)} this cannot fault: any buffer can be read from,
     * {@code n} never exceeds {@code src.remaining()} and the ring offsets stay within the storage.
     */
    int write(@NonNull PipeSession session, @NonNull ByteBuffer src) throws InterruptedException, PipeException {
        if (!session.getMode().isWritable()) {
            throw new NonWritableChannelException();
        }
        int len = src.remaining();
        if (len == 0) {
            return 0;
        }

        lock.lockInterruptibly();
        try {
            assert invariantsHold();
            while (true) {
                checkUsable(session);
                if (filledCount < capacity) {
                    break;
                }
                if (session.isNonBlocking()) {
                    throw new WouldBlockException(name, "no space available");
                }
                // wait until a reader makes some room
                spaceAvailable.await();
            }

            byte[] buf = storage;
            assert buf != null;
            int n = Math.min(len, capacity - filledCount);
            int top = Math.min(n, capacity - writeCursor);
            src.get(buf, writeCursor, top);
            if (n > top) {
                src.get(buf, 0, n - top);
            }

            writeCursor = (writeCursor + n) % capacity;
            filledCount += n;
            assert invariantsHold();

            dataAvailable.signalAll();
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer(String.format("write(%s,%d)->%d", name, len, n));
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gives up the reference held by the session.
     *
     * When the last reader or writer goes away the ring storage is dropped.
     * This method does not respond to interruption and never fails.
     */
    void release(@NonNull PipeSession session) {
        lock.lock();
        try {
            assert invariantsHold();
            if (session.getMode().isReadable()) {
                readerCount--;
            }
            if (session.getMode().isWritable()) {
                writerCount--;
            }
            if (readerCount + writerCount == 0 && storage != null) {
                releaseRing();
                LOGGER.log(Level.FINE, "Released ring storage of {0}", name);
            }
            // a thread may still be blocked on behalf of the released session
            dataAvailable.signalAll();
            spaceAvailable.signalAll();
            assert invariantsHold();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tears the pipe down for good.
     *
     * The ring storage is dropped, every blocked reader and writer wakes up and fails with
     * {@link PipeClosedException}, and so does any later read, write or open. Sessions may still be released.
     *
     * Only meant to be called by the owner of the pipe, such as {@link org.jenkinsci.pipes.registry.PipeRegistry}.
     */
    public void destroy() {
        lock.lock();
        try {
            if (destroyed) {
                return;
            }
            destroyed = true;
            releaseRing();
            dataAvailable.signalAll();
            spaceAvailable.signalAll();
            LOGGER.log(
                    Level.FINE,
                    "Destroyed {0} with {1} reader(s) and {2} writer(s) still attached",
                    new Object[] {name, readerCount, writerCount});
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void releaseRing() {
        storage = null;
        readCursor = 0;
        writeCursor = 0;
        filledCount = 0;
    }

    @GuardedBy("lock")
    private void checkUsable(PipeSession session) throws PipeClosedException {
        if (destroyed) {
            throw new PipeClosedException(name, "pipe has been destroyed");
        }
        if (session.isClosed()) {
            throw new PipeClosedException(name, "session is already closed");
        }
    }

    /**
     * Number of bytes that can be read right now.
     */
    public int readable() {
        lock.lock();
        try {
            return filledCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of bytes that can be written right now. 0 if the storage is not allocated.
     */
    public int writable() {
        lock.lock();
        try {
            return storage == null ? 0 : capacity - filledCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true while at least one session is open and the ring storage exists.
     */
    public boolean isAllocated() {
        lock.lock();
        try {
            return storage != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDestroyed() {
        lock.lock();
        try {
            return destroyed;
        } finally {
            lock.unlock();
        }
    }

    public int getReaderCount() {
        lock.lock();
        try {
            return readerCount;
        } finally {
            lock.unlock();
        }
    }

    public int getWriterCount() {
        lock.lock();
        try {
            return writerCount;
        } finally {
            lock.unlock();
        }
    }

    // Exposed for testing
    int readCursor() {
        lock.lock();
        try {
            return readCursor;
        } finally {
            lock.unlock();
        }
    }

    // Exposed for testing
    int writeCursor() {
        lock.lock();
        try {
            return writeCursor;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks the ring bookkeeping. Must be called with the lock held.
     */
    private boolean invariantsHold() {
        if (!lock.isHeldByCurrentThread()) {
            return false;
        }
        if (filledCount < 0 || filledCount > capacity || readerCount < 0 || writerCount < 0) {
            return false;
        }
        if (destroyed) {
            return storage == null;
        }
        if ((storage != null) != (readerCount + writerCount > 0)) {
            return false;
        }
        if (storage == null) {
            return filledCount == 0;
        }
        if (readCursor < 0 || readCursor >= capacity || writeCursor < 0 || writeCursor >= capacity) {
            return false;
        }
        // a full ring has both cursors at the same place, just like an empty one
        return Math.floorMod(writeCursor - readCursor, capacity) == filledCount % capacity;
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            String state = destroyed ? "destroyed" : storage == null ? "unallocated" : filledCount + "/" + capacity;
            return "PipeBuffer[" + name + ": " + state + ", readers=" + readerCount + ", writers=" + writerCount + "]";
        } finally {
            lock.unlock();
        }
    }

    private static final Logger LOGGER = Logger.getLogger(PipeBuffer.class.getName());
}
