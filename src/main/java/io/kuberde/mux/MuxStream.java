package io.kuberde.mux;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;

/**
 * One logical, flow-controlled byte stream inside a {@link MuxSession}. Reads and writes may run on
 * different threads; a reset or a session close wakes both.
 */
public final class MuxStream implements Closeable {
    private final MuxSession session;
    private final int id;
    private final int initialWindow;
    private final int maxFramePayload;
    private final long writeTimeoutMs;
    private final Object lock = new Object();
    private final ArrayDeque<byte[]> chunks = new ArrayDeque<>();
    private final InputStream input = new StreamInput();
    private final OutputStream output = new StreamOutput();

    private int chunkOffset;
    private int buffered;
    private int consumedSinceUpdate;
    private long sendWindow;
    private boolean remoteFin;
    private boolean localFin;
    private boolean closed;
    private String resetReason;
    private volatile long readTimeoutMs;

    MuxStream(MuxSession session, int id, MuxConfig config) {
        this.session = session;
        this.id = id;
        this.initialWindow = config.initialWindow();
        this.maxFramePayload = config.maxFramePayload();
        this.writeTimeoutMs = config.writeTimeout().toMillis();
        this.sendWindow = config.initialWindow();
    }

    public int id() {
        return id;
    }

    public MuxSession session() {
        return session;
    }

    public InputStream getInputStream() {
        return input;
    }

    public OutputStream getOutputStream() {
        return output;
    }

    /**
     * Read timeout for subsequent reads; {@code null} or zero waits indefinitely.
     */
    public void setReadTimeout(Duration timeout) {
        this.readTimeoutMs = timeout == null ? 0L : Math.max(0L, timeout.toMillis());
    }

    public boolean isReset() {
        synchronized (lock) {
            return resetReason != null;
        }
    }

    public int read(byte[] buf, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        int delta = 0;
        int n;
        synchronized (lock) {
            long timeout = readTimeoutMs;
            long deadline = timeout > 0 ? System.currentTimeMillis() + timeout : 0L;
            while (buffered == 0) {
                if (resetReason != null) {
                    throw new IOException("stream " + id + " reset: " + resetReason);
                }
                if (remoteFin) {
                    return -1;
                }
                if (closed) {
                    throw new IOException("stream " + id + " closed");
                }
                long waitMs = 0L;
                if (deadline > 0) {
                    waitMs = deadline - System.currentTimeMillis();
                    if (waitMs <= 0) {
                        throw new SocketTimeoutException("stream " + id + " read timed out");
                    }
                }
                try {
                    lock.wait(waitMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted while reading stream " + id, e);
                }
            }
            n = 0;
            while (n < len && !chunks.isEmpty()) {
                byte[] head = chunks.peekFirst();
                int take = Math.min(len - n, head.length - chunkOffset);
                System.arraycopy(head, chunkOffset, buf, off + n, take);
                n += take;
                chunkOffset += take;
                if (chunkOffset == head.length) {
                    chunks.pollFirst();
                    chunkOffset = 0;
                }
            }
            buffered -= n;
            consumedSinceUpdate += n;
            if (consumedSinceUpdate >= initialWindow / 2 && !remoteFin) {
                delta = consumedSinceUpdate;
                consumedSinceUpdate = 0;
            }
        }
        if (delta > 0) {
            session.sendFrame(Frame.control(FrameType.WINDOW_UPDATE, 0, id, delta));
        }
        return n;
    }

    public void write(byte[] buf, int off, int len) throws IOException {
        while (len > 0) {
            int n;
            synchronized (lock) {
                long deadline = System.currentTimeMillis() + writeTimeoutMs;
                while (sendWindow == 0 && resetReason == null && !localFin) {
                    long waitMs = deadline - System.currentTimeMillis();
                    if (waitMs <= 0) {
                        throw new MuxException("stream " + id + " write timed out waiting for window");
                    }
                    try {
                        lock.wait(waitMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IOException("interrupted while writing stream " + id, e);
                    }
                }
                if (resetReason != null) {
                    throw new IOException("stream " + id + " reset: " + resetReason);
                }
                if (localFin) {
                    throw new IOException("stream " + id + " closed for writing");
                }
                n = (int) Math.min(Math.min(len, sendWindow), maxFramePayload);
                sendWindow -= n;
            }
            byte[] chunk = new byte[n];
            System.arraycopy(buf, off, chunk, 0, n);
            session.sendFrame(Frame.data(0, id, chunk));
            off += n;
            len -= n;
        }
    }

    /**
     * Half-close: the peer reads end of stream once it drained what was sent.
     */
    public void closeWrite() throws IOException {
        boolean forget;
        synchronized (lock) {
            if (localFin || resetReason != null) {
                return;
            }
            localFin = true;
            forget = remoteFin;
            lock.notifyAll();
        }
        session.sendFrame(Frame.control(FrameType.WINDOW_UPDATE, Frame.FLAG_FIN, id, 0));
        if (forget) {
            session.forget(this);
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            lock.notifyAll();
        }
        try {
            if (!session.isClosed()) {
                closeWrite();
            }
        } finally {
            session.forget(this);
        }
    }

    /**
     * Aborts this stream only; sibling streams of the session are unaffected.
     */
    public void reset() {
        if (!markReset("reset locally")) {
            return;
        }
        session.forget(this);
        if (session.isClosed()) {
            return;
        }
        try {
            session.sendFrame(Frame.control(FrameType.WINDOW_UPDATE, Frame.FLAG_RST, id, 0));
        } catch (IOException e) {
            // The session failed while resetting; its own close path resets this stream as well.
            System.err.println("WARN stream " + id + " reset frame not delivered: " + e.getMessage());
        }
    }

    void handleFrame(Frame frame) throws MuxException {
        boolean forget = false;
        synchronized (lock) {
            if (frame.has(Frame.FLAG_RST)) {
                if (resetReason == null) {
                    resetReason = "reset by peer";
                }
                lock.notifyAll();
                forget = true;
            } else {
                if (frame.type() == FrameType.DATA && frame.payload().length > 0 && !closed && resetReason == null) {
                    if (buffered + frame.payload().length > initialWindow) {
                        throw new MuxException("peer exceeded receive window on stream " + id);
                    }
                    chunks.addLast(frame.payload());
                    buffered += frame.payload().length;
                }
                if (frame.type() == FrameType.WINDOW_UPDATE && frame.length() > 0) {
                    sendWindow += frame.length();
                }
                if (frame.has(Frame.FLAG_FIN)) {
                    remoteFin = true;
                    forget = localFin || closed;
                }
                lock.notifyAll();
            }
        }
        if (forget) {
            session.forget(this);
        }
    }

    void onSessionClosed(String reason) {
        markReset(reason);
    }

    private boolean markReset(String reason) {
        synchronized (lock) {
            if (resetReason != null) {
                return false;
            }
            resetReason = reason;
            lock.notifyAll();
            return true;
        }
    }

    private final class StreamInput extends InputStream {
        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = MuxStream.this.read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return MuxStream.this.read(b, off, len);
        }

        @Override
        public int available() {
            synchronized (lock) {
                return buffered;
            }
        }

        @Override
        public void close() throws IOException {
            MuxStream.this.close();
        }
    }

    private final class StreamOutput extends OutputStream {
        @Override
        public void write(int b) throws IOException {
            MuxStream.this.write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            MuxStream.this.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            closeWrite();
        }
    }
}
