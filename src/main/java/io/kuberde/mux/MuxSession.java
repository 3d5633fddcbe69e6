package io.kuberde.mux;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multiplexed session over one established connection. The server side opens even stream ids,
 * the client side odd ones. One reader thread dispatches inbound frames; writers serialize on a
 * single lock so frames never interleave.
 */
public final class MuxSession implements Closeable {
    private static final long ACCEPT_POLL_MS = 100L;

    private final String name;
    private final Socket socket;
    private final MuxConfig config;
    private final boolean client;
    private final DataInputStream in;
    private final OutputStream out;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Map<Integer, MuxStream> streams = new ConcurrentHashMap<>();
    private final LinkedBlockingQueue<MuxStream> acceptQueue;
    private final AtomicInteger nextStreamId;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final Map<Long, CompletableFuture<Long>> pendingPings = new ConcurrentHashMap<>();
    private final AtomicLong pingIds = new AtomicLong();
    private final ScheduledExecutorService keepAlive;
    private volatile ControlHandler controlHandler;
    private volatile long lastFrameNanos;
    private volatile long writeStartedNanos;
    private volatile Throwable closeCause;

    private MuxSession(Socket socket, boolean client, MuxConfig config, String name) throws IOException {
        this.name = name == null || name.isBlank() ? "session" : name;
        this.socket = socket;
        this.config = config;
        this.client = client;
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream(), 64 * 1024));
        this.out = new BufferedOutputStream(socket.getOutputStream(), config.maxFramePayload() + Frame.HEADER_SIZE);
        this.acceptQueue = new LinkedBlockingQueue<>(config.acceptBacklog());
        this.nextStreamId = new AtomicInteger(client ? 1 : 2);
        this.lastFrameNanos = System.nanoTime();
        this.keepAlive = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "mux-keepalive-" + this.name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Agent side of an upgraded tunnel connection.
     */
    public static MuxSession client(Socket socket, MuxConfig config, String name) throws IOException {
        MuxSession session = new MuxSession(socket, true, config, name);
        session.start();
        return session;
    }

    /**
     * Relay side of an upgraded tunnel connection.
     */
    public static MuxSession server(Socket socket, MuxConfig config, String name) throws IOException {
        MuxSession session = new MuxSession(socket, false, config, name);
        session.start();
        return session;
    }

    private void start() {
        Thread reader = new Thread(this::readLoop, "mux-reader-" + name);
        reader.setDaemon(true);
        reader.start();
        long keepAliveMs = config.keepAliveInterval().toMillis();
        keepAlive.scheduleAtFixedRate(this::sendKeepAlive, keepAliveMs, keepAliveMs, TimeUnit.MILLISECONDS);
        long checkMs = Math.max(10L, Math.min(1_000L, keepAliveMs));
        keepAlive.scheduleWithFixedDelay(this::checkLiveness, checkMs, checkMs, TimeUnit.MILLISECONDS);
    }

    public String name() {
        return name;
    }

    public MuxStream openStream() throws IOException {
        if (closed.get()) {
            throw new MuxException("session " + name + " is closed");
        }
        int id = nextStreamId.getAndAdd(2);
        if (id < 0) {
            throw new MuxException("stream ids exhausted on session " + name);
        }
        MuxStream stream = new MuxStream(this, id, config);
        streams.put(id, stream);
        try {
            sendFrame(Frame.control(FrameType.WINDOW_UPDATE, Frame.FLAG_SYN, id, 0));
        } catch (IOException e) {
            streams.remove(id);
            throw e;
        }
        return stream;
    }

    /**
     * @return the next stream opened by the peer, or {@code null} when the timeout elapsed
     * @throws MuxException when the session is or becomes closed
     */
    public MuxStream acceptStream(Duration timeout) throws IOException {
        long deadline = timeout == null || timeout.isZero() ? Long.MAX_VALUE : System.currentTimeMillis() + timeout.toMillis();
        while (true) {
            if (closed.get()) {
                throw new MuxException("session " + name + " is closed");
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return null;
            }
            try {
                MuxStream stream = acceptQueue.poll(Math.min(remaining, ACCEPT_POLL_MS), TimeUnit.MILLISECONDS);
                if (stream != null) {
                    return stream;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MuxException("interrupted while accepting on " + name, e);
            }
        }
    }

    /**
     * Round trip of one ping frame.
     */
    public Duration ping(Duration timeout) throws IOException {
        long id = pingIds.incrementAndGet();
        CompletableFuture<Long> pong = new CompletableFuture<>();
        pendingPings.put(id, pong);
        long started = System.nanoTime();
        try {
            sendFrame(Frame.control(FrameType.PING, Frame.FLAG_SYN, 0, id));
            pong.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return Duration.ofNanos(System.nanoTime() - started);
        } catch (TimeoutException e) {
            throw new MuxException("ping timed out on " + name, e);
        } catch (ExecutionException e) {
            throw new MuxException("ping failed on " + name, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MuxException("interrupted while pinging " + name, e);
        } finally {
            pendingPings.remove(id);
        }
    }

    /**
     * Sends a refreshed bearer credential to the peer on stream 0.
     */
    public void sendReauth(String token) throws IOException {
        byte[] payload = token.getBytes(StandardCharsets.UTF_8);
        if (payload.length > MuxConfig.MAX_REAUTH_PAYLOAD) {
            throw new IllegalArgumentException("reauth token too large");
        }
        sendFrame(new Frame(FrameType.REAUTH, Frame.FLAG_SYN, 0, payload.length, payload));
    }

    public void setControlHandler(ControlHandler handler) {
        this.controlHandler = handler;
    }

    /**
     * Registers a callback run once when the session closes; runs immediately if already closed.
     */
    public void onClose(Runnable listener) {
        closeListeners.add(listener);
        if (closed.get() && closedLatch.getCount() == 0 && closeListeners.remove(listener)) {
            listener.run();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public Throwable closeCause() {
        return closeCause;
    }

    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public long millisSinceLastFrame() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastFrameNanos);
    }

    public int streamCount() {
        return streams.size();
    }

    @Override
    public void close() {
        close(new MuxException("session " + name + " closed locally"));
    }

    public void close(Throwable cause) {
        close(cause, Frame.GO_AWAY_NORMAL);
    }

    private void close(Throwable cause, int goAwayCode) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeCause = cause;
        if (writeLock.tryLock()) {
            try {
                FrameCodec.write(out, Frame.control(FrameType.GO_AWAY, 0, 0, goAwayCode));
                out.flush();
            } catch (IOException e) {
                cause.addSuppressed(e);
            } finally {
                writeLock.unlock();
            }
        }
        try {
            socket.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
        keepAlive.shutdownNow();
        String reason = cause.getMessage() == null ? "session closed" : cause.getMessage();
        for (MuxStream stream : streams.values()) {
            stream.onSessionClosed(reason);
        }
        streams.clear();
        MuxStream pending;
        while ((pending = acceptQueue.poll()) != null) {
            pending.onSessionClosed(reason);
        }
        for (CompletableFuture<Long> pong : pendingPings.values()) {
            pong.completeExceptionally(cause);
        }
        closedLatch.countDown();
        for (Runnable listener : closeListeners) {
            if (!closeListeners.remove(listener)) {
                continue;
            }
            try {
                listener.run();
            } catch (RuntimeException e) {
                System.err.println("WARN close listener failed on " + name + ": " + e.getMessage());
            }
        }
    }

    void sendFrame(Frame frame) throws IOException {
        if (closed.get()) {
            throw new MuxException("session " + name + " is closed");
        }
        writeLock.lock();
        try {
            writeStartedNanos = System.nanoTime();
            FrameCodec.write(out, frame);
            out.flush();
        } catch (IOException e) {
            close(e);
            throw new MuxException("write failed on " + name, e);
        } finally {
            writeStartedNanos = 0L;
            writeLock.unlock();
        }
    }

    void forget(MuxStream stream) {
        streams.remove(stream.id(), stream);
    }

    private void readLoop() {
        try {
            while (!closed.get()) {
                Frame frame = FrameCodec.read(in, config.maxInboundPayload());
                if (frame == null) {
                    close(new MuxException("peer closed the connection"));
                    return;
                }
                lastFrameNanos = System.nanoTime();
                dispatch(frame);
            }
        } catch (MuxException e) {
            close(e, Frame.GO_AWAY_PROTOCOL_ERROR);
        } catch (IOException | RuntimeException e) {
            close(e);
        }
    }

    private void dispatch(Frame frame) throws IOException {
        switch (frame.type()) {
            case PING -> {
                if (frame.has(Frame.FLAG_SYN)) {
                    sendFrame(Frame.control(FrameType.PING, Frame.FLAG_ACK, 0, frame.length()));
                } else if (frame.has(Frame.FLAG_ACK)) {
                    CompletableFuture<Long> pong = pendingPings.get(frame.length());
                    if (pong != null) {
                        pong.complete(frame.length());
                    }
                }
            }
            case GO_AWAY -> close(new MuxException("peer sent go-away, code " + frame.length()));
            case REAUTH -> handleReauth(frame);
            case DATA, WINDOW_UPDATE -> handleStreamFrame(frame);
            default -> throw new MuxException("unexpected frame type " + frame.type());
        }
    }

    private void handleReauth(Frame frame) throws IOException {
        if (frame.streamId() != 0) {
            throw new MuxException("reauth frame on stream " + frame.streamId());
        }
        if (frame.has(Frame.FLAG_ACK)) {
            ControlHandler handler = controlHandler;
            if (handler != null) {
                handler.onReauthAccepted();
            }
            return;
        }
        ControlHandler handler = controlHandler;
        String token = new String(frame.payload(), StandardCharsets.UTF_8);
        if (handler != null && handler.onReauth(token)) {
            sendFrame(Frame.control(FrameType.REAUTH, Frame.FLAG_ACK, 0, 0));
            return;
        }
        if (writeLock.tryLock()) {
            try {
                FrameCodec.write(out, Frame.control(FrameType.GO_AWAY, 0, 0, Frame.GO_AWAY_UNAUTHORIZED));
                out.flush();
            } finally {
                writeLock.unlock();
            }
        }
        close(new MuxException("refreshed credential rejected on " + name));
    }

    private void handleStreamFrame(Frame frame) throws IOException {
        int id = frame.streamId();
        if (id == 0) {
            throw new MuxException(frame.type() + " frame on stream 0");
        }
        if (frame.has(Frame.FLAG_SYN)) {
            boolean peerParity = client ? id % 2 == 0 : id % 2 == 1;
            if (!peerParity || streams.containsKey(id)) {
                throw new MuxException("invalid stream open for id " + id);
            }
            MuxStream stream = new MuxStream(this, id, config);
            streams.put(id, stream);
            if (!acceptQueue.offer(stream)) {
                streams.remove(id);
                sendFrame(Frame.control(FrameType.WINDOW_UPDATE, Frame.FLAG_RST, id, 0));
                return;
            }
            sendFrame(Frame.control(FrameType.WINDOW_UPDATE, Frame.FLAG_ACK, id, 0));
            stream.handleFrame(frame);
            return;
        }
        MuxStream stream = streams.get(id);
        if (stream != null) {
            stream.handleFrame(frame);
        }
    }

    private void sendKeepAlive() {
        if (closed.get() || !writeLock.tryLock()) {
            return;
        }
        try {
            writeStartedNanos = System.nanoTime();
            FrameCodec.write(out, Frame.control(FrameType.PING, Frame.FLAG_SYN, 0, pingIds.incrementAndGet()));
            out.flush();
        } catch (IOException e) {
            close(e);
        } finally {
            writeStartedNanos = 0L;
            writeLock.unlock();
        }
    }

    private void checkLiveness() {
        if (closed.get()) {
            return;
        }
        long heartbeatMs = config.heartbeatTimeout().toMillis();
        if (heartbeatMs > 0 && millisSinceLastFrame() > heartbeatMs) {
            close(new MuxException("no frames from peer for " + millisSinceLastFrame() + "ms on " + name));
            return;
        }
        long started = writeStartedNanos;
        if (started != 0L && System.nanoTime() - started > config.writeTimeout().toNanos()) {
            close(new MuxException("write blocked longer than " + config.writeTimeout() + " on " + name));
        }
    }

    /**
     * Receives session-level credential refreshes.
     */
    public interface ControlHandler {
        /**
         * @return {@code true} to keep the session, {@code false} to close it as unauthorized
         */
        boolean onReauth(String token);

        default void onReauthAccepted() {
        }
    }
}
