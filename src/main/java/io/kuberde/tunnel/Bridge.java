package io.kuberde.tunnel;

import io.kuberde.mux.MuxStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Copies bytes between a plain socket and a mux stream in both directions. The two copy tasks share
 * one cancellation scope: a clean end of input half-closes the opposite side, any failure tears
 * down both sides at once.
 */
public final class Bridge {
    private static final int BUFFER_SIZE = 32 * 1024;

    private final Socket socket;
    private final MuxStream stream;
    private final TrafficListener listener;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    public Bridge(Socket socket, MuxStream stream, TrafficListener listener) {
        this.socket = socket;
        this.stream = stream;
        this.listener = listener == null ? TrafficListener.NONE : listener;
    }

    /**
     * Runs the socket-to-stream copy on the calling thread and the stream-to-socket copy on
     * {@code executor}; returns once both directions ended. Both sides are closed afterwards.
     */
    public Result run(ExecutorService executor) throws InterruptedException {
        long toStream = 0L;
        long toSocket = 0L;
        try {
            InputStream socketIn = socket.getInputStream();
            OutputStream socketOut = socket.getOutputStream();
            Future<Long> outbound = executor.submit(() ->
                    pump(stream.getInputStream(), socketOut, Direction.TO_SOCKET, this::halfCloseSocket));
            toStream = pump(socketIn, stream.getOutputStream(), Direction.TO_STREAM, this::halfCloseStream);
            try {
                toSocket = outbound.get();
            } catch (ExecutionException e) {
                fail(e.getCause());
            }
        } catch (IOException e) {
            fail(e);
        } catch (InterruptedException e) {
            fail(e);
            throw e;
        } finally {
            finish();
        }
        return new Result(toStream, toSocket, failure.get());
    }

    /**
     * Aborts both directions from outside, for example when the owning session goes away.
     */
    public void cancel() {
        fail(new IOException("bridge cancelled"));
    }

    private long pump(InputStream in, OutputStream out, Direction direction, Runnable onEnd) {
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0L;
        try {
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                out.flush();
                total += read;
                listener.onTraffic(direction, read);
            }
            onEnd.run();
        } catch (IOException e) {
            fail(e);
        }
        return total;
    }

    private void halfCloseStream() {
        try {
            stream.closeWrite();
        } catch (IOException e) {
            fail(e);
        }
    }

    private void halfCloseSocket() {
        if (socket.isClosed()) {
            return;
        }
        try {
            socket.shutdownOutput();
        } catch (UnsupportedOperationException | IOException e) {
            // TLS sockets cannot half-close; end the whole exchange once the agent side is done.
            cancelled.set(true);
            closeSocket();
            stream.reset();
        }
    }

    private void fail(Throwable cause) {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        failure.compareAndSet(null, cause);
        stream.reset();
        closeSocket();
    }

    private void finish() {
        if (cancelled.compareAndSet(false, true)) {
            try {
                stream.close();
            } catch (IOException e) {
                failure.compareAndSet(null, e);
            }
        }
        closeSocket();
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            failure.compareAndSet(null, e);
        }
    }

    public enum Direction {
        TO_STREAM,
        TO_SOCKET
    }

    @FunctionalInterface
    public interface TrafficListener {
        TrafficListener NONE = (direction, bytes) -> { };

        void onTraffic(Direction direction, int bytes);
    }

    public record Result(long bytesToStream, long bytesToSocket, Throwable failure) {
        public boolean clean() {
            return failure == null;
        }
    }
}
