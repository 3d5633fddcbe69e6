package io.kuberde.agent;

import io.kuberde.model.ServiceSpec;
import io.kuberde.model.ServiceTable;
import io.kuberde.mux.MuxStream;
import io.kuberde.tunnel.Bridge;
import io.kuberde.tunnel.Preamble;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves streams the relay opens: reads the service preamble, dials the matching local port and
 * bridges until either side is done. One stream failing never touches the others.
 */
public final class StreamDispatcher {
    private static final int LOCAL_CONNECT_TIMEOUT_MS = 2_000;

    private final ServiceTable services;
    private final String localHost;
    private final Duration preambleTimeout;
    private final Duration dialWindow;
    private final Duration dialStep;
    private final ExecutorService executor;
    private final AtomicInteger active = new AtomicInteger();

    public StreamDispatcher(
            ServiceTable services,
            String localHost,
            Duration preambleTimeout,
            Duration dialWindow,
            Duration dialStep,
            ExecutorService executor
    ) {
        this.services = services;
        this.localHost = localHost;
        this.preambleTimeout = preambleTimeout;
        this.dialWindow = dialWindow;
        this.dialStep = dialStep;
        this.executor = executor;
    }

    public void dispatch(MuxStream stream) {
        try {
            executor.execute(() -> serve(stream));
        } catch (RejectedExecutionException e) {
            System.err.println("WARN stream " + stream.id() + " dropped: agent is shutting down");
            stream.reset();
        }
    }

    public int activeStreams() {
        return active.get();
    }

    void serve(MuxStream stream) {
        String service;
        try {
            service = Preamble.read(stream, preambleTimeout);
        } catch (IOException e) {
            System.err.println("WARN stream " + stream.id() + " preamble failed: " + e.getMessage());
            stream.reset();
            return;
        }
        Optional<ServiceSpec> spec = services.find(service);
        if (spec.isEmpty()) {
            System.err.println("WARN stream " + stream.id() + " asked for unknown service " + service);
            stream.reset();
            return;
        }
        Socket local;
        try {
            local = dialLocal(spec.get().port());
        } catch (IOException e) {
            System.err.println("WARN service " + service + " on port " + spec.get().port() + " unreachable: " + e.getMessage());
            stream.reset();
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stream.reset();
            return;
        }
        active.incrementAndGet();
        try {
            Bridge.Result result = new Bridge(local, stream, Bridge.TrafficListener.NONE).run(executor);
            if (!result.clean()) {
                System.err.println("WARN stream " + stream.id() + " to " + service + " aborted: " + result.failure().getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            active.decrementAndGet();
        }
    }

    /**
     * Retries refused connections until the dial window runs out, so a workload that is still
     * starting gets the stream instead of a reset.
     */
    Socket dialLocal(int port) throws IOException, InterruptedException {
        long deadline = System.currentTimeMillis() + dialWindow.toMillis();
        while (true) {
            Socket socket = new Socket();
            try {
                socket.connect(new InetSocketAddress(localHost, port), LOCAL_CONNECT_TIMEOUT_MS);
                socket.setTcpNoDelay(true);
                return socket;
            } catch (ConnectException e) {
                socket.close();
                if (System.currentTimeMillis() + dialStep.toMillis() > deadline) {
                    throw e;
                }
                Thread.sleep(dialStep.toMillis());
            } catch (IOException e) {
                socket.close();
                throw e;
            }
        }
    }
}
