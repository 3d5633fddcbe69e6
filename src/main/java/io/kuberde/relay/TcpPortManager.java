package io.kuberde.relay;

import javax.net.ServerSocketFactory;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;

/**
 * Listening sockets for TCP routes: one per registered external port, opened on registration and
 * closed on deregistration. Parked routes keep their listener so traffic can wake the workload.
 */
public final class TcpPortManager implements Closeable {
    private final String bindHost;
    private final ExecutorService connections;
    private final InboundRouter router;
    private final Map<Integer, SocketAcceptor> listeners = new TreeMap<>();

    public TcpPortManager(String bindHost, ExecutorService connections, InboundRouter router) {
        this.bindHost = bindHost;
        this.connections = connections;
        this.router = router;
    }

    /**
     * @return {@code false} when the port was already open
     */
    public synchronized boolean open(int port) throws IOException {
        if (listeners.containsKey(port)) {
            return false;
        }
        SocketAcceptor acceptor = SocketAcceptor.start(
                "tcp-" + port,
                ServerSocketFactory.getDefault(),
                bindHost,
                port,
                connections,
                socket -> router.handleTcp(socket, port)
        );
        listeners.put(port, acceptor);
        return true;
    }

    public synchronized boolean close(int port) {
        SocketAcceptor acceptor = listeners.remove(port);
        if (acceptor == null) {
            return false;
        }
        acceptor.close();
        return true;
    }

    public synchronized boolean isOpen(int port) {
        return listeners.containsKey(port);
    }

    @Override
    public synchronized void close() {
        for (SocketAcceptor acceptor : listeners.values()) {
            acceptor.close();
        }
        listeners.clear();
    }
}
