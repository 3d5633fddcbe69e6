package io.kuberde.relay;

import javax.net.ServerSocketFactory;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * One listening socket with a dedicated accept thread; each accepted connection runs on the shared
 * connection pool.
 */
final class SocketAcceptor implements Closeable {
    private static final int BACKLOG = 128;

    private final String name;
    private final ServerSocket serverSocket;
    private final ExecutorService connections;
    private final Consumer<Socket> handler;
    private volatile boolean closed;

    private SocketAcceptor(String name, ServerSocket serverSocket, ExecutorService connections, Consumer<Socket> handler) {
        this.name = name;
        this.serverSocket = serverSocket;
        this.connections = connections;
        this.handler = handler;
    }

    static SocketAcceptor start(
            String name,
            ServerSocketFactory factory,
            String bindHost,
            int port,
            ExecutorService connections,
            Consumer<Socket> handler
    ) throws IOException {
        ServerSocket serverSocket = factory.createServerSocket(port, BACKLOG, InetAddress.getByName(bindHost));
        serverSocket.setReuseAddress(true);
        SocketAcceptor acceptor = new SocketAcceptor(name, serverSocket, connections, handler);
        Thread thread = new Thread(acceptor::acceptLoop, "accept-" + name);
        thread.setDaemon(true);
        thread.start();
        return acceptor;
    }

    int port() {
        return serverSocket.getLocalPort();
    }

    private void acceptLoop() {
        while (!closed) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (!closed) {
                    System.err.println("WARN accept failed on " + name + ": " + e.getMessage());
                    close();
                }
                return;
            }
            try {
                connections.execute(() -> handler.accept(socket));
            } catch (RejectedExecutionException e) {
                System.err.println("WARN connection on " + name + " rejected: pool is shut down");
                try {
                    socket.close();
                } catch (IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        try {
            serverSocket.close();
        } catch (IOException e) {
            System.err.println("WARN closing listener " + name + " failed: " + e.getMessage());
        }
    }
}
