package org.muma.tiny.redis.server;

import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.tiny.redis.config.TinyRedisConfig;
import org.muma.tiny.redis.protocol.RespParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 阻塞网络层：一个 accept 线程，每个连接一个处理线程。
 * 慢客户端只占住自己的线程，不影响其他连接。
 */
public class BlockingServerTransport implements ServerTransport {

    private static final Logger log = LoggerFactory.getLogger(BlockingServerTransport.class);

    private final TinyRedisConfig config;
    private final RespParser parser;
    private final RequestRouter router;

    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
    private final ExecutorService connectionPool =
            Executors.newCachedThreadPool(new DefaultThreadFactory("tiny-redis-conn", true));

    private ServerSocket serverSocket;
    private Thread acceptor;

    public BlockingServerTransport(TinyRedisConfig config, RespParser parser, RequestRouter router) {
        this.config = config;
        this.parser = parser;
        this.router = router;
    }

    @Override
    public void start() throws IOException {
        serverSocket = new ServerSocket();
        try {
            serverSocket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
        } catch (IOException e) {
            serverSocket.close();
            throw new IOException("Failed to bind " + config.getHost() + ":" + config.getPort(), e);
        }

        // 后台线程，不阻止 JVM 退出
        acceptor = new DefaultThreadFactory("tiny-redis-acceptor", true).newThread(this::acceptLoop);
        acceptor.start();
        log.info("Blocking transport listening on {}", serverSocket.getLocalSocketAddress());
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (serverSocket.isClosed()) {
                    break;
                }
                log.warn("Error accepting client connection: {}", e.getMessage());
                continue;
            }

            clients.add(socket);
            try {
                socket.setTcpNoDelay(true);
                connectionPool.execute(() -> {
                    try {
                        new BlockingConnectionHandler(socket, parser, router).run();
                    } finally {
                        clients.remove(socket);
                    }
                });
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to start handler for {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                clients.remove(socket);
                closeQuietly(socket);
            }
        }
        log.info("Blocking transport stopped accepting connections");
    }

    @Override
    public int port() {
        return serverSocket.getLocalPort();
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        acceptor.join();
    }

    @Override
    public void shutdown() {
        if (serverSocket != null) {
            closeQuietly(serverSocket);
        }
        // 关闭客户端 socket，让阻塞在 read 上的线程退出
        for (Socket client : clients) {
            closeQuietly(client);
        }
        connectionPool.shutdownNow();
    }

    private void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Error while closing {}: {}", closeable, e.getMessage());
        }
    }
}
