package org.muma.tiny.redis;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.muma.tiny.redis.config.TinyRedisConfig;
import org.muma.tiny.redis.config.TinyRedisConfig.IoMode;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 真实 socket 上的端到端测试，两种 IO 模式跑同一组用例
 */
class TinyRedisServerTest {

    private TinyRedisServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.shutdown();
        }
    }

    private void start(IoMode mode) throws Exception {
        TinyRedisConfig config = new TinyRedisConfig();
        config.setHost("127.0.0.1");
        config.setPort(0); // 随机端口
        config.setIoMode(mode);
        server = new TinyRedisServer(config);
        server.start();
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", server.getPort());
        socket.setSoTimeout(5000);
        return socket;
    }

    private static void send(Socket socket, String s) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(s.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    // 按期望回复的长度读取，读不够会在 soTimeout 后失败
    private static String read(Socket socket, String expected) throws IOException {
        byte[] bytes = socket.getInputStream().readNBytes(expected.getBytes(StandardCharsets.UTF_8).length);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void expect(Socket socket, String expected) throws IOException {
        assertEquals(expected, read(socket, expected));
    }

    @ParameterizedTest
    @EnumSource(IoMode.class)
    void testPipelinedInlineCommands(IoMode mode) throws Exception {
        start(mode);
        try (Socket client = connect()) {
            send(client, "SET a 1\r\nGET a\r\n");
            expect(client, "+OK\r\n$1\r\n1\r\n");
        }
    }

    @ParameterizedTest
    @EnumSource(IoMode.class)
    void testRespCommandsAcrossConnections(IoMode mode) throws Exception {
        start(mode);
        try (Socket first = connect(); Socket second = connect()) {
            send(first, "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
            expect(first, "+OK\r\n");

            send(second, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
            expect(second, "$3\r\nbar\r\n");

            send(second, "*3\r\n$3\r\nDEL\r\n$3\r\nfoo\r\n$3\r\nbaz\r\n");
            expect(second, ":1\r\n");

            send(first, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
            expect(first, "$-1\r\n");
        }
    }

    @ParameterizedTest
    @EnumSource(IoMode.class)
    void testUnknownCommandThenPing(IoMode mode) throws Exception {
        start(mode);
        try (Socket client = connect()) {
            send(client, "FOO\r\n");
            expect(client, "-Unknown command\r\n");
            send(client, "*1\r\n$4\r\nPING\r\n");
            expect(client, "+PONG\r\n");
        }
    }

    @ParameterizedTest
    @EnumSource(IoMode.class)
    void testProtocolErrorClosesConnection(IoMode mode) throws Exception {
        start(mode);
        try (Socket client = connect(); Socket other = connect()) {
            send(client, "*1\r\n!");
            expect(client, "-ERR Protocol error: Unknown RESP type byte: '!'\r\n");
            assertEquals(-1, client.getInputStream().read());

            // 其他连接不受影响
            send(other, "PING\r\n");
            expect(other, "+PONG\r\n");
        }
    }

    @ParameterizedTest
    @EnumSource(IoMode.class)
    void testSlowClientDoesNotBlockOthers(IoMode mode) throws Exception {
        start(mode);
        try (Socket slow = connect(); Socket fast = connect()) {
            // 只发半帧
            send(slow, "*2\r\n$3\r\nGE");

            send(fast, "SET k v\r\n");
            expect(fast, "+OK\r\n");

            send(slow, "T\r\n$1\r\nk\r\n");
            expect(slow, "$1\r\nv\r\n");
        }
    }

    @ParameterizedTest
    @EnumSource(IoMode.class)
    void testConcurrentClients(IoMode mode) throws Exception {
        start(mode);
        int clients = 4;
        int keysPerClient = 100;

        ExecutorService pool = Executors.newFixedThreadPool(clients);
        CountDownLatch ready = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int c = 0; c < clients; c++) {
                int id = c;
                futures.add(pool.submit(() -> {
                    ready.await();
                    try (Socket client = connect()) {
                        for (int i = 0; i < keysPerClient; i++) {
                            send(client, "SET key:" + id + ":" + i + " v" + i + "\r\n");
                            expect(client, "+OK\r\n");
                            // 所有客户端都在写同一个 key
                            send(client, "SET shared " + id + "\r\n");
                            expect(client, "+OK\r\n");
                        }
                    }
                    return null;
                }));
            }
            ready.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(clients * keysPerClient + 1, server.getStorage().size());
        assertTrue(Set.of("0", "1", "2", "3").contains(server.getStorage().get("shared")));
        assertEquals("v42", server.getStorage().get("key:2:42"));
    }
}
