package org.muma.tiny.redis;

import org.muma.tiny.redis.command.CommandDispatcher;
import org.muma.tiny.redis.config.TinyRedisConfig;
import org.muma.tiny.redis.protocol.RespParser;
import org.muma.tiny.redis.server.BlockingServerTransport;
import org.muma.tiny.redis.server.NettyServerTransport;
import org.muma.tiny.redis.server.RequestRouter;
import org.muma.tiny.redis.server.ServerTransport;
import org.muma.tiny.redis.store.StorageEngine;
import org.muma.tiny.redis.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class TinyRedisServer {

    private static final Logger log = LoggerFactory.getLogger(TinyRedisServer.class);

    private final TinyRedisConfig config;
    private final StorageEngine storage;
    private final ServerTransport transport;

    public TinyRedisServer(TinyRedisConfig config) {
        this.config = config;

        // 1. 初始化存储，所有连接共享
        this.storage = new MemoryStorageEngine();

        // 2. 命令分发和请求路由，无状态，所有连接共享
        CommandDispatcher dispatcher = new CommandDispatcher(storage);
        RequestRouter router = new RequestRouter(dispatcher);
        RespParser parser = new RespParser(config.getMaxNestingDepth(), config.getMaxBulkLength(),
                config.getMaxLineLength());

        // 3. 选择网络层
        this.transport = switch (config.getIoMode()) {
            case NETTY -> new NettyServerTransport(config, parser, router);
            case BLOCKING -> new BlockingServerTransport(config, parser, router);
        };
    }

    public void start() throws IOException, InterruptedException {
        log.info("Starting tiny-redis server on {}:{} ({} mode)", config.getHost(), config.getPort(), config.getIoMode());
        transport.start();
        log.info("tiny-redis started successfully on port {}.", transport.port());
    }

    public int getPort() {
        return transport.port();
    }

    public StorageEngine getStorage() {
        return storage;
    }

    public void awaitTermination() throws InterruptedException {
        transport.awaitTermination();
    }

    public void shutdown() {
        transport.shutdown();
        log.info("tiny-redis stopped, {} keys were in memory.", storage.size());
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. 初始化配置并解析参数
        TinyRedisConfig config = TinyRedisConfig.getInstance();
        config.load(args);

        TinyRedisServer server = new TinyRedisServer(config);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start server", e);
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "tiny-redis-shutdown"));
        server.awaitTermination();
    }
}
