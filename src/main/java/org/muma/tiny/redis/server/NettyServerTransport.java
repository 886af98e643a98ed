package org.muma.tiny.redis.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.tiny.redis.config.TinyRedisConfig;
import org.muma.tiny.redis.protocol.RespDecoder;
import org.muma.tiny.redis.protocol.RespEncoder;
import org.muma.tiny.redis.protocol.RespParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Netty 网络层：一个 boss 线程接受连接，worker 事件循环处理读写。
 * 每个连接有自己的解码器和 {@link RedisCommandHandler}，解析器和路由器是共享的。
 */
public class NettyServerTransport implements ServerTransport {

    private static final Logger log = LoggerFactory.getLogger(NettyServerTransport.class);

    private final TinyRedisConfig config;
    private final RespParser parser;
    private final RequestRouter router;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public NettyServerTransport(TinyRedisConfig config, RespParser parser, RequestRouter router) {
        this.config = config;
        this.parser = parser;
        this.router = router;
    }

    @Override
    public void start() throws IOException, InterruptedException {
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("tiny-redis-boss", true));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), new DefaultThreadFactory("tiny-redis-worker", true));

        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                .handler(new LoggingHandler(LogLevel.DEBUG))
                // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder(parser))
                                .addLast(new RespEncoder())
                                .addLast(new RedisCommandHandler(router));
                    }
                });

        try {
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (Exception e) {
            shutdown();
            // sync() 会把绑定失败原样抛出，这里统一成 IOException
            if (e instanceof InterruptedException ie) {
                throw ie;
            }
            throw new IOException("Failed to bind " + config.getHost() + ":" + config.getPort(), e);
        }
        log.info("Netty transport listening on {}", serverChannel.localAddress());
    }

    @Override
    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    @Override
    public void shutdown() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
    }
}
