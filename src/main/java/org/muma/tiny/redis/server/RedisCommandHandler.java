package org.muma.tiny.redis.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.RespDecodeException;
import org.muma.tiny.redis.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Netty 模式下的连接处理器，每个 Channel 一个实例。
 * <p>
 * Channel 固定在一个 EventLoop 线程上，请求按到达顺序逐个处理，每个回复写出并 flush 后才处理下一个。
 * 解码错误或写失败都会关闭本连接，不影响其他连接。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final RequestRouter router;
    private ConnectionState state = ConnectionState.AWAITING_FRAME;

    public RedisCommandHandler(RequestRouter router) {
        this.router = router;
    }

    public ConnectionState getState() {
        return state;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(),
                connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        state = ConnectionState.CLOSED;
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(),
                connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (state == ConnectionState.CLOSED) {
            return;
        }
        state = ConnectionState.DISPATCHING;
        router.route(msg, reply -> {
            state = ConnectionState.REPLYING;
            ctx.writeAndFlush(reply).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        });
        if (state != ConnectionState.CLOSED) {
            state = ConnectionState.AWAITING_FRAME;
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (state == ConnectionState.CLOSED) {
            return;
        }
        state = ConnectionState.CLOSED;

        if (cause instanceof RespDecodeException e && e.getReason() != RespDecodeException.Reason.IO) {
            // 协议错误：尽量把错误回复和之前缓冲的数据刷出去，再关闭
            log.warn("Protocol error from {}: {} ({})", ctx.channel().remoteAddress(),
                    TextUtils.printable(e.getMessage(), 128), e.getReason());
            ctx.writeAndFlush(ErrorMessage.protocolError(e.getMessage()))
                    .addListener(ChannelFutureListener.CLOSE);
        } else if (cause instanceof IOException) {
            log.info("Connection {} dropped: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.close();
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
