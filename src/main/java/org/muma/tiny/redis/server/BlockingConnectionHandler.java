package org.muma.tiny.redis.server;

import org.muma.tiny.redis.protocol.ByteSource;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.RespDecodeException;
import org.muma.tiny.redis.protocol.RespParser;
import org.muma.tiny.redis.protocol.RespSerializer;
import org.muma.tiny.redis.protocol.StreamByteSource;
import org.muma.tiny.redis.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.Socket;

/**
 * 阻塞模式下的连接处理器，每个连接占用一个线程。
 * <p>
 * 循环：读一帧 -> 路由执行 -> 写回复并 flush -> 再读下一帧。
 * 只会阻塞在读 socket 和写回复上，直到对端关闭、解码失败或 IO 出错。
 */
public class BlockingConnectionHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BlockingConnectionHandler.class);

    private final Socket socket;
    private final RespParser parser;
    private final RequestRouter router;

    private volatile ConnectionState state = ConnectionState.AWAITING_FRAME;

    public BlockingConnectionHandler(Socket socket, RespParser parser, RequestRouter router) {
        this.socket = socket;
        this.parser = parser;
        this.router = router;
    }

    public ConnectionState getState() {
        return state;
    }

    @Override
    public void run() {
        Object remote = socket.getRemoteSocketAddress();
        log.info("Client connected: {}", remote);
        try (Socket s = socket;
             InputStream in = s.getInputStream();
             OutputStream out = new BufferedOutputStream(s.getOutputStream())) {
            serve(in, out);
        } catch (IOException e) {
            log.info("Connection {} dropped: {}", remote, e.getMessage());
        } finally {
            state = ConnectionState.CLOSED;
            log.info("Client disconnected: {}", remote);
        }
    }

    /**
     * 在给定的流上跑请求循环，返回时连接进入 CLOSED。
     */
    void serve(InputStream in, OutputStream out) throws IOException {
        ByteSource source = new StreamByteSource(in);
        try {
            while (true) {
                state = ConnectionState.AWAITING_FRAME;
                RedisMessage request;
                try {
                    request = parser.parse(source, true);
                } catch (RespDecodeException e) {
                    onDecodeError(e, out);
                    return;
                }
                if (request == null) {
                    // 对端正常关闭
                    return;
                }

                state = ConnectionState.DISPATCHING;
                router.route(request, reply -> write(reply, out));
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } finally {
            state = ConnectionState.CLOSED;
        }
    }

    private void write(RedisMessage reply, OutputStream out) {
        state = ConnectionState.REPLYING;
        try {
            out.write(RespSerializer.serialize(reply));
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void onDecodeError(RespDecodeException e, OutputStream out) throws IOException {
        if (e.getReason() == RespDecodeException.Reason.IO) {
            log.info("Read failed on {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
            return;
        }
        log.warn("Protocol error from {}: {} ({})", socket.getRemoteSocketAddress(),
                TextUtils.printable(e.getMessage(), 128), e.getReason());
        // 尽量把错误回复刷出去再关闭
        out.write(RespSerializer.serialize(ErrorMessage.protocolError(e.getMessage())));
        out.flush();
    }
}
