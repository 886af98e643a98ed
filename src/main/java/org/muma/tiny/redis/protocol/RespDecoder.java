package org.muma.tiny.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;

import java.util.List;

/**
 * RESP 协议解码器
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不够时整帧回滚，等下一批字节到达后重新解析。
 * <p>
 * 每个顶层帧都允许内联命令，所以 "SET a 1\r\nGET a\r\n" 这种纯文本流水线也能被拆成两个请求。
 * 一旦解码失败，后续字节全部丢弃，由下游 handler 关闭连接。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    private final RespParser parser;
    private boolean failed;

    public RespDecoder() {
        this(new RespParser());
    }

    public RespDecoder(RespParser parser) {
        this.parser = parser;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(actualReadableBytes());
            return;
        }

        RedisMessage msg;
        try {
            msg = parser.parse(new ByteBufSource(in), true);
        } catch (RespDecodeException e) {
            failed = true;
            throw e;
        }
        if (msg != null) {
            out.add(msg);
        }
    }
}
