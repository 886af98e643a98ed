package org.muma.tiny.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

/**
 * 基于 Netty ByteBuf 的字节源。
 * <p>
 * 普通 ByteBuf 就是一段固定字节，读完即视为输入结束。
 * 在 {@link RespDecoder} (ReplayingDecoder) 里，缓冲区不足时 readByte 会抛出 Signal 并回滚索引，
 * 等更多数据到达后整帧重新解析；连接关闭后缓冲区被 terminate，读完才会返回 -1。
 * 所以这里不能捕获 Signal (它是 Error)。
 */
public class ByteBufSource implements ByteSource {

    private final ByteBuf in;

    public ByteBufSource(ByteBuf in) {
        this.in = in;
    }

    @Override
    public int read() {
        if (!in.isReadable()) {
            return -1;
        }
        return in.readByte() & 0xFF;
    }

    @Override
    public byte[] readExact(int length) {
        if (in.readableBytes() < length) {
            throw new RespDecodeException(RespDecodeException.Reason.UNEXPECTED_EOF,
                    "Expected " + length + " bytes but only " + in.readableBytes() + " available");
        }
        // 先 readSlice：数据不够时在分配数组之前就回滚
        return ByteBufUtil.getBytes(in.readSlice(length));
    }
}
