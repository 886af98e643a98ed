package org.muma.tiny.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议编码工具类
 * 纯函数：同一个值永远得到相同的字节，对所有变体都有定义，不会失败。
 */
public final class RespSerializer {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.UTF_8);

    private RespSerializer() {
    }

    public static byte[] serialize(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer();
        try {
            write(msg, buf);
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    /**
     * 把 msg 编码后写入 out，数组元素递归写入。
     */
    public static void write(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeBytes(s.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeBytes(e.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeDecimal(i.value(), out);
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            byte[] content = b.content();
            if (content == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeDecimal(content.length, out);
                out.writeBytes(content);
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            RedisMessage[] elements = a.elements();
            if (elements == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeDecimal(elements.length, out);
                for (RedisMessage element : elements) {
                    write(element, out);
                }
            }
        }
    }

    // 写入十进制数字并以 CRLF 结尾
    private static void writeDecimal(long value, ByteBuf out) {
        out.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(CRLF);
    }
}
