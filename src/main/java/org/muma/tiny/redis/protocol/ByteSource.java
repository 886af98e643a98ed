package org.muma.tiny.redis.protocol;

/**
 * 解析器读取字节的游标。
 * 阻塞流和 Netty 的 ByteBuf 都通过它接入同一套解析逻辑。
 */
public interface ByteSource {

    /**
     * 读取下一个字节。
     *
     * @return 0-255，输入结束时返回 -1
     */
    int read();

    /**
     * 精确读取 length 个字节。
     *
     * @throws RespDecodeException 输入在读满之前结束 ({@code UNEXPECTED_EOF})
     */
    byte[] readExact(int length);
}
