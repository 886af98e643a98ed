package org.muma.tiny.redis.protocol;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * 基于阻塞 InputStream 的字节源，用于每连接一个线程的模式。
 * read 会一直阻塞到有数据或对端关闭。
 */
public class StreamByteSource implements ByteSource {

    private final InputStream in;

    public StreamByteSource(InputStream in) {
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
    }

    @Override
    public int read() {
        try {
            return in.read();
        } catch (IOException e) {
            throw new RespDecodeException(RespDecodeException.Reason.IO, "Read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] readExact(int length) {
        byte[] buf;
        try {
            buf = in.readNBytes(length);
        } catch (IOException e) {
            throw new RespDecodeException(RespDecodeException.Reason.IO, "Read failed: " + e.getMessage(), e);
        }
        if (buf.length < length) {
            throw new RespDecodeException(RespDecodeException.Reason.UNEXPECTED_EOF,
                    "Expected " + length + " bytes but stream ended after " + buf.length);
        }
        return buf;
    }
}
