package org.muma.tiny.redis.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * RESP 解码失败。
 * <p>
 * 解码错误对当前连接是致命的：连接会被关闭，不做半帧重试。
 * 继承 Netty 的 {@link DecoderException}，这样在 pipeline 里抛出时不会被再包一层。
 */
public class RespDecodeException extends DecoderException {

    public enum Reason {
        /** 底层读取失败 */
        IO,
        /** 整数或长度字段不是合法的 64 位整数 */
        MALFORMED_INTEGER,
        /** 文本不是合法的 UTF-8 */
        INVALID_TEXT,
        /** 除 -1 以外的负长度，或超出数组下标范围的长度 */
        NEGATIVE_LENGTH,
        /** 行或批量字符串缺少结尾的 CRLF */
        MISSING_TERMINATOR,
        /** 帧还没读完输入就结束了 */
        UNEXPECTED_EOF,
        /** 无法识别的类型前缀 */
        UNKNOWN_TYPE,
        NESTING_TOO_DEEP,
        BULK_TOO_LARGE,
        /** 单行内容超过上限 */
        LINE_TOO_LONG
    }

    private final Reason reason;

    public RespDecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RespDecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
