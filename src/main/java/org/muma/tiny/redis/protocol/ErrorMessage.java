package org.muma.tiny.redis.protocol;

import org.muma.tiny.redis.utils.TextUtils;

import java.util.Objects;

// 2. 错误 (-)，错误不能作为命令参数，asText 保持 null
public record ErrorMessage(String content) implements RedisMessage {

    public ErrorMessage {
        Objects.requireNonNull(content, "content");
        SimpleString.checkLine(content);
    }

    /**
     * 解码失败时回给客户端的错误，detail 里可能带有客户端原始字节，先转义
     */
    public static ErrorMessage protocolError(String detail) {
        return new ErrorMessage("ERR Protocol error: " + TextUtils.printable(detail));
    }
}
