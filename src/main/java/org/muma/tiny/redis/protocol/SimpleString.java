package org.muma.tiny.redis.protocol;

import java.util.Objects;

// 1. 简单字符串 (+)，单行文本，不能包含 CR / LF
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");

    public SimpleString {
        Objects.requireNonNull(content, "content");
        checkLine(content);
    }

    @Override
    public String asText() {
        return content;
    }

    static void checkLine(String content) {
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Line value must not contain CR or LF");
        }
    }
}
