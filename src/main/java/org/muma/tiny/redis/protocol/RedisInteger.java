package org.muma.tiny.redis.protocol;

// 3. 整数 (:)
public record RedisInteger(long value) implements RedisMessage {

    // 内联命令里的数字 token 会被解析成整数，作为参数时按十进制还原
    @Override
    public String asText() {
        return Long.toString(value);
    }
}
