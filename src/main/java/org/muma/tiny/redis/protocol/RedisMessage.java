package org.muma.tiny.redis.protocol;

// 密封接口，限制实现类
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {

    /**
     * 作为命令参数时的文本形式。
     * 只有 SimpleString、非空 BulkString 和 RedisInteger 有文本，其余返回 null。
     */
    default String asText() {
        return null;
    }
}
