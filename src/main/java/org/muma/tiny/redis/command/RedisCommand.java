package org.muma.tiny.redis.command;

import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.store.StorageEngine;

public interface RedisCommand {
    // 执行命令，传入存储引擎和完整请求 (第 0 个元素是命令名)
    RedisMessage execute(StorageEngine storage, RedisArray args);

    /**
     * 辅助工具：按位置取参数文本
     * SimpleString、BulkString、整数都可以作为参数；不存在或类型不对时返回 null
     */
    default String argument(RedisArray args, int index) {
        RedisMessage element = args.get(index);
        return element == null ? null : element.asText();
    }
}
