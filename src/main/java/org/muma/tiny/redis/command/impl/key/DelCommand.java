package org.muma.tiny.redis.command.impl.key;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisInteger;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

public class DelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // 格式: DEL key [key ...]
        // 没有文本的元素 (嵌套数组、null、错误) 直接跳过，不算参数
        List<String> keys = new ArrayList<>();
        for (int i = 1; i < args.size(); i++) {
            String key = argument(args, i);
            if (key != null) {
                keys.add(key);
            }
        }

        return new RedisInteger(storage.del(keys));
    }
}
