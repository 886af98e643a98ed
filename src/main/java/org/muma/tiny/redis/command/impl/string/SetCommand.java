package org.muma.tiny.redis.command.impl.string;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.SimpleString;
import org.muma.tiny.redis.store.StorageEngine;

public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // 基本格式: SET key value，不支持 NX/XX/EX 等选项，多余参数忽略
        String key = argument(args, 1);
        if (key == null) {
            return new ErrorMessage("No key provided");
        }
        String value = argument(args, 2);
        if (value == null) {
            return new ErrorMessage("No value provided");
        }

        storage.set(key, value);
        return SimpleString.OK;
    }
}
