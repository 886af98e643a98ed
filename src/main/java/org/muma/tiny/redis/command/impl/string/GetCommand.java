package org.muma.tiny.redis.command.impl.string;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.BulkString;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.store.StorageEngine;

public class GetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // 格式: GET key
        String key = argument(args, 1);
        if (key == null) {
            return new ErrorMessage("No key provided");
        }

        String value = storage.get(key);
        if (value == null) {
            return BulkString.NULL; // Nil
        }
        return new BulkString(value);
    }
}
