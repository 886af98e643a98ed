package org.muma.tiny.redis.command.impl.server;

import org.muma.tiny.redis.command.RedisCommand;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.SimpleString;
import org.muma.tiny.redis.store.StorageEngine;

public class PingCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // 多余的参数忽略
        return SimpleString.PONG;
    }
}
