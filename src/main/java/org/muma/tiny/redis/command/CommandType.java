package org.muma.tiny.redis.command;

import org.muma.tiny.redis.command.impl.key.DelCommand;
import org.muma.tiny.redis.command.impl.server.PingCommand;
import org.muma.tiny.redis.command.impl.string.GetCommand;
import org.muma.tiny.redis.command.impl.string.SetCommand;

import java.util.HashMap;
import java.util.Map;

/**
 * 支持的命令是固定的几个，用枚举做封闭的命令表。
 * 命令名区分大小写，必须完全匹配。
 */
public enum CommandType {
    PING(new PingCommand()),
    GET(new GetCommand()),
    SET(new SetCommand()),
    DEL(new DelCommand()),
    UNKNOWN(null);

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            if (type != UNKNOWN) {
                BY_NAME.put(type.name(), type);
            }
        }
    }

    private final RedisCommand command;

    CommandType(RedisCommand command) {
        this.command = command;
    }

    public RedisCommand command() {
        return command;
    }

    public static CommandType of(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return BY_NAME.getOrDefault(name, UNKNOWN);
    }
}
