package org.muma.tiny.redis.command;

import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.store.StorageEngine;
import org.muma.tiny.redis.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 命令分发器，所有连接共享一个实例。
 * 命令执行中的异常都转换成错误回复，不会影响连接本身。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
    }

    /**
     * 核心分发逻辑
     *
     * @param request 完整请求，第 0 个元素是命令名
     * @return 回复，永远不为 null
     */
    public RedisMessage dispatch(RedisArray request) {
        RedisMessage nameElement = request.get(0);
        String commandName = nameElement == null ? null : nameElement.asText();
        // 只用于日志，客户端传来的名字可能带控制字符
        String loggedName = TextUtils.printable(commandName, 64);

        // 1. 查找命令
        CommandType type = CommandType.of(commandName);
        if (type == CommandType.UNKNOWN) {
            log.warn("Unknown command: {}", loggedName);
            return new ErrorMessage("Unknown command");
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = type.command().execute(storage, request);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > SLOW_COMMAND_MILLIS) {
                log.warn("Slow command detected: {} cost {}ms", loggedName, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} -> {}", loggedName, response);
            }

            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误 (如参数错误)
            String detail = TextUtils.printable(e.getMessage());
            log.warn("Command execution failed (Client Error): {} - {}", loggedName, detail);
            return new ErrorMessage("ERR " + detail);

        } catch (RuntimeException e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", loggedName, e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
