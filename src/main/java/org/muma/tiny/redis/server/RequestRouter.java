package org.muma.tiny.redis.server;

import org.muma.tiny.redis.command.CommandDispatcher;
import org.muma.tiny.redis.protocol.ErrorMessage;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.utils.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * 把一个顶层请求路由成零个或多个命令，两种 IO 模式共用。
 * <ul>
 *     <li>首元素有文本 (命令名)：整个数组作为一条命令，产生一个回复</li>
 *     <li>首元素没有文本 (例如嵌套数组)：把其中每个非 null 的子数组当作独立请求递归处理 (批量命令)</li>
 *     <li>空数组：不产生回复</li>
 *     <li>不是数组或 null 数组：回复协议错误，不执行任何命令</li>
 * </ul>
 * 回复按请求顺序交给 replySink。
 */
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    static final ErrorMessage EXPECTED_ARRAY = new ErrorMessage("ERR protocol error: expected array");

    private final CommandDispatcher dispatcher;

    public RequestRouter(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public void route(RedisMessage request, Consumer<RedisMessage> replySink) {
        if (!(request instanceof RedisArray array) || array.isNull()) {
            log.warn("Received non-array message: {}", TextUtils.printable(String.valueOf(request), 128));
            replySink.accept(EXPECTED_ARRAY);
            return;
        }
        routeArray(array, replySink);
    }

    private void routeArray(RedisArray array, Consumer<RedisMessage> replySink) {
        RedisMessage first = array.get(0);
        if (first == null) {
            return;
        }

        if (first.asText() != null) {
            if (log.isDebugEnabled()) {
                log.debug("Execute Command: {}", TextUtils.printable(array.toString(), 256));
            }
            replySink.accept(dispatcher.dispatch(array));
            return;
        }

        // 批量：逐个处理嵌套的命令数组，其余元素跳过
        for (RedisMessage element : array.elements()) {
            if (element instanceof RedisArray inner && !inner.isNull()) {
                routeArray(inner, replySink);
            }
        }
    }
}
