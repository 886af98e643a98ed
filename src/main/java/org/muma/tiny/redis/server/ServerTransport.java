package org.muma.tiny.redis.server;

import java.io.IOException;

/**
 * 监听端口并为每个连接启动独立处理单元的网络层。
 */
public interface ServerTransport {

    /**
     * 绑定端口并开始接受连接，绑定完成后立即返回。
     */
    void start() throws IOException, InterruptedException;

    /**
     * @return 实际监听的端口 (配置为 0 时是系统分配的端口)
     */
    int port();

    // 阻塞直到监听关闭
    void awaitTermination() throws InterruptedException;

    void shutdown();
}
