package org.muma.tiny.redis.server;

/**
 * 单个连接的处理状态
 * AWAITING_FRAME -> DISPATCHING -> REPLYING -> AWAITING_FRAME，终态 CLOSED
 */
public enum ConnectionState {
    AWAITING_FRAME,
    DISPATCHING,
    REPLYING,
    CLOSED
}
