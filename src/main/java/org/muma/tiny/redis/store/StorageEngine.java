package org.muma.tiny.redis.store;

import java.util.Collection;

/**
 * 键值存储，所有连接共享同一个实例。
 * 实现必须是线程安全的：读可以并发，写与其他所有访问互斥。
 */
public interface StorageEngine {

    /**
     * @return key 对应的值，不存在时返回 null
     */
    String get(String key);

    // 新建或覆盖
    void set(String key, String value);

    /**
     * 删除一组 key。
     *
     * @return 实际被删除的 key 数量，不存在的 key 不计数
     */
    long del(Collection<String> keys);

    int size();
}
