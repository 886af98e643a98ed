package org.muma.tiny.redis.protocol;

import java.util.Arrays;

// 5. 数组 (*) - 支持 null (表示 *-1)，空数组和 null 数组是两种值
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);

    public RedisArray {
        elements = elements == null ? null : elements.clone();
    }

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(elements);
    }

    @Override
    public RedisMessage[] elements() {
        return elements == null ? null : elements.clone();
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? -1 : elements.length;
    }

    public RedisMessage get(int index) {
        if (elements == null || index < 0 || index >= elements.length) {
            return null;
        }
        return elements[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[nil]" : "RedisArray" + Arrays.toString(elements);
    }
}
