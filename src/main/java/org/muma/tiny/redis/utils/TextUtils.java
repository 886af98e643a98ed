package org.muma.tiny.redis.utils;

/**
 * 文本转义工具
 * 客户端发来的内容写进日志或错误回复之前，先把控制字符转成 \xNN，防止伪造日志行或破坏 RESP 帧。
 */
public final class TextUtils {

    private TextUtils() {
    }

    public static String printable(String text) {
        return printable(text, Integer.MAX_VALUE);
    }

    /**
     * @param maxLength 最多保留的字符数，超出部分用 "..." 表示
     */
    public static String printable(String text, int maxLength) {
        if (text == null) {
            return "null";
        }
        int limit = Math.min(text.length(), maxLength);
        StringBuilder sb = new StringBuilder(limit + 8);
        for (int i = 0; i < limit; i++) {
            char c = text.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                sb.append(String.format("\\x%02X", (int) c));
            } else {
                sb.append(c);
            }
        }
        if (text.length() > limit) {
            sb.append("...");
        }
        return sb.toString();
    }
}
