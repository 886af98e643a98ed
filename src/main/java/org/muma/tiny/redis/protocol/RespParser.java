package org.muma.tiny.redis.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.muma.tiny.redis.protocol.RespDecodeException.Reason;

/**
 * RESP 协议解析器
 * <p>
 * 从 {@link ByteSource} 中读出一个完整的 {@link RedisMessage}。同一套逻辑同时服务于阻塞流和 Netty 的 ByteBuf。
 * <ul>
 *     <li>"+" "-" ":" 读取到 CRLF 为止的一行</li>
 *     <li>"$" 先读长度，再精确读取 length 个字节和结尾 CRLF，-1 表示 Null Bulk String</li>
 *     <li>"*" 先读元素个数，再递归解析，-1 表示 Null Array；数组内部不允许内联命令</li>
 *     <li>其他字节：只有顶层允许时按内联命令处理 (如 "SET a 1\r\n")</li>
 * </ul>
 * 解析器本身无状态，可以被多个连接共享。
 */
public class RespParser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;
    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final int CR = '\r';
    private static final int LF = '\n';

    private final int maxNestingDepth;
    private final long maxBulkLength;
    private final int maxLineLength;

    public RespParser() {
        this(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_LINE_LENGTH);
    }

    public RespParser(int maxNestingDepth, long maxBulkLength) {
        this(maxNestingDepth, maxBulkLength, DEFAULT_MAX_LINE_LENGTH);
    }

    /**
     * @param maxLineLength 单行 (内联命令、+ - : 行、长度行) 内容的最大字节数，不含 CRLF
     */
    public RespParser(int maxNestingDepth, long maxBulkLength, int maxLineLength) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        if (maxBulkLength < 0) {
            throw new IllegalArgumentException("maxBulkLength must not be negative: " + maxBulkLength);
        }
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        this.maxNestingDepth = maxNestingDepth;
        this.maxBulkLength = maxBulkLength;
        this.maxLineLength = maxLineLength;
    }

    /**
     * 解析下一个值。
     *
     * @param source      字节源
     * @param allowInline 顶层是否接受不带类型前缀的内联命令
     * @return 解析出的值；在新帧的第一个字节之前输入就结束 (对端正常关闭) 时返回 null
     * @throws RespDecodeException 帧格式错误或帧不完整
     */
    public RedisMessage parse(ByteSource source, boolean allowInline) {
        int lead = source.read();
        if (lead == -1) {
            return null;
        }
        return parseValue(source, lead, allowInline, 0);
    }

    private RedisMessage parseValue(ByteSource source, int lead, boolean allowInline, int depth) {
        return switch (lead) {
            case PLUS_BYTE -> new SimpleString(readLine(source));
            case MINUS_BYTE -> new ErrorMessage(readLine(source));
            case COLON_BYTE -> new RedisInteger(readLong(source));
            case DOLLAR_BYTE -> parseBulkString(source);
            case ASTERISK_BYTE -> parseArray(source, depth);
            default -> {
                if (allowInline) {
                    yield parseInline(source, lead);
                }
                throw new RespDecodeException(Reason.UNKNOWN_TYPE, "Unknown RESP type byte: " + describe(lead));
            }
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private BulkString parseBulkString(ByteSource source) {
        long length = readLength(source, "bulk string");
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length > maxBulkLength) {
            throw new RespDecodeException(Reason.BULK_TOO_LARGE,
                    "Bulk string length " + length + " exceeds limit " + maxBulkLength);
        }

        byte[] content = source.readExact((int) length);
        readCrlf(source);

        // 校验是合法 UTF-8，内容仍保持原始字节
        decodeText(content);
        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisArray parseArray(ByteSource source, int depth) {
        long count = readLength(source, "array");
        if (count == -1) {
            return RedisArray.NULL;
        }
        if (depth >= maxNestingDepth) {
            throw new RespDecodeException(Reason.NESTING_TOO_DEEP,
                    "Array nesting exceeds limit " + maxNestingDepth);
        }

        // 声明的个数不可信，不按它预分配
        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count, 16));
        while (elements.size() < count) {
            int lead = source.read();
            if (lead == -1) {
                throw new RespDecodeException(Reason.UNEXPECTED_EOF,
                        "Array declared " + count + " elements but input ended after " + elements.size());
            }
            elements.add(parseValue(source, lead, false, depth + 1));
        }
        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    // 内联命令：首字节 + 本行剩余内容，按单个空格切分，数字 token 转成整数
    private RedisArray parseInline(ByteSource source, int lead) {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b = lead;
        while (b != -1 && b != LF) {
            // 结尾的 CR 不算内容，所以多留一个字节
            if (line.size() > maxLineLength) {
                throw lineTooLong();
            }
            line.write(b);
            b = source.read();
        }

        byte[] bytes = line.toByteArray();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == CR) {
            length--;
        }
        if (length > maxLineLength) {
            throw lineTooLong();
        }
        String text = decodeText(bytes, length);
        if (text.indexOf(CR) >= 0) {
            throw new RespDecodeException(Reason.INVALID_TEXT, "Inline command contains a bare CR");
        }

        List<RedisMessage> tokens = new ArrayList<>();
        for (String token : text.split(" ")) {
            if (token.isEmpty()) {
                continue;
            }
            tokens.add(isInteger(token) ? new RedisInteger(Long.parseLong(token)) : new SimpleString(token));
        }
        return new RedisArray(tokens.toArray(new RedisMessage[0]));
    }

    // 辅助：读取一行字符串（即读取到 \r\n 为止），行内不允许单独的 \r 或 \n
    private String readLine(ByteSource source) {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        boolean lastWasCr = false;
        while (true) {
            int b = source.read();
            if (b == -1) {
                throw new RespDecodeException(Reason.MISSING_TERMINATOR, "Line is not terminated by CRLF");
            }
            if (lastWasCr) {
                if (b != LF) {
                    throw new RespDecodeException(Reason.INVALID_TEXT, "Line contains a bare CR");
                }
                return decodeText(line.toByteArray());
            }
            if (b == CR) {
                lastWasCr = true;
                continue;
            }
            if (b == LF) {
                throw new RespDecodeException(Reason.INVALID_TEXT, "Line contains a bare LF");
            }
            if (line.size() >= maxLineLength) {
                throw lineTooLong();
            }
            line.write(b);
        }
    }

    private RespDecodeException lineTooLong() {
        return new RespDecodeException(Reason.LINE_TOO_LONG, "Line exceeds limit " + maxLineLength);
    }

    // 辅助：读取并解析长整型
    private long readLong(ByteSource source) {
        String s = readLine(source);
        if (!isInteger(s)) {
            throw new RespDecodeException(Reason.MALFORMED_INTEGER, "Invalid integer: '" + s + "'");
        }
        return Long.parseLong(s);
    }

    // 长度字段：-1 是 null 哨兵，其他负数和超出 int 下标范围的值都拒绝
    private long readLength(ByteSource source, String what) {
        long length = readLong(source);
        if (length == -1) {
            return -1;
        }
        if (length < 0) {
            throw new RespDecodeException(Reason.NEGATIVE_LENGTH, "Negative " + what + " length: " + length);
        }
        if (length > Integer.MAX_VALUE) {
            throw new RespDecodeException(Reason.NEGATIVE_LENGTH,
                    "The " + what + " length " + length + " does not fit in an array index");
        }
        return length;
    }

    // 辅助：跳过 CRLF
    private void readCrlf(ByteSource source) {
        int b1 = source.read();
        int b2 = source.read();
        if (b1 != CR || b2 != LF) {
            throw new RespDecodeException(Reason.MISSING_TERMINATOR, "Expected CRLF after bulk string payload");
        }
    }

    private static String decodeText(byte[] bytes) {
        return decodeText(bytes, bytes.length);
    }

    private static String decodeText(byte[] bytes, int length) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, 0, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new RespDecodeException(Reason.INVALID_TEXT, "Text is not valid UTF-8", e);
        }
    }

    // Long.parseLong 也接受非 ASCII 数字，这里先限定成 [+-]?[0-9]+
    private static boolean isInteger(String s) {
        int length = s.length();
        if (length == 0) {
            return false;
        }
        int start = (s.charAt(0) == '-' || s.charAt(0) == '+') ? 1 : 0;
        if (start == length) {
            return false;
        }
        for (int i = start; i < length; i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        // 位数超出 long 范围的由 parseLong 拒绝
        try {
            Long.parseLong(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String describe(int b) {
        return (b >= 0x20 && b < 0x7F) ? "'" + (char) b + "'" : String.format("0x%02X", b);
    }
}
