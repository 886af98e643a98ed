package org.muma.tiny.redis.protocol;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编解码的性质测试：随机生成值和字节
 */
class RespCodecPropertyTest {

    private final RespParser parser = new RespParser();

    @Property
    void serializedValuesParseBack(@ForAll("values") RedisMessage value) {
        byte[] bytes = RespSerializer.serialize(value);

        RedisMessage parsed = parser.parse(new ByteBufSource(Unpooled.wrappedBuffer(bytes)), false);

        assertEquals(value, parsed);
    }

    @Property
    void serializedValuesParseBackFromStream(@ForAll("values") RedisMessage value) {
        byte[] bytes = RespSerializer.serialize(value);

        RedisMessage parsed = parser.parse(new StreamByteSource(new ByteArrayInputStream(bytes)), false);

        assertEquals(value, parsed);
    }

    @Property
    void arbitraryInputOnlyFailsWithDecodeErrors(@ForAll("wireNoise") byte[] input) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder(new RespParser(8, 1024, 64)));
        try {
            channel.writeInbound(Unpooled.wrappedBuffer(input));
            channel.finish();
        } catch (RespDecodeException e) {
            // 格式错误只能以解码异常的形式出现
            assertNotNull(e.getReason());
        } finally {
            channel.finishAndReleaseAll();
        }
    }

    @Provide
    Arbitrary<RedisMessage> values() {
        return value(3);
    }

    // 混合 RESP 片段和随机字节，比纯随机字节更容易走进深层分支
    @Provide
    Arbitrary<byte[]> wireNoise() {
        Arbitrary<byte[]> fragments = Arbitraries.of(
                        "*2\r\n", "*-1\r\n", "*0\r\n", "*99\r\n", "$3\r\n", "$-1\r\n", "$-2\r\n", "$0\r\n",
                        "+OK\r\n", "-ERR x\r\n", ":1\r\n", ":x\r\n", "foo", "\r\n", "\r", "\n", " ", "SET a 1",
                        "$99999999999\r\n", "\u00ff")
                .list().ofMaxSize(12)
                .map(parts -> String.join("", parts).getBytes(StandardCharsets.ISO_8859_1));
        Arbitrary<byte[]> raw = Arbitraries.bytes().array(byte[].class).ofMaxSize(64);
        return Arbitraries.oneOf(fragments, raw,
                Arbitraries.integers().between(0, 200).map(n -> "*1\r\n".repeat(n).getBytes(StandardCharsets.US_ASCII)));
    }

    private Arbitrary<RedisMessage> value(int depth) {
        if (depth == 0) {
            return scalars();
        }
        Arbitrary<RedisMessage> array = value(depth - 1).list().ofMaxSize(4)
                .map(elements -> new RedisArray(elements.toArray(new RedisMessage[0])));
        return Arbitraries.<RedisMessage>oneOf(scalars(), array, Arbitraries.just(RedisArray.NULL));
    }

    private Arbitrary<RedisMessage> scalars() {
        // 行内文本不能有 CR / LF，批量字符串可以
        Arbitrary<String> lineText = Arbitraries.strings()
                .withCharRange(' ', '~')
                .withCharRange('\u4e00', '\u4fff')
                .withChars('\t')
                .ofMaxLength(16);
        Arbitrary<String> bulkText = Arbitraries.strings()
                .withCharRange(' ', '~')
                .withCharRange('\u4e00', '\u4fff')
                .withChars('\r', '\n', '\0')
                .ofMaxLength(16);
        return Arbitraries.<RedisMessage>oneOf(
                lineText.map(SimpleString::new),
                lineText.map(ErrorMessage::new),
                Arbitraries.longs().map(RedisInteger::new),
                bulkText.map(BulkString::new),
                Arbitraries.just(BulkString.NULL));
    }
}
