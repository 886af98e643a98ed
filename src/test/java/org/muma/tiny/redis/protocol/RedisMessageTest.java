package org.muma.tiny.redis.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RedisMessageTest {

    @Test
    void testLineValuesRejectCrLf() {
        assertThrows(IllegalArgumentException.class, () -> new SimpleString("a\r\nb"));
        assertThrows(IllegalArgumentException.class, () -> new SimpleString("a\rb"));
        assertThrows(IllegalArgumentException.class, () -> new ErrorMessage("ERR\nfake"));
        assertDoesNotThrow(() -> new SimpleString("tab\tis fine"));
    }

    @Test
    void testProtocolErrorIsSingleLine() {
        ErrorMessage error = ErrorMessage.protocolError("Invalid integer: '1\r\n+OK'");

        assertEquals("ERR Protocol error: Invalid integer: '1\\x0D\\x0A+OK'", error.content());
        String wire = new String(RespSerializer.serialize(error), StandardCharsets.UTF_8);
        assertEquals(wire.length() - 2, wire.indexOf("\r\n"), "Only the terminating CRLF");
    }

    @Test
    void testArgumentText() {
        assertEquals("k", new SimpleString("k").asText());
        assertEquals("k", new BulkString("k").asText());
        assertEquals("-3", new RedisInteger(-3).asText());
        assertNull(BulkString.NULL.asText());
        assertNull(new ErrorMessage("ERR").asText());
        assertNull(RedisArray.of().asText());
    }
}
