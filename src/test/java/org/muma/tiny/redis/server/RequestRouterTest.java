package org.muma.tiny.redis.server;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.tiny.redis.command.CommandDispatcher;
import org.muma.tiny.redis.protocol.BulkString;
import org.muma.tiny.redis.protocol.RedisArray;
import org.muma.tiny.redis.protocol.RedisInteger;
import org.muma.tiny.redis.protocol.RedisMessage;
import org.muma.tiny.redis.protocol.SimpleString;
import org.muma.tiny.redis.store.impl.MemoryStorageEngine;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RequestRouterTest {

    private final List<RedisMessage> replies = new ArrayList<>();
    private RequestRouter router;

    @BeforeEach
    void setUp() {
        router = new RequestRouter(new CommandDispatcher(new MemoryStorageEngine()));
    }

    private static RedisArray command(String... parts) {
        RedisMessage[] elements = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = new BulkString(parts[i]);
        }
        return new RedisArray(elements);
    }

    @Test
    void testSingleCommand() {
        router.route(command("PING"), replies::add);
        assertEquals(List.of(SimpleString.PONG), replies);
    }

    @Test
    void testBatchRepliesInOrder() {
        RedisArray batch = RedisArray.of(
                command("SET", "a", "1"),
                command("GET", "a"),
                command("DEL", "a"),
                command("GET", "a"));

        router.route(batch, replies::add);

        assertEquals(List.of(SimpleString.OK, new BulkString("1"), new RedisInteger(1), BulkString.NULL), replies);
    }

    @Test
    void testBatchSkipsNonArrayElements() {
        RedisArray batch = RedisArray.of(
                RedisArray.of(command("PING")),
                RedisArray.NULL,
                new RedisInteger(7),
                command("PING"));

        router.route(batch, replies::add);

        // 第一个元素本身又是一层批量
        assertEquals(List.of(SimpleString.PONG, SimpleString.PONG), replies);
    }

    @Test
    void testEmptyArrayProducesNoReply() {
        router.route(RedisArray.of(), replies::add);
        router.route(RedisArray.of(RedisArray.of()), replies::add);
        assertTrue(replies.isEmpty());
    }

    @Test
    void testNonArrayIsProtocolError() {
        router.route(new SimpleString("PING"), replies::add);
        router.route(new BulkString("PING"), replies::add);
        router.route(RedisArray.NULL, replies::add);

        assertEquals(List.of(RequestRouter.EXPECTED_ARRAY, RequestRouter.EXPECTED_ARRAY, RequestRouter.EXPECTED_ARRAY),
                replies);
        assertEquals("ERR protocol error: expected array", RequestRouter.EXPECTED_ARRAY.content());
    }

    @Test
    void testNonArrayNeverReachesDispatcher() {
        CommandDispatcher dispatcher = mock(CommandDispatcher.class);
        RequestRouter mocked = new RequestRouter(dispatcher);

        mocked.route(new RedisInteger(1), replies::add);
        mocked.route(RedisArray.of(), replies::add);

        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void testWholeArrayIsPassedToDispatcher() {
        CommandDispatcher dispatcher = mock(CommandDispatcher.class);
        when(dispatcher.dispatch(any())).thenReturn(SimpleString.OK);
        RequestRouter mocked = new RequestRouter(dispatcher);

        RedisArray request = RedisArray.of(new SimpleString("SET"), new SimpleString("a"), new RedisInteger(1));
        mocked.route(request, replies::add);

        verify(dispatcher).dispatch(request);
        assertEquals(List.of(SimpleString.OK), replies);
    }
}
