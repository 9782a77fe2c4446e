package com.taskforge.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.config.TaskForgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisStreamingCacheTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private TaskForgeProperties properties;
    private RedisStreamingCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        properties = new TaskForgeProperties();
        cache = new RedisStreamingCache(redisTemplate, new ObjectMapper(), properties);
    }

    @Test
    void testInitializeWritesEmptyBufferAndState() {
        cache.initialize(1L, 10L, 1000L);

        verify(valueOperations).set("executor:streaming:10", "", Duration.ofHours(1));
        ArgumentCaptor<String> state = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("executor:streaming:state:10"), state.capture(), eq(Duration.ofHours(1)));
        assertTrue(state.getValue().contains("\"status\":\"streaming\""));
        assertTrue(state.getValue().contains("\"started_at\":1000"));
    }

    @Test
    void testWriteSkipsEmptyOptionalBuffers() {
        cache.write(new CachedStream(1L, 10L, "streaming", "AB", 2L, "", 0L, List.of(), Map.of(), 1000L, 2000L));

        verify(valueOperations).set("executor:streaming:10", "AB", Duration.ofHours(1));
        verify(valueOperations, never()).set(eq("executor:reasoning:10"), anyString(), any(Duration.class));
        verify(valueOperations, never()).set(eq("executor:thinking:10"), anyString(), any(Duration.class));
        verify(valueOperations, never()).set(eq("executor:workbench:10"), anyString(), any(Duration.class));
    }

    @Test
    void testWriteUsesConfiguredTtl() {
        properties.getStreaming().setCacheTtl(Duration.ofMinutes(10));

        cache.write(new CachedStream(1L, 10L, "streaming", "AB", 2L, "r", 1L,
                List.of(Map.of("title", "plan")), Map.of("status", "running"), 1000L, 2000L));

        verify(valueOperations).set("executor:reasoning:10", "r", Duration.ofMinutes(10));
        verify(valueOperations).set("executor:thinking:10", "[{\"title\":\"plan\"}]", Duration.ofMinutes(10));
        verify(valueOperations).set("executor:workbench:10", "{\"status\":\"running\"}", Duration.ofMinutes(10));
    }

    @Test
    void testReadRebuildsStream() {
        when(valueOperations.get("executor:streaming:state:10")).thenReturn(
                "{\"task_id\":1,\"status\":\"streaming\",\"offset\":2,\"reasoning_offset\":1,"
                        + "\"started_at\":1000,\"last_update_at\":2000}");
        when(valueOperations.get("executor:streaming:10")).thenReturn("AB");
        when(valueOperations.get("executor:reasoning:10")).thenReturn("r");
        when(valueOperations.get("executor:thinking:10")).thenReturn("[{\"title\":\"plan\"}]");

        Optional<CachedStream> stream = cache.read(10L);

        assertTrue(stream.isPresent());
        assertEquals(Long.valueOf(1L), stream.get().taskId());
        assertEquals("AB", stream.get().content());
        assertEquals(2L, stream.get().offset());
        assertEquals(1L, stream.get().reasoningOffset());
        assertEquals("plan", stream.get().thinking().get(0).get("title"));
        assertTrue(stream.get().workbench().isEmpty());
        assertEquals(2000L, stream.get().lastUpdateAt());
    }

    @Test
    void testReadMissingStreamIsEmpty() {
        assertTrue(cache.read(10L).isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testPurgeRemovesEveryKey() {
        cache.purge(10L);

        ArgumentCaptor<Collection<String>> keys = ArgumentCaptor.forClass(Collection.class);
        verify(redisTemplate).delete(keys.capture());
        assertEquals(6, keys.getValue().size());
        assertTrue(keys.getValue().contains("executor:cancel:10"));
        assertTrue(keys.getValue().contains("executor:workbench:10"));
    }

    @Test
    void testCancelFlag() {
        when(redisTemplate.hasKey("executor:cancel:10")).thenReturn(true);

        assertTrue(cache.requestCancel(10L));
        verify(valueOperations).set("executor:cancel:10", "1", Duration.ofMinutes(5));
        assertTrue(cache.isCancelRequested(10L));
        assertFalse(cache.isCancelRequested(11L));
    }

    @Test
    void testCancelFailureIsReported() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertFalse(cache.requestCancel(10L));
    }
}
