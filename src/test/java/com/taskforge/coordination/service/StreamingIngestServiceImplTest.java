package com.taskforge.coordination.service;

import com.taskforge.cache.CachedStream;
import com.taskforge.cache.StreamingCache;
import com.taskforge.config.TaskForgeProperties;
import com.taskforge.coordination.api.SubtaskUpdateService;
import com.taskforge.coordination.model.CancelState;
import com.taskforge.coordination.model.StreamSnapshot;
import com.taskforge.coordination.model.StreamingAck;
import com.taskforge.coordination.model.SubtaskUpdate;
import com.taskforge.coordination.streaming.StreamingEventParser;
import com.taskforge.coordination.streaming.StreamingSessionRegistry;
import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskRole;
import com.taskforge.entity.SubtaskStatus;
import com.taskforge.stream.TaskStreamService;
import com.taskforge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class StreamingIngestServiceImplTest {

    private static final Long TASK_ID = 7L;
    private static final Long SUBTASK_ID = 70L;

    private MutableClock clock;
    private StreamingSessionRegistry registry;
    private StreamingCache cache;
    private StreamingPersistenceService persistence;
    private SubtaskUpdateService subtaskUpdateService;
    private TaskStreamService streamService;
    private StreamingIngestServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        registry = new StreamingSessionRegistry();
        cache = mock(StreamingCache.class);
        persistence = mock(StreamingPersistenceService.class);
        subtaskUpdateService = mock(SubtaskUpdateService.class);
        streamService = mock(TaskStreamService.class);
        service = new StreamingIngestServiceImpl(new StreamingEventParser(), registry, cache, persistence,
                subtaskUpdateService, streamService, new TaskForgeProperties(), clock);
    }

    @Test
    void testPersistenceFollowsTwoCadences() {
        send("start", Map.of());
        clock.advance(Duration.ofMillis(200));
        send("chunk", Map.of("content", "A"));
        verify(cache, times(1)).write(any());
        verify(persistence, times(1)).saveInFlight(eq(SUBTASK_ID), any(), any());

        clock.advance(Duration.ofMillis(900));
        send("chunk", Map.of("content", "B"));
        verify(cache, times(2)).write(any());
        verify(persistence, times(1)).saveInFlight(eq(SUBTASK_ID), any(), any());

        clock.advance(Duration.ofMillis(2000));
        send("chunk", Map.of("content", "C"));
        verify(cache, times(3)).write(any());
        verify(persistence, times(2)).saveInFlight(eq(SUBTASK_ID), any(), any());
    }

    @Test
    void testEveryChunkIsPublished() {
        send("chunk", Map.of("content", "AB"));
        StreamingAck ack = send("chunk", Map.of("content", "CDE"));

        assertTrue(ack.success());
        assertEquals(Long.valueOf(5L), ack.offset());
        verify(streamService).emitChunk(TASK_ID, SUBTASK_ID, "AB", 2L, null);
        verify(streamService).emitChunk(TASK_ID, SUBTASK_ID, "CDE", 5L, null);
        verify(cache).initialize(eq(TASK_ID), eq(SUBTASK_ID), anyLong());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCompletedStatusFinalizesAndClosesSession() {
        send("start", Map.of());
        send("chunk", Map.of("content", "A"));
        send("chunk", Map.of("content", "B"));
        StreamingAck ack = send("status", Map.of("status", "completed", "result", Map.of("value", "AB")));

        assertTrue(ack.success());
        ArgumentCaptor<SubtaskUpdate> captor = ArgumentCaptor.forClass(SubtaskUpdate.class);
        verify(subtaskUpdateService).update(captor.capture());
        SubtaskUpdate update = captor.getValue();
        assertEquals(SubtaskStatus.COMPLETED, update.status());
        assertEquals("AB", update.result().get("value"));
        assertEquals(false, update.result().get("streaming"));

        ArgumentCaptor<Map<String, Object>> done = ArgumentCaptor.forClass(Map.class);
        verify(streamService).emitDone(eq(TASK_ID), eq(SUBTASK_ID), eq(2L), done.capture());
        assertEquals("AB", done.getValue().get("value"));
        verify(cache).purge(SUBTASK_ID);
        assertEquals(0, registry.size());
    }

    @Test
    void testErrorEventKeepsPartialOutput() {
        send("chunk", Map.of("content", "par"));
        send("error", Map.of("error", "boom"));

        ArgumentCaptor<SubtaskUpdate> captor = ArgumentCaptor.forClass(SubtaskUpdate.class);
        verify(subtaskUpdateService).update(captor.capture());
        assertEquals(SubtaskStatus.FAILED, captor.getValue().status());
        assertEquals("boom", captor.getValue().errorMessage());
        assertEquals("par", captor.getValue().result().get("value"));
        verify(streamService).emitError(eq(TASK_ID), eq(SUBTASK_ID), eq("boom"), any());
    }

    @Test
    void testFailedDurableFlushIsRetriedOnNextEvent() {
        when(persistence.saveInFlight(eq(SUBTASK_ID), any(), any()))
                .thenThrow(new IllegalStateException("db down"))
                .thenReturn(true);

        assertTrue(send("chunk", Map.of("content", "A")).success());
        clock.advance(Duration.ofMillis(100));
        assertTrue(send("chunk", Map.of("content", "B")).success());

        verify(persistence, times(2)).saveInFlight(eq(SUBTASK_ID), any(), any());
        assertTrue(registry.find(SUBTASK_ID).isPresent());
    }

    @Test
    void testFinalWriteFailureKeepsSession() {
        when(subtaskUpdateService.update(any())).thenThrow(new IllegalStateException("db down"));
        send("chunk", Map.of("content", "A"));

        StreamingAck ack = send("done", Map.of());

        assertFalse(ack.success());
        assertTrue(registry.find(SUBTASK_ID).isPresent());
        verify(cache, never()).purge(any());
        verify(streamService, never()).emitDone(any(), any(), anyLong(), any());
        verify(streamService, never()).emitError(any(), any(), any(), any());
    }

    @Test
    void testRepeatedCompletedKeepsStoredOutput() {
        Subtask stored = storedSubtask(SubtaskStatus.RUNNING, null);
        when(persistence.find(SUBTASK_ID)).thenReturn(Optional.of(stored));
        when(subtaskUpdateService.update(any())).thenAnswer(invocation -> {
            SubtaskUpdate update = invocation.getArgument(0);
            stored.setStatus(update.status());
            stored.setResult(update.result());
            return null;
        });

        send("start", Map.of());
        send("chunk", Map.of("content", "A"));
        send("chunk", Map.of("content", "B"));
        assertTrue(send("status", Map.of("status", "completed")).success());
        StreamingAck repeated = send("status", Map.of("status", "completed"));

        assertTrue(repeated.success());
        assertEquals(Long.valueOf(2L), repeated.offset());
        assertEquals("AB", stored.getResult().get("value"));
        verify(subtaskUpdateService, times(1)).update(any());
        verify(streamService, times(1)).emitDone(any(), any(), anyLong(), any());
        assertEquals(0, registry.size());
    }

    @Test
    void testCompletedAfterReclaimFinishesFromStoredOutput() {
        when(persistence.find(SUBTASK_ID)).thenReturn(Optional.of(
                storedSubtask(SubtaskStatus.RUNNING, Map.of("value", "AB", "streaming", true))));

        StreamingAck ack = send("status", Map.of("status", "completed"));

        assertTrue(ack.success());
        assertEquals(Long.valueOf(2L), ack.offset());
        ArgumentCaptor<SubtaskUpdate> captor = ArgumentCaptor.forClass(SubtaskUpdate.class);
        verify(subtaskUpdateService).update(captor.capture());
        assertEquals("AB", captor.getValue().result().get("value"));
        assertEquals(false, captor.getValue().result().get("streaming"));
    }

    @Test
    void testChunkAfterReclaimContinuesStoredOffset() {
        when(persistence.find(SUBTASK_ID)).thenReturn(Optional.of(
                storedSubtask(SubtaskStatus.RUNNING, Map.of("value", "AB"))));

        StreamingAck ack = send("chunk", Map.of("content", "C"));

        assertEquals(Long.valueOf(3L), ack.offset());
        verify(streamService).emitChunk(TASK_ID, SUBTASK_ID, "C", 3L, null);
    }

    @Test
    void testLateChunkForFinishedSubtaskIsRejected() {
        when(persistence.find(SUBTASK_ID)).thenReturn(Optional.of(
                storedSubtask(SubtaskStatus.COMPLETED, Map.of("value", "AB"))));

        StreamingAck ack = send("chunk", Map.of("content", "C"));

        assertFalse(ack.success());
        assertEquals(0, registry.size());
        verify(streamService, never()).emitChunk(any(), any(), any(), anyLong(), any());
        verify(cache, never()).initialize(any(), any(), anyLong());
    }

    @Test
    void testTerminalEventForUnknownSubtaskIsRejected() {
        StreamingAck ack = send("done", Map.of());

        assertFalse(ack.success());
        verifyNoInteractions(subtaskUpdateService);
        assertEquals(0, registry.size());
    }

    @Test
    void testMalformedEventIsRejectedWithoutSession() {
        StreamingAck ack = send("thinking", Map.of("step_index", 0));

        assertFalse(ack.success());
        assertEquals(0, registry.size());
        verifyNoInteractions(cache, persistence, streamService);
    }

    @Test
    void testToolEventsAreOnlyFannedOut() {
        send("tool_start", Map.of("tool_id", "t1", "tool_name", "grep"));
        send("tool_done", Map.of("tool_id", "t1", "tool_output", "ok"));

        verify(streamService).emitToolStart(TASK_ID, SUBTASK_ID, "t1", "grep", null);
        verify(streamService).emitToolDone(eq(TASK_ID), eq(SUBTASK_ID), eq("t1"), eq("ok"), isNull());
        assertEquals(0, registry.size());
        verifyNoInteractions(cache, persistence);
    }

    @Test
    void testAbandonedSessionIsReclaimed() {
        send("chunk", Map.of("content", "A"));
        clock.advance(Duration.ofMinutes(61));

        assertEquals(1, service.reclaimStaleSessions());
        assertEquals(0, registry.size());
    }

    @Test
    void testSnapshotFallsBackToStoredResult() {
        when(cache.read(SUBTASK_ID)).thenReturn(Optional.empty());
        when(persistence.find(SUBTASK_ID)).thenReturn(Optional.of(Subtask.builder()
                .id(SUBTASK_ID)
                .taskId(TASK_ID)
                .userId(1L)
                .role(SubtaskRole.ASSISTANT)
                .status(SubtaskStatus.COMPLETED)
                .result(Map.of("value", "done text"))
                .build()));

        StreamSnapshot snapshot = service.snapshot(SUBTASK_ID);

        assertEquals("durable", snapshot.source());
        assertEquals("done text", snapshot.content());
        assertEquals(9L, snapshot.offset());
    }

    @Test
    void testSnapshotPrefersCache() {
        when(cache.read(SUBTASK_ID)).thenReturn(Optional.of(new CachedStream(TASK_ID, SUBTASK_ID, "streaming",
                "cached", 6L, "", 0L, List.of(), Map.of(), 0L, 0L)));

        assertEquals("cache", service.snapshot(SUBTASK_ID).source());
        verify(persistence, never()).find(any());
    }

    @Test
    void testCancelRaisesFlagAndNotifies() {
        when(persistence.find(SUBTASK_ID)).thenReturn(Optional.of(Subtask.builder()
                .id(SUBTASK_ID).taskId(TASK_ID).userId(1L).role(SubtaskRole.ASSISTANT).build()));
        when(cache.requestCancel(SUBTASK_ID)).thenReturn(true);

        CancelState state = service.requestCancel(SUBTASK_ID);

        assertTrue(state.cancelRequested());
        verify(streamService).emitCancel(TASK_ID, SUBTASK_ID);
    }

    private Subtask storedSubtask(SubtaskStatus status, Map<String, Object> result) {
        return Subtask.builder()
                .id(SUBTASK_ID)
                .taskId(TASK_ID)
                .userId(1L)
                .role(SubtaskRole.ASSISTANT)
                .status(status)
                .result(result)
                .build();
    }

    private StreamingAck send(String type, Map<String, Object> payload) {
        return service.process(TASK_ID, SUBTASK_ID, type, payload);
    }
}
