package com.taskforge.stream;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TaskStreamServiceTest {

    @Test
    void testChunkCarriesOffsetAndProjection() {
        TaskStreamHub hub = mock(TaskStreamHub.class);
        TaskStreamService service = new TaskStreamService(hub);

        service.emitChunk(1L, 10L, "B", 1L, Map.of("value", "AB"));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(hub).publish(eq(1L), eq(TaskStreamService.EVENT_CHUNK), captor.capture());
        TaskNotification notification = (TaskNotification) captor.getValue();
        assertEquals(Long.valueOf(10L), notification.subtaskId());
        assertEquals(Long.valueOf(1L), notification.offset());
        assertEquals("B", notification.content());
        assertEquals("AB", notification.result().get("value"));
    }

    @Test
    void testDoneAndErrorArePublishedAsFinalEvents() {
        TaskStreamHub hub = mock(TaskStreamHub.class);
        TaskStreamService service = new TaskStreamService(hub);

        service.emitDone(1L, 10L, 2L, Map.of("value", "AB"));
        service.emitError(1L, 11L, "boom", Map.of("value", "A"));

        verify(hub).publishFinal(eq(1L), eq(TaskStreamService.EVENT_DONE), any());
        verify(hub).publishFinal(eq(1L), eq(TaskStreamService.EVENT_ERROR), any());
        verify(hub, never()).publish(any(), any(), any());
    }

    @Test
    void testToolDoneCarriesToolFields() {
        TaskStreamHub hub = mock(TaskStreamHub.class);
        TaskStreamService service = new TaskStreamService(hub);

        service.emitToolDone(1L, 10L, "t-1", Map.of("ok", true), null);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(hub).publish(eq(1L), eq(TaskStreamService.EVENT_TOOL_DONE), captor.capture());
        TaskNotification notification = (TaskNotification) captor.getValue();
        assertEquals("t-1", notification.toolId());
        assertNull(notification.toolError());
        assertNull(notification.offset());
    }
}
