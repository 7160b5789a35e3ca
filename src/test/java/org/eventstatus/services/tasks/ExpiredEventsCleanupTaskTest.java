package org.eventstatus.services.tasks;

import org.eventstatus.client.EventBackendClient;
import org.eventstatus.client.dto.Event;
import org.eventstatus.client.dto.EventStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpiredEventsCleanupTaskTest {

    @Mock
    private EventBackendClient client;

    private ExpiredEventsCleanupTask task;

    @BeforeEach
    void setUp() {
        task = new ExpiredEventsCleanupTask(client, 300);
    }

    private static Event expired(Long id) {
        return new Event(id, EventStatus.SCHEDULED, "2024-12-01T00:00:00", null, Map.of());
    }

    @Test
    void nameAndInterval() {
        assertEquals("cleanup_expired_events", task.name());
        assertEquals(300, task.intervalSeconds());
    }

    @Test
    void noTokenMeansNoFurtherCalls() {
        when(client.ensureToken()).thenReturn(false);

        task.execute();

        verify(client).ensureToken();
        verifyNoMoreInteractions(client);
    }

    @Test
    void deletesEveryExpiredEventEvenWhenOneFails() {
        when(client.ensureToken()).thenReturn(true);
        when(client.fetchExpired()).thenReturn(List.of(expired(1L), expired(2L), expired(3L)));
        when(client.delete(1L)).thenReturn(true);
        when(client.delete(2L)).thenReturn(false);
        when(client.delete(3L)).thenReturn(true);

        task.execute();

        InOrder inOrder = inOrder(client);
        inOrder.verify(client).ensureToken();
        inOrder.verify(client).fetchExpired();
        inOrder.verify(client).delete(1L);
        inOrder.verify(client).delete(2L);
        inOrder.verify(client).delete(3L);
        verifyNoMoreInteractions(client);
    }

    @Test
    void nothingExpiredDeletesNothing() {
        when(client.ensureToken()).thenReturn(true);
        when(client.fetchExpired()).thenReturn(List.of());

        task.execute();

        verify(client, never()).delete(anyLong());
    }

    @Test
    void eventsWithoutIdAreSkipped() {
        when(client.ensureToken()).thenReturn(true);
        when(client.fetchExpired()).thenReturn(List.of(expired(null), expired(4L)));
        when(client.delete(4L)).thenReturn(true);

        task.execute();

        verify(client, times(1)).delete(anyLong());
    }

    @Test
    void unexpectedFailureIsContained() {
        when(client.ensureToken()).thenReturn(true);
        when(client.fetchExpired()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> task.execute());
        verify(client, never()).delete(anyLong());
    }
}
