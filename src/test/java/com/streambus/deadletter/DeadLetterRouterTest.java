package com.streambus.deadletter;

import com.streambus.consumer.ConsumerKey;
import com.streambus.store.InMemoryLogStore;
import com.streambus.store.LogStore;
import com.streambus.store.LogStoreException;
import com.streambus.store.LogStoreFacade;
import com.streambus.store.StreamEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.lang.reflect.Field;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeadLetterRouterTest {

    private final ConsumerKey key = new ConsumerKey("orders", "workers", "w1");

    private LogStoreFacade facade;
    private DeadLetterRouter router;

    @BeforeEach
    void setup() throws Exception {
        facade = new LogStoreFacade();
        setField(facade, "mode", "in-memory");
        setField(facade, "inMemoryStore", new InMemoryLogStore());

        router = new DeadLetterRouter();
        setField(router, "suffix", ":dead-letter");
        setField(router, "logStore", facade);
    }

    @Test
    void routeRecordsFailureAndAcknowledgesOriginal() {
        facade.createGroup("orders", "workers", "0");
        String entryId = facade.append("orders", Map.of("payload", "{\"id\":\"m1\"}"));
        StreamEntry entry = facade.readGroup("orders", "workers", "w1", 10, 0, LogStore.NEW_ENTRIES).get(0);

        boolean acked = router.route(key, entry, new IllegalStateException("handler exploded"));

        assertThat(acked).isTrue();
        assertThat(facade.pendingList("orders", "workers", 10)).isEmpty();
        StreamEntry deadLetter = deadLetters().get(0);
        assertThat(deadLetter.getFields())
                .containsEntry("originalStream", "orders")
                .containsEntry("originalEntryId", entryId)
                .containsEntry("error", "handler exploded")
                .containsEntry("consumerGroup", "workers")
                .containsEntry("consumer", "w1")
                .containsEntry("payload", "{\"id\":\"m1\"}")
                .containsKey("timestamp");
    }

    @Test
    void errorWithoutMessageIsRecordedByClassName() {
        StreamEntry entry = new StreamEntry("1-0", Map.of());

        router.route(key, entry, new NullPointerException());

        StreamEntry deadLetter = deadLetters().get(0);
        assertThat(deadLetter.getField("error")).isEqualTo("java.lang.NullPointerException");
        assertThat(deadLetter.getFields()).doesNotContainKey("payload");
    }

    @Test
    void appendFailureLeavesOriginalUnacknowledged() throws Exception {
        LogStoreFacade failing = Mockito.mock(LogStoreFacade.class);
        when(failing.append(eq("orders:dead-letter"), anyMap())).thenThrow(new LogStoreException("OOM"));
        setField(router, "logStore", failing);

        boolean acked = router.route(key, new StreamEntry("1-0", Map.of()), new RuntimeException("boom"));

        assertThat(acked).isFalse();
        verify(failing, never()).ack(anyString(), anyString(), anyString());
    }

    @Test
    void ackFailureAfterDeadLetterReportsUnacknowledged() throws Exception {
        LogStoreFacade failing = Mockito.mock(LogStoreFacade.class);
        when(failing.append(eq("orders:dead-letter"), anyMap())).thenReturn("2-0");
        when(failing.ack("orders", "workers", "1-0")).thenThrow(new LogStoreException("timeout"));
        setField(router, "logStore", failing);

        assertThat(router.route(key, new StreamEntry("1-0", Map.of()), new RuntimeException("boom"))).isFalse();
    }

    @Test
    void deadLetterStreamUsesConfiguredSuffix() {
        assertThat(router.deadLetterStream("orders")).isEqualTo("orders:dead-letter");
    }

    private List<StreamEntry> deadLetters() {
        facade.createGroup("orders:dead-letter", "inspect", "0");
        return facade.readGroup("orders:dead-letter", "inspect", "i1", 10, 0, LogStore.NEW_ENTRIES);
    }

    private static void setField(Object target, String name, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(name);
        field.setAccessible(true);
        field.set(target, value);
    }
}
