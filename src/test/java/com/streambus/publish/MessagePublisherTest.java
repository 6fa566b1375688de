package com.streambus.publish;

import com.streambus.codec.CodecFixtures;
import com.streambus.codec.MessageCodec;
import com.streambus.domain.MessagePayload;
import com.streambus.metrics.BusMetrics;
import com.streambus.store.InMemoryLogStore;
import com.streambus.store.LogStore;
import com.streambus.store.LogStoreException;
import com.streambus.store.LogStoreFacade;
import com.streambus.store.StreamEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.lang.reflect.Field;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MessagePublisherTest {

    private LogStoreFacade logStore;
    private MessageCodec codec;
    private BusMetrics metrics;
    private MessagePublisher publisher;

    @BeforeEach
    void setup() throws Exception {
        logStore = Mockito.mock(LogStoreFacade.class);
        codec = CodecFixtures.newCodec();
        metrics = new BusMetrics();

        publisher = new MessagePublisher();
        setField(publisher, "logStore", logStore);
        setField(publisher, "codec", codec);
        setField(publisher, "metrics", metrics);
    }

    @Test
    @SuppressWarnings("unchecked")
    void publishAppendsEncodedEnvelopeAndCountsIt() {
        when(logStore.append(eq("orders"), anyMap())).thenReturn("1-0");
        MessagePayload message = MessagePayload.of("m1", "order", "svc-a", Map.of("amount", 42));

        String entryId = publisher.publish("orders", message);

        assertThat(entryId).isEqualTo("1-0");
        assertThat(metrics.snapshot().getMessagesSent()).isEqualTo(1);
        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(logStore).append(eq("orders"), captor.capture());
        assertThat(captor.getValue()).containsOnlyKeys(MessageCodec.PAYLOAD_FIELD);
        MessagePayload stored = codec.decode(captor.getValue().get(MessageCodec.PAYLOAD_FIELD));
        assertThat(stored.getId()).isEqualTo("m1");
        assertThat(stored.getData()).isEqualTo(Map.of("amount", 42));
        verify(logStore, never()).expire(anyString(), anyLong());
    }

    @Test
    void ttlSetsExpirationOnTheStream() {
        when(logStore.append(eq("orders"), anyMap())).thenReturn("1-0");

        publisher.publish("orders", MessagePayload.of("m1", "order", "svc-a", null).withTtl(30));

        verify(logStore).expire("orders", 30);
    }

    @Test
    void storeFailureSurfacesAsPublishException() {
        when(logStore.append(eq("orders"), anyMap())).thenThrow(new LogStoreException("redis down"));

        PublishException e = assertThrows(PublishException.class,
                () -> publisher.publish("orders", MessagePayload.of("m1", "order", "svc-a", null)));

        assertThat(e.getStream()).isEqualTo("orders");
        assertThat(e.getCause()).isInstanceOf(LogStoreException.class);
        assertThat(metrics.snapshot().getMessagesSent()).isZero();
    }

    @Test
    void expireFailureSurfacesAsPublishException() {
        when(logStore.append(eq("orders"), anyMap())).thenReturn("1-0");
        when(logStore.expire("orders", 30)).thenThrow(new LogStoreException("redis down"));

        assertThrows(PublishException.class,
                () -> publisher.publish("orders", MessagePayload.of("m1", "order", "svc-a", null).withTtl(30)));
    }

    @Test
    void rejectsMissingStreamOrMessage() {
        assertThrows(IllegalArgumentException.class,
                () -> publisher.publish(" ", MessagePayload.of("m1", "order", "svc-a", null)));
        assertThrows(IllegalArgumentException.class, () -> publisher.publish("orders", null));
    }

    @Test
    void publishedEntryIsReadableFromInMemoryStore() throws Exception {
        InMemoryLogStore inMemory = new InMemoryLogStore();
        LogStoreFacade facade = new LogStoreFacade();
        setField(facade, "mode", "in-memory");
        setField(facade, "inMemoryStore", inMemory);
        setField(publisher, "logStore", facade);
        facade.createGroup("orders", "g1", "0");

        String entryId = publisher.publish("orders", MessagePayload.of("m1", "order", "svc-a", Map.of("k", "v")));

        StreamEntry entry = facade.readGroup("orders", "g1", "c1", 10, 0, LogStore.NEW_ENTRIES).get(0);
        assertThat(entry.getId()).isEqualTo(entryId);
        assertThat(codec.decode(entry.getField(MessageCodec.PAYLOAD_FIELD)).getData()).isEqualTo(Map.of("k", "v"));
    }

    private static void setField(Object target, String name, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(name);
        field.setAccessible(true);
        field.set(target, value);
    }
}
