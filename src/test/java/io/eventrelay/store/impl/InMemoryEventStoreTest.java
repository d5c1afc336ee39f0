package io.eventrelay.store.impl;

import io.eventrelay.core.model.Data;
import io.eventrelay.core.model.Event;
import io.eventrelay.core.model.EventType;
import io.eventrelay.core.model.Message;
import io.eventrelay.core.model.MessageHeader;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class InMemoryEventStoreTest {

    @Test
    void assignsSequencesFromZeroAcrossNamespaces() {
        final InMemoryEventStore store = new InMemoryEventStore();
        assertEquals(-1L, store.getLatestSequence(null));

        final Event e0 = store.appendEvent(EventType.MESSAGE_CONFIRMED, "ns1", null);
        final Event e1 = store.appendEvent(EventType.MESSAGE_CONFIRMED, "ns2", null);
        final Event e2 = store.appendEvent(EventType.DATA_ARRIVED_BROADCAST, "ns1", null);

        assertEquals(0L, e0.sequence());
        assertEquals(1L, e1.sequence());
        assertEquals(2L, e2.sequence());
        assertEquals(2L, store.getLatestSequence("ns1"));
        assertEquals(1L, store.getLatestSequence("ns2"));
        assertEquals(-1L, store.getLatestSequence("ns3"));
    }

    @Test
    void pagesAreExclusiveOfOffsetAndNamespaceScoped() {
        final InMemoryEventStore store = new InMemoryEventStore();
        for (int i = 0; i < 6; i++) {
            store.appendEvent(EventType.MESSAGE_CONFIRMED, i % 2 == 0 ? "ns1" : "ns2", null);
        }

        final List<Event> ns1 = store.getEvents("ns1", -1L, 10);
        assertEquals(List.of(0L, 2L, 4L), ns1.stream().map(Event::sequence).toList());

        final List<Event> page = store.getEvents("ns1", 2L, 1);
        assertEquals(1, page.size());
        assertEquals(4L, page.get(0).sequence());

        assertEquals(6, store.getEvents(null, -1L, 10).size());
        assertTrue(store.getEvents(null, 5L, 10).isEmpty());
    }

    @Test
    void lookupsAreNamespaceScoped() {
        final InMemoryEventStore store = new InMemoryEventStore();
        final Message msg = new Message(MessageHeader.of("ns1", "t1").withId(UUID.randomUUID()), List.of());
        final Data row = new Data(UUID.randomUUID(), "ns1", "h1", "{}");
        store.putMessage(msg);
        store.putData(row);

        assertSame(msg, store.getMessageById("ns1", msg.id()));
        assertNull(store.getMessageById("ns2", msg.id()));
        assertNull(store.getMessageById("ns1", UUID.randomUUID()));
        assertNull(store.getMessageById("ns1", null));

        assertEquals(List.of(msg), store.getMessagesByIds("ns1", Set.of(msg.id(), row.id())));
        assertEquals(List.of(row.toRef()), store.getDataRefsByIds("ns1", Set.of(msg.id(), row.id())));
        assertTrue(store.getDataRefsByIds("ns2", Set.of(row.id())).isEmpty());
    }

    @Test
    void notifiesListenersOnAppend() {
        final InMemoryEventStore store = new InMemoryEventStore();
        final AtomicInteger taps = new AtomicInteger();
        store.onNewEvent(taps::incrementAndGet);

        store.appendEvent(EventType.MESSAGE_CONFIRMED, "ns1", null);
        store.appendEvent(EventType.MESSAGE_CONFIRMED, "ns1", null);

        assertEquals(2, taps.get());
    }
}
