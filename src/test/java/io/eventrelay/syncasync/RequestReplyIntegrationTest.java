package io.eventrelay.syncasync;

import io.eventrelay.config.impl.RelayConfig;
import io.eventrelay.core.model.Data;
import io.eventrelay.core.model.EventType;
import io.eventrelay.core.model.Message;
import io.eventrelay.core.model.MessageHeader;
import io.eventrelay.core.model.MessageInOut;
import io.eventrelay.error.RequestTimeoutException;
import io.eventrelay.events.dispatcher.EventDispatcher;
import io.eventrelay.events.system.SystemEventManager;
import io.eventrelay.offset.InMemoryOffsetStore;
import io.eventrelay.store.impl.InMemoryEventStore;
import io.eventrelay.subscription.FirstEvent;
import io.eventrelay.subscription.Subscription;
import io.eventrelay.subscription.SubscriptionDefinition;
import io.eventrelay.subscription.SubscriptionFilter;
import io.eventrelay.subscription.SubscriptionOptions;
import io.eventrelay.syncasync.impl.CorrelatingSyncAsyncBridge;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Request/reply over the in-process event path: messages are confirmed into the event log,
 * an {@link EventDispatcher} delivers the confirmations to the {@link SystemEventManager},
 * and the bridge resolves the caller from there.
 */
final class RequestReplyIntegrationTest {

    private static final RelayConfig CONFIG = RelayConfig.load(new ByteArrayInputStream("""
            eventDispatcher:
              pollTimeoutMs: 100
              retry:
                initialDelayMs: 10
                maxDelayMs: 50
            syncAsync:
              requestTimeoutMs: 5000
            """.getBytes(StandardCharsets.UTF_8)));

    private final InMemoryEventStore store = new InMemoryEventStore();
    private final InMemoryOffsetStore offsets = new InMemoryOffsetStore();
    private final SystemEventManager systemEvents = new SystemEventManager();
    private final List<MessageInOut> sent = new CopyOnWriteArrayList<>();

    private EventDispatcher dispatcher;
    private CorrelatingSyncAsyncBridge bridge;

    @BeforeEach
    void setUp() {
        final Subscription sub = Subscription.compile(new SubscriptionDefinition(UUID.randomUUID(), "ns1",
                "system_ns1", SubscriptionFilter.matchAll(), new SubscriptionOptions(null, FirstEvent.OLDEST), false));
        dispatcher = new EventDispatcher(store, offsets, CONFIG, "system", sub, systemEvents);
        store.onNewEvent(dispatcher::newEvents);
        dispatcher.start();

        bridge = new CorrelatingSyncAsyncBridge(store, this::loadData, systemEvents, this::confirmAndRespond, CONFIG);
    }

    @AfterEach
    void tearDown() throws Exception {
        bridge.close();
        dispatcher.close();
        systemEvents.close();
    }

    @Test
    void replyFlowsBackThroughDispatcher() {
        final MessageInOut reply = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> bridge.requestReply("ns1", request("ping")));

        final MessageInOut request = sent.get(0);
        assertEquals(request.message().id(), reply.header().cid());
        assertEquals("pong", reply.header().tag());
        assertEquals(1, reply.inlineData().size());
        assertEquals("{\"pong\":true}", reply.inlineData().get(0).value());
    }

    @Test
    void consecutiveRequestsAreCorrelatedIndividually() {
        final MessageInOut first = bridge.requestReply("ns1", request("ping"));
        final MessageInOut second = bridge.requestReply("ns1", request("ping"));

        assertEquals(sent.get(0).message().id(), first.header().cid());
        assertEquals(sent.get(1).message().id(), second.header().cid());
    }

    @Test
    void rejectedDeliveryIsRedeliveredToBridge() {
        final AtomicBoolean rejectedOnce = new AtomicBoolean(false);
        systemEvents.addSystemEventListener("ns1", event -> {
            if (rejectedOnce.compareAndSet(false, true)) {
                throw new IllegalStateException("listener not ready");
            }
        });

        final MessageInOut reply = bridge.requestReply("ns1", request("ping"));

        assertTrue(rejectedOnce.get());
        assertEquals(sent.get(0).message().id(), reply.header().cid());
    }

    @Test
    void confirmationWithoutReferenceDoesNotBlockReplies() {
        store.appendEvent(EventType.MESSAGE_CONFIRMED, "ns1", null);

        final MessageInOut reply = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> bridge.requestReply("ns1", request("ping"), Duration.ofSeconds(3)));

        assertEquals(sent.get(0).message().id(), reply.header().cid());
    }

    @Test
    void unansweredRequestTimesOut() {
        assertThrows(RequestTimeoutException.class,
                () -> bridge.requestReply("ns1", request("silent"), Duration.ofMillis(300)));
    }

    private static MessageInOut request(final String tag) {
        return new MessageInOut(new Message(MessageHeader.of("ns1", tag), List.of()), List.of());
    }

    /* Confirms every message it is given; "ping" requests are answered with a "pong" reply. */
    private Message confirmAndRespond(final String namespace, final MessageInOut message) {
        sent.add(message);
        final Message request = message.message();
        store.putMessage(request);
        store.appendEvent(EventType.MESSAGE_CONFIRMED, namespace, request.id());

        if ("ping".equals(request.header().tag())) {
            final Data row = new Data(UUID.randomUUID(), namespace, "h-" + request.id(), "{\"pong\":true}");
            store.putData(row);
            final Message reply = new Message(MessageHeader.of(namespace, "pong")
                    .withId(UUID.randomUUID())
                    .withCid(request.id()), List.of(row.toRef()));
            store.putMessage(reply);
            store.appendEvent(EventType.MESSAGE_CONFIRMED, namespace, reply.id());
        }
        return request;
    }

    private MessageData loadData(final Message message, final boolean allowPartial) {
        final List<Data> rows = message.data().stream()
                .map(ref -> store.getData(ref.id()))
                .filter(Objects::nonNull)
                .toList();
        return new MessageData(rows, rows.size() == message.data().size());
    }
}
