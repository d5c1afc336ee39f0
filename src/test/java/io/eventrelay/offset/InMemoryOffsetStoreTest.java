package io.eventrelay.offset;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class InMemoryOffsetStoreTest {

    @Test
    void fetchIsEmptyUntilCommitted() {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();

        assertTrue(store.fetch(OffsetType.SUBSCRIPTION, "ns1", "sub1").isEmpty());

        store.commit(OffsetType.SUBSCRIPTION, "ns1", "sub1", 5L);
        assertEquals(OptionalLong.of(5L), store.fetch(OffsetType.SUBSCRIPTION, "ns1", "sub1"));
    }

    @Test
    void commitsAreScopedByNamespaceAndName() {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();

        store.commit(OffsetType.SUBSCRIPTION, "ns1", "sub1", 5L);
        store.commit(OffsetType.SUBSCRIPTION, "ns1", "sub2", 7L);
        store.commit(OffsetType.SUBSCRIPTION, "ns2", "sub1", 9L);
        store.commit(OffsetType.SUBSCRIPTION, "ns1", "sub1", 3L); // later commit wins, even if lower

        assertEquals(OptionalLong.of(3L), store.fetch(OffsetType.SUBSCRIPTION, "ns1", "sub1"));
        assertEquals(OptionalLong.of(7L), store.fetch(OffsetType.SUBSCRIPTION, "ns1", "sub2"));
        assertEquals(OptionalLong.of(9L), store.fetch(OffsetType.SUBSCRIPTION, "ns2", "sub1"));
        assertTrue(store.fetch(OffsetType.SUBSCRIPTION, "ns2", "sub2").isEmpty());
    }

    @Test
    void rejectsNullKeys() {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();
        assertThrows(NullPointerException.class, () -> store.commit(OffsetType.SUBSCRIPTION, null, "sub1", 1L));
    }

    @Test
    void concurrentCommitsKeepLastValuePerName() throws Exception {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();
        final int threads = 4;
        final int perThread = 50;

        final ExecutorService exec = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);

        for (int t = 0; t < threads; t++) {
            final String name = "sub" + t;
            exec.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.commit(OffsetType.SUBSCRIPTION, "ns1", name, i);
                    }
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException(e);
                }
                return null;
            });
        }

        start.countDown();
        exec.shutdown();
        assertTrue(exec.awaitTermination(5, TimeUnit.SECONDS), "executor did not finish");

        IntStream.range(0, threads)
                .forEach(t -> assertEquals(OptionalLong.of(49L), store.fetch(OffsetType.SUBSCRIPTION, "ns1", "sub" + t)));
    }
}
