package io.framerelay.registry;

import io.framerelay.core.model.FeedMessage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class SubscriberRegistryTest {

    private record StubSubscriber(String id) implements Subscriber {
        @Override
        public CompletableFuture<Void> send(final FeedMessage message) {
            return CompletableFuture.completedFuture(null);
        }
    }

    @Test
    void rejectsDuplicateIds() {
        final SubscriberRegistry registry = new SubscriberRegistry();

        assertTrue(registry.add(new StubSubscriber("a")));
        assertFalse(registry.add(new StubSubscriber("a")));
        assertEquals(1, registry.size());
    }

    @Test
    void removeByInstanceIgnoresReplacement() {
        final SubscriberRegistry registry = new SubscriberRegistry();
        final StubSubscriber first = new StubSubscriber("a");
        registry.add(first);
        registry.remove("a");
        final Subscriber second = new Subscriber() {
            @Override
            public String id() {
                return "a";
            }

            @Override
            public CompletableFuture<Void> send(final FeedMessage message) {
                return CompletableFuture.completedFuture(null);
            }
        };
        registry.add(second);

        assertFalse(registry.remove(first));
        assertTrue(registry.contains("a"));
        assertTrue(registry.remove(second));
        assertFalse(registry.contains("a"));
    }

    @Test
    void snapshotIsAnImmutableCopyInJoinOrder() {
        final SubscriberRegistry registry = new SubscriberRegistry();
        final StubSubscriber a = new StubSubscriber("a");
        final StubSubscriber b = new StubSubscriber("b");
        registry.add(a);
        registry.add(b);

        final List<Subscriber> snapshot = registry.snapshot();
        registry.remove("a");
        registry.add(new StubSubscriber("c"));

        assertEquals(List.of(a, b), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(a));
        assertEquals(2, registry.size());
    }

    @Test
    void concurrentJoinsAndLeavesStayConsistent() throws Exception {
        final SubscriberRegistry registry = new SubscriberRegistry();
        final ExecutorService pool = Executors.newFixedThreadPool(8);
        final CountDownLatch go = new CountDownLatch(1);

        for (int t = 0; t < 8; t++) {
            final int thread = t;
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < 500; i++) {
                    final StubSubscriber s = new StubSubscriber(thread + "-" + i);
                    registry.add(s);
                    registry.snapshot();
                    if (i % 2 == 0) registry.remove(s);
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(8 * 250, registry.size());
        assertEquals(8 * 250, registry.snapshot().stream().map(Subscriber::id).distinct().count());
    }
}
