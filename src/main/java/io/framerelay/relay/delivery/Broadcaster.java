package io.framerelay.relay.delivery;

import io.framerelay.core.model.Feed;
import io.framerelay.core.model.FeedMessage;
import io.framerelay.core.model.Frame;
import io.framerelay.core.queue.BoundedFrameQueue;
import io.framerelay.registry.Subscriber;
import io.framerelay.registry.SubscriberRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Drains completed frames from the queue and fans their feeds out to every live subscriber.
 * <p>
 * One loop thread pops frames; each subscriber gets one delivery unit per frame, sending that frame's
 * feeds in order on the fan-out executor, each send bounded by the send timeout. A subscriber whose
 * previous unit is still in flight skips the frame. A failed or timed-out unit removes the subscriber.
 * Nothing a subscriber does can block the loop or another subscriber.
 */
@Slf4j
public final class Broadcaster implements AutoCloseable {

    private final BoundedFrameQueue queue;
    private final SubscriberRegistry registry;
    private final List<FeedDeriver> derivers;
    private final Executor fanOut;
    private final Duration pollTimeout;
    private final Duration sendTimeout;
    private final DeliveryListener listener;

    /* subscriber id -> completion of its current delivery unit */
    private final ConcurrentMap<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong frameIds = new AtomicLong();

    @Getter private volatile boolean running;
    private volatile Thread loop;

    public Broadcaster(final BoundedFrameQueue queue,
                       final SubscriberRegistry registry,
                       final List<FeedDeriver> derivers,
                       final Executor fanOut,
                       final Duration pollTimeout,
                       final Duration sendTimeout,
                       final DeliveryListener listener) {
        if (derivers.isEmpty()) {
            throw new IllegalArgumentException("At least one feed deriver is required");
        }
        if (pollTimeout.isNegative() || pollTimeout.isZero() || sendTimeout.isNegative() || sendTimeout.isZero()) {
            throw new IllegalArgumentException("Poll and send timeouts must be positive");
        }
        this.queue = queue;
        this.registry = registry;
        this.derivers = List.copyOf(derivers);
        this.fanOut = fanOut;
        this.pollTimeout = pollTimeout;
        this.sendTimeout = sendTimeout;
        this.listener = listener;
    }

    /**
     * Starts the broadcast loop on its own thread.
     */
    public synchronized void start() {
        if (loop != null) {
            throw new IllegalStateException("Broadcaster already started");
        }
        running = true;
        final Thread t = new Thread(this::runLoop, "relay-broadcaster");
        t.setDaemon(true);
        loop = t;
        t.start();
        log.info("Broadcaster started (poll={}ms, sendTimeout={}ms)", pollTimeout.toMillis(), sendTimeout.toMillis());
    }

    /**
     * Stops issuing pops. Deliveries already dispatched complete or time out on their own.
     */
    public void stop() {
        running = false;
        final Thread t = loop;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }

    public boolean awaitTermination(final Duration timeout) throws InterruptedException {
        final Thread t = loop;
        if (t == null) return true;
        t.join(Math.max(1L, timeout.toMillis()));
        return !t.isAlive();
    }

    @Override
    public void close() throws InterruptedException {
        stop();
        if (!awaitTermination(pollTimeout.plusSeconds(1))) {
            log.warn("Broadcaster loop did not exit in time");
        }
    }

    /**
     * @return the id of the last frame that produced at least one feed, 0 before the first
     */
    public long lastFrameId() {
        return frameIds.get();
    }

    /**
     * @return subscribers with a delivery unit still in flight
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private void runLoop() {
        while (running) {
            final Optional<Frame> next;
            try {
                next = queue.pop(pollTimeout);
            } catch (final InterruptedException ie) {
                if (running) {
                    log.warn("Broadcaster interrupted while running; exiting");
                    Thread.currentThread().interrupt();
                }
                break;
            }

            if (next.isEmpty()) continue;

            try {
                broadcast(next.get());
            } catch (final RuntimeException e) {
                log.error("Broadcast of frame failed", e);
            }
        }
        log.info("Broadcaster stopped after frame {}", frameIds.get());
    }

    /**
     * One loop iteration for an already popped frame.
     *
     * @return the frame id assigned, or -1 if no feed was derived
     */
    long broadcast(final Frame frame) {
        final List<Feed> feeds = derive(frame);
        if (feeds.isEmpty()) return -1L;

        final long frameId = frameIds.incrementAndGet();
        final List<FeedMessage> messages = new ArrayList<>(feeds.size());
        for (final Feed feed : feeds) {
            messages.add(FeedMessage.of(feed, frameId));
        }

        final List<Subscriber> targets = registry.snapshot();
        listener.onBroadcast(frameId, messages.size(), targets.size());

        for (final Subscriber subscriber : targets) {
            dispatch(subscriber, messages, frameId);
        }
        return frameId;
    }

    private List<Feed> derive(final Frame frame) {
        final List<Feed> feeds = new ArrayList<>(derivers.size());
        for (final FeedDeriver deriver : derivers) {
            try {
                feeds.addAll(deriver.derive(frame));
            } catch (final RuntimeException e) {
                log.warn("Feed derivation failed for frame of {} bytes; frame skipped", frame.totalSize(), e);
                return List.of();
            }
        }
        return feeds;
    }

    private void dispatch(final Subscriber subscriber, final List<FeedMessage> messages, final long frameId) {
        final CompletableFuture<Void> unit = new CompletableFuture<>();
        if (inFlight.putIfAbsent(subscriber.id(), unit) != null) {
            log.debug("Subscriber {} still busy; frame {} skipped", subscriber.describe(), frameId);
            listener.onSkipped(subscriber, frameId);
            return;
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (final FeedMessage message : messages) {
            chain = chain.thenCompose(v -> sendOne(subscriber, message));
        }

        chain.whenComplete((v, ex) -> {
            /* a failed subscriber leaves the registry before its slot is released */
            if (ex != null) {
                fail(subscriber, frameId, ex);
            }
            inFlight.remove(subscriber.id(), unit);
            unit.complete(null);
            if (ex == null) {
                listener.onDelivered(subscriber, frameId);
            }
        });
    }

    private CompletableFuture<Void> sendOne(final Subscriber subscriber, final FeedMessage message) {
        return CompletableFuture.supplyAsync(() -> subscriber.send(message), fanOut)
                .thenCompose(Function.identity())
                .orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void fail(final Subscriber subscriber, final long frameId, final Throwable ex) {
        final Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                ? ex.getCause()
                : ex;

        if (registry.remove(subscriber)) {
            log.warn("Delivery of frame {} to {} failed ({}); subscriber removed",
                    frameId, subscriber.describe(), cause.toString());
        } else {
            log.debug("Delivery of frame {} to departed subscriber {} failed: {}", frameId, subscriber.describe(), cause.toString());
        }

        try {
            subscriber.close();
        } catch (final RuntimeException e) {
            log.debug("Closing subscriber {} failed", subscriber.describe(), e);
        }
        listener.onFailed(subscriber, frameId, cause);
    }
}
