package io.framerelay.relay.stats;

import io.framerelay.core.assembly.AssemblyObserver;
import io.framerelay.core.assembly.AssemblyOutcome;
import io.framerelay.core.assembly.DiscardReason;
import io.framerelay.core.queue.BoundedFrameQueue;
import io.framerelay.registry.Subscriber;
import io.framerelay.registry.SubscriberRegistry;
import io.framerelay.relay.delivery.DeliveryListener;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Diagnostic counters for the receive and broadcast paths.
 */
public final class RelayStats implements AssemblyObserver, DeliveryListener {
    private final LongAdder datagrams = new LongAdder();
    private final LongAdder malformed = new LongAdder();
    private final Map<AssemblyOutcome, LongAdder> chunks = new EnumMap<>(AssemblyOutcome.class);
    private final Map<DiscardReason, LongAdder> discarded = new EnumMap<>(DiscardReason.class);
    private final LongAdder lateStarts = new LongAdder();
    private final LongAdder framesBroadcast = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder skippedBusy = new LongAdder();

    public RelayStats() {
        for (final AssemblyOutcome o : AssemblyOutcome.values()) chunks.put(o, new LongAdder());
        for (final DiscardReason r : DiscardReason.values()) discarded.put(r, new LongAdder());
    }

    public void recordDatagram() {
        datagrams.increment();
    }

    public void recordMalformed() {
        malformed.increment();
    }

    @Override
    public void onChunk(final AssemblyOutcome outcome) {
        chunks.get(outcome).increment();
    }

    @Override
    public void onDiscarded(final DiscardReason reason, final int received, final int expected) {
        discarded.get(reason).increment();
    }

    @Override
    public void onLateStart(final int received, final int expected) {
        lateStarts.increment();
    }

    @Override
    public void onBroadcast(final long frameId, final int feeds, final int subscribers) {
        framesBroadcast.increment();
    }

    @Override
    public void onDelivered(final Subscriber subscriber, final long frameId) {
        delivered.increment();
    }

    @Override
    public void onFailed(final Subscriber subscriber, final long frameId, final Throwable cause) {
        failed.increment();
    }

    @Override
    public void onSkipped(final Subscriber subscriber, final long frameId) {
        skippedBusy.increment();
    }

    public long datagrams() {
        return datagrams.sum();
    }

    public long malformed() {
        return malformed.sum();
    }

    public long chunks(final AssemblyOutcome outcome) {
        return chunks.get(outcome).sum();
    }

    public long rejectedChunks() {
        long total = 0;
        for (final Map.Entry<AssemblyOutcome, LongAdder> e : chunks.entrySet()) {
            if (e.getKey().rejected()) total += e.getValue().sum();
        }
        return total;
    }

    public long framesAssembled() {
        return chunks(AssemblyOutcome.COMPLETED);
    }

    public long discarded(final DiscardReason reason) {
        return discarded.get(reason).sum();
    }

    public long lateStarts() {
        return lateStarts.sum();
    }

    public long framesBroadcast() {
        return framesBroadcast.sum();
    }

    public long delivered() {
        return delivered.sum();
    }

    public long failed() {
        return failed.sum();
    }

    public long skippedBusy() {
        return skippedBusy.sum();
    }

    public String summary(final BoundedFrameQueue queue, final SubscriberRegistry registry) {
        return "datagrams=" + datagrams()
                + " malformed=" + malformed()
                + " assembled=" + framesAssembled()
                + " rejected=" + rejectedChunks()
                + " mismatched=" + chunks(AssemblyOutcome.EPOCH_MISMATCH)
                + " lateStarts=" + lateStarts()
                + " superseded=" + discarded(DiscardReason.SUPERSEDED)
                + " expired=" + discarded(DiscardReason.EXPIRED)
                + " queueDropped=" + queue.dropped()
                + " broadcast=" + framesBroadcast()
                + " delivered=" + delivered()
                + " failed=" + failed()
                + " skippedBusy=" + skippedBusy()
                + " subscribers=" + registry.size();
    }
}
