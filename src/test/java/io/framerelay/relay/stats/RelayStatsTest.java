package io.framerelay.relay.stats;

import io.framerelay.core.assembly.AssemblyOutcome;
import io.framerelay.core.assembly.DiscardReason;
import io.framerelay.core.model.Frame;
import io.framerelay.core.queue.BoundedFrameQueue;
import io.framerelay.registry.SubscriberRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RelayStatsTest {

    @Test
    void countsOutcomesByKind() {
        final RelayStats stats = new RelayStats();

        stats.recordDatagram();
        stats.recordDatagram();
        stats.recordMalformed();
        stats.onChunk(AssemblyOutcome.STORED);
        stats.onChunk(AssemblyOutcome.COMPLETED);
        stats.onChunk(AssemblyOutcome.OVERSIZED);
        stats.onChunk(AssemblyOutcome.BAD_LENGTH);
        stats.onChunk(AssemblyOutcome.DUPLICATE);
        stats.onDiscarded(DiscardReason.SUPERSEDED, 2, 3);
        stats.onLateStart(2, 3);

        assertEquals(2L, stats.datagrams());
        assertEquals(1L, stats.malformed());
        assertEquals(1L, stats.framesAssembled());
        assertEquals(2L, stats.rejectedChunks());
        assertEquals(1L, stats.discarded(DiscardReason.SUPERSEDED));
        assertEquals(0L, stats.discarded(DiscardReason.EXPIRED));
        assertEquals(1L, stats.lateStarts());
    }

    @Test
    void summaryIncludesQueueAndRegistryState() {
        final RelayStats stats = new RelayStats();
        final BoundedFrameQueue queue = new BoundedFrameQueue(1);
        queue.push(Frame.of(new byte[]{1}));
        queue.push(Frame.of(new byte[]{2}));

        final String summary = stats.summary(queue, new SubscriberRegistry());

        assertTrue(summary.contains("queueDropped=1"), summary);
        assertTrue(summary.contains("subscribers=0"), summary);
    }
}
