package io.framerelay.core.assembly;

import io.framerelay.core.chunk.Chunk;
import io.framerelay.core.chunk.ChunkHeaderCodec;
import io.framerelay.core.chunk.FrameChunker;
import io.framerelay.core.model.Frame;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class FrameAssemblerTest {

    private static final int MAX = 10;
    private static final Duration WINDOW = FrameAssembler.DEFAULT_LATE_START_WINDOW;

    private static byte[] payload(final int size, final long seed) {
        final byte[] b = new byte[size];
        new Random(seed).nextBytes(b);
        return b;
    }

    private static List<Chunk> chunks(final byte[] payload, final int max) {
        final List<Chunk> out = new ArrayList<>();
        for (final byte[] d : FrameChunker.split(payload, max)) {
            out.add(ChunkHeaderCodec.decode(d));
        }
        return out;
    }

    private static List<Frame> feed(final FrameAssembler assembler, final List<Chunk> chunks) {
        final List<Frame> frames = new ArrayList<>();
        for (final Chunk c : chunks) {
            assembler.ingest(c).ifPresent(frames::add);
        }
        return frames;
    }

    @Test
    void outOfOrderScenarioYieldsOneFrame() {
        final byte[] original = payload(150_000, 1);
        final List<Chunk> c = chunks(original, 60_000);
        final FrameAssembler assembler = frozen(60_000);

        assertTrue(assembler.ingest(c.get(2)).isEmpty());
        assertTrue(assembler.ingest(c.get(0)).isEmpty());
        final Optional<Frame> frame = assembler.ingest(c.get(1));

        assertTrue(frame.isPresent());
        assertEquals(150_000L, frame.get().totalSize());
        assertArrayEquals(original, frame.get().payload());
        assertFalse(assembler.hasPendingEpoch());
    }

    @Test
    void everyPermutationReassemblesTheSamePayload() {
        final byte[] original = payload(35, 2);
        final List<Chunk> c = chunks(original, MAX);
        assertEquals(4, c.size());

        final Random rnd = new Random(3);
        for (int round = 0; round < 50; round++) {
            final List<Chunk> shuffled = new ArrayList<>(c);
            Collections.shuffle(shuffled, rnd);

            final List<Frame> frames = feed(frozen(MAX), shuffled);

            assertEquals(1, frames.size(), "order " + shuffled);
            assertArrayEquals(original, frames.get(0).payload());
        }
    }

    @Test
    void singleChunkFrameCompletesImmediately() {
        final byte[] original = payload(7, 4);

        final List<Frame> frames = feed(new FrameAssembler(MAX), chunks(original, MAX));

        assertEquals(1, frames.size());
        assertArrayEquals(original, frames.get(0).payload());
    }

    @Test
    void lostChunkThenRestartEmitsNothingForTheBrokenEpoch() {
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = assembler(observer, Duration.ZERO, new AtomicLong());
        final List<Chunk> first = chunks(payload(30, 5), MAX);
        final byte[] secondPayload = payload(30, 6);
        final List<Chunk> second = chunks(secondPayload, MAX);

        assertTrue(assembler.ingest(first.get(0)).isEmpty());
        assertTrue(assembler.ingest(first.get(2)).isEmpty());
        /* chunk 1 of the first epoch is lost */

        final List<Frame> frames = feed(assembler, second);

        assertEquals(1, frames.size());
        assertArrayEquals(secondPayload, frames.get(0).payload());
        assertEquals(1, observer.discards.get(DiscardReason.SUPERSEDED));
        assertFalse(assembler.hasPendingEpoch());
    }

    @Test
    void restartNeverMixesSupersededPayload() {
        final byte[] old = payload(30, 7);
        final byte[] fresh = payload(30, 8);
        final List<Chunk> oldChunks = chunks(old, MAX);
        final List<Chunk> freshChunks = chunks(fresh, MAX);
        final FrameAssembler assembler = frozen(MAX);

        assembler.ingest(oldChunks.get(0));
        assembler.ingest(oldChunks.get(1));

        assertTrue(assembler.ingest(freshChunks.get(0)).isEmpty());
        assertEquals(1, assembler.pendingChunkCount(), "restart must drop the superseded chunks");
        assertTrue(assembler.ingest(freshChunks.get(2)).isEmpty());
        final Optional<Frame> frame = assembler.ingest(freshChunks.get(1));

        assertTrue(frame.isPresent());
        assertArrayEquals(fresh, frame.get().payload());
    }

    @Test
    void restartWithDifferentSizeReplacesEpoch() {
        final FrameAssembler assembler = frozen(MAX);
        final byte[] fresh = payload(12, 10);

        assembler.ingest(chunks(payload(30, 9), MAX).get(1));
        final List<Frame> frames = feed(assembler, chunks(fresh, MAX));

        assertEquals(1, frames.size());
        assertArrayEquals(fresh, frames.get(0).payload());
    }

    @Test
    void duplicateChunksDoNotCorruptOrDuplicateTheFrame() {
        final byte[] original = payload(30, 11);
        final List<Chunk> c = chunks(original, MAX);
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = assembler(observer, Duration.ZERO, new AtomicLong());

        final List<Frame> frames = feed(assembler, List.of(c.get(2), c.get(1), c.get(2), c.get(1), c.get(0)));

        assertEquals(1, frames.size());
        assertArrayEquals(original, frames.get(0).payload());
        assertEquals(2, observer.outcomes.get(AssemblyOutcome.DUPLICATE));
        assertEquals(1, observer.lateStarts);
    }

    @Test
    void redeliveredStartRestartsEpochInsteadOfMerging() {
        final byte[] original = payload(30, 20);
        final List<Chunk> c = chunks(original, MAX);
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = assembler(observer, Duration.ZERO, new AtomicLong());

        final List<Frame> frames = feed(assembler, List.of(c.get(0), c.get(1), c.get(0), c.get(2)));

        assertTrue(frames.isEmpty());
        assertEquals(1, observer.discards.get(DiscardReason.SUPERSEDED));
        assertEquals(2, assembler.pendingChunkCount());
    }

    @Test
    void nextFrameWithIdenticalFirstChunkIsNotFoldedIntoPreviousEpoch() {
        final byte[] a = payload(30, 21);
        final byte[] b = payload(30, 22);
        System.arraycopy(a, 0, b, 0, MAX);
        final List<Chunk> ca = chunks(a, MAX);
        final List<Chunk> cb = chunks(b, MAX);
        final FrameAssembler assembler = frozen(MAX);

        /* chunk 2 of frame a is lost */
        final List<Frame> frames = feed(assembler, List.of(ca.get(0), ca.get(1), cb.get(0), cb.get(1), cb.get(2)));

        assertEquals(1, frames.size());
        assertArrayEquals(b, frames.get(0).payload());
    }

    @Test
    void lostStartIsNotCompletedByNextFrameOutsideLateStartWindow() {
        final AtomicLong now = new AtomicLong();
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = assembler(observer, Duration.ZERO, now);
        final List<Chunk> a = chunks(payload(30, 23), MAX);
        final byte[] b = payload(30, 24);
        final List<Chunk> cb = chunks(b, MAX);

        /* chunk 0 of frame a is lost; frame b follows one video frame interval later */
        feed(assembler, List.of(a.get(1), a.get(2)));
        now.addAndGet(Duration.ofMillis(33).toNanos());
        final List<Frame> frames = feed(assembler, cb);

        assertEquals(1, frames.size());
        assertArrayEquals(b, frames.get(0).payload());
        assertEquals(1, observer.discards.get(DiscardReason.SUPERSEDED));
        assertEquals(0, observer.lateStarts);
    }

    @Test
    void lateStartInsideWindowCompletesFrameAndIsReported() {
        final AtomicLong now = new AtomicLong();
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = assembler(observer, Duration.ZERO, now);
        final byte[] original = payload(30, 25);
        final List<Chunk> c = chunks(original, MAX);

        feed(assembler, List.of(c.get(1), c.get(2)));
        now.addAndGet(Duration.ofMillis(5).toNanos());
        final Optional<Frame> frame = assembler.ingest(c.get(0));

        assertTrue(frame.isPresent());
        assertArrayEquals(original, frame.get().payload());
        assertEquals(1, observer.lateStarts);
    }

    @Test
    void zeroLateStartWindowAlwaysRestartsOnChunkZero() {
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = new FrameAssembler(MAX, FrameAssembler.ARRAY_LIMIT, 0L,
                Duration.ZERO, Duration.ZERO, observer, () -> 0L);
        final List<Chunk> c = chunks(payload(30, 26), MAX);

        final List<Frame> frames = feed(assembler, List.of(c.get(1), c.get(2), c.get(0)));

        assertTrue(frames.isEmpty());
        assertEquals(1, observer.discards.get(DiscardReason.SUPERSEDED));
        assertEquals(1, assembler.pendingChunkCount());
    }

    @Test
    void tamperedDuplicateIsIgnoredFirstCopyWins() {
        final byte[] original = payload(30, 12);
        final List<Chunk> c = chunks(original, MAX);
        final Chunk forged = new Chunk(30L, 1L, new byte[MAX]);
        final FrameAssembler assembler = frozen(MAX);

        final List<Frame> frames = feed(assembler, List.of(c.get(1), c.get(2), forged, c.get(0)));

        assertEquals(1, frames.size());
        assertArrayEquals(original, frames.get(0).payload());
    }

    @Test
    void mismatchedSizeWithoutRestartIsDroppedAndEpochKept() {
        final byte[] original = payload(30, 13);
        final List<Chunk> c = chunks(original, MAX);
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = assembler(observer, Duration.ZERO, new AtomicLong());

        assembler.ingest(c.get(0));
        assertTrue(assembler.ingest(chunks(payload(25, 14), MAX).get(1)).isEmpty());

        assertEquals(1, observer.outcomes.get(AssemblyOutcome.EPOCH_MISMATCH));
        assertEquals(30L, assembler.pendingTotalSize());
        assertEquals(1, assembler.pendingChunkCount());

        final List<Frame> frames = feed(assembler, c.subList(1, 3));
        assertEquals(1, frames.size());
        assertArrayEquals(original, frames.get(0).payload());
    }

    @Test
    void structurallyInvalidChunksAreRejected() {
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = new FrameAssembler(MAX, 100L, 0L, Duration.ZERO, WINDOW, observer, System::nanoTime);

        assembler.ingest(new Chunk(0L, 0L, new byte[0]));
        assembler.ingest(new Chunk(101L, 0L, new byte[MAX]));
        assembler.ingest(new Chunk(30L, 3L, new byte[MAX]));
        assembler.ingest(new Chunk(30L, 0L, new byte[MAX - 1]));
        assembler.ingest(new Chunk(25L, 2L, new byte[MAX]));

        assertEquals(1, observer.outcomes.get(AssemblyOutcome.EMPTY_FRAME));
        assertEquals(1, observer.outcomes.get(AssemblyOutcome.OVERSIZED));
        assertEquals(1, observer.outcomes.get(AssemblyOutcome.INDEX_OUT_OF_RANGE));
        assertEquals(2, observer.outcomes.get(AssemblyOutcome.BAD_LENGTH));
        assertFalse(assembler.hasPendingEpoch(), "rejected chunks must not open an epoch");
    }

    @Test
    void fixedFrameSizeRejectsOtherSizes() {
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = new FrameAssembler(MAX, 1_000L, 30L, Duration.ZERO, WINDOW, observer, System::nanoTime);

        assertTrue(feed(assembler, chunks(payload(20, 15), MAX)).isEmpty());
        assertEquals(2, observer.outcomes.get(AssemblyOutcome.UNEXPECTED_SIZE));

        assertEquals(1, feed(assembler, chunks(payload(30, 16), MAX)).size());
    }

    @Test
    void staleEpochExpiresWhenTimeoutConfigured() {
        final AtomicLong now = new AtomicLong();
        final RecordingObserver observer = new RecordingObserver();
        final FrameAssembler assembler = assembler(observer, Duration.ofMillis(100), now);
        final List<Chunk> stale = chunks(payload(30, 17), MAX);

        assembler.ingest(stale.get(1));
        now.addAndGet(Duration.ofMillis(50).toNanos());
        assertFalse(assembler.expire(now.get()));

        now.addAndGet(Duration.ofMillis(60).toNanos());
        assertTrue(assembler.expire(now.get()));
        assertFalse(assembler.hasPendingEpoch());
        assertEquals(1, observer.discards.get(DiscardReason.EXPIRED));
    }

    @Test
    void expiredEpochIsNotCompletedByLateChunks() {
        final AtomicLong now = new AtomicLong();
        final FrameAssembler assembler = assembler(new RecordingObserver(), Duration.ofMillis(100), now);
        final List<Chunk> c = chunks(payload(30, 18), MAX);

        assembler.ingest(c.get(0));
        assembler.ingest(c.get(1));
        now.addAndGet(Duration.ofSeconds(1).toNanos());

        assertTrue(assembler.ingest(c.get(2)).isEmpty());
        assertEquals(1, assembler.pendingChunkCount());
    }

    @Test
    void withoutTimeoutStalledEpochIsKept() {
        final AtomicLong now = new AtomicLong();
        final FrameAssembler assembler = assembler(new RecordingObserver(), Duration.ZERO, now);

        assembler.ingest(chunks(payload(30, 19), MAX).get(0));
        now.addAndGet(Duration.ofHours(1).toNanos());

        assertFalse(assembler.expire(now.get()));
        assertTrue(assembler.hasPendingEpoch());
    }

    @Test
    void consecutiveEpochsEachProduceOneFrame() {
        final FrameAssembler assembler = frozen(MAX);
        final List<Chunk> all = new ArrayList<>();
        final List<byte[]> originals = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            final byte[] p = payload(30, 100 + i);
            originals.add(p);
            all.addAll(chunks(p, MAX));
        }

        final List<Frame> frames = feed(assembler, all);

        assertEquals(5, frames.size());
        for (int i = 0; i < 5; i++) {
            assertArrayEquals(originals.get(i), frames.get(i).payload());
        }
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new FrameAssembler(0));
        assertThrows(IllegalArgumentException.class,
                () -> new FrameAssembler(MAX, 10L, 11L, Duration.ZERO, WINDOW, AssemblyObserver.NOOP, System::nanoTime));
        assertThrows(IllegalArgumentException.class,
                () -> new FrameAssembler(MAX, 10L, 0L, Duration.ofMillis(-1), WINDOW, AssemblyObserver.NOOP, System::nanoTime));
        assertThrows(IllegalArgumentException.class,
                () -> new FrameAssembler(MAX, 10L, 0L, Duration.ZERO, Duration.ofMillis(-1), AssemblyObserver.NOOP, System::nanoTime));
    }

    private static FrameAssembler assembler(final AssemblyObserver observer, final Duration timeout, final AtomicLong clock) {
        return new FrameAssembler(MAX, FrameAssembler.ARRAY_LIMIT, 0L, timeout, WINDOW, observer, clock::get);
    }

    /** Clock never advances, so every late start falls inside the window. */
    private static FrameAssembler frozen(final int max) {
        return new FrameAssembler(max, FrameAssembler.ARRAY_LIMIT, 0L, Duration.ZERO, WINDOW, AssemblyObserver.NOOP, () -> 0L);
    }

    private static final class RecordingObserver implements AssemblyObserver {
        final Map<AssemblyOutcome, Integer> outcomes = new EnumMap<>(AssemblyOutcome.class);
        final Map<DiscardReason, Integer> discards = new EnumMap<>(DiscardReason.class);
        int lateStarts;

        @Override
        public void onChunk(final AssemblyOutcome outcome) {
            outcomes.merge(outcome, 1, Integer::sum);
        }

        @Override
        public void onDiscarded(final DiscardReason reason, final int received, final int expected) {
            discards.merge(reason, 1, Integer::sum);
        }

        @Override
        public void onLateStart(final int received, final int expected) {
            lateStarts++;
        }
    }
}
