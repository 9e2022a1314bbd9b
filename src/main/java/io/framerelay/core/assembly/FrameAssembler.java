package io.framerelay.core.assembly;

import io.framerelay.core.chunk.Chunk;
import io.framerelay.core.chunk.FrameChunker;
import io.framerelay.core.model.Frame;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Turns chunks of a lossy, reordering datagram stream into complete frames.
 * <p>
 * Holds at most one live epoch. A chunk with index 0 restarts assembly unless it is the late start
 * of the live epoch: same size, no chunk 0 stored yet, and the epoch opened within the late-start
 * window. A non-restart chunk whose total size disagrees with the live epoch is dropped and the
 * live epoch kept.
 * <p>
 * Not thread-safe: owned by the receive path, which feeds it one chunk at a time.
 */
@Slf4j
public final class FrameAssembler {

    /** Largest array the JVM reliably allocates. */
    public static final long ARRAY_LIMIT = Integer.MAX_VALUE - 8L;

    /** Late-start window used when none is configured. */
    public static final Duration DEFAULT_LATE_START_WINDOW = Duration.ofMillis(10);

    @Getter private final int maxChunkPayload;
    @Getter private final long maxFrameSize;
    private final long expectedFrameSize;
    private final long timeoutNanos;
    private final long lateStartNanos;
    private final AssemblyObserver observer;
    private final LongSupplier nanoClock;

    private AssemblyContext context;

    public FrameAssembler(final int maxChunkPayload) {
        this(maxChunkPayload, ARRAY_LIMIT, 0L, Duration.ZERO, DEFAULT_LATE_START_WINDOW, AssemblyObserver.NOOP, System::nanoTime);
    }

    /**
     * @param maxChunkPayload   chunk payload ceiling; must match the sender
     * @param maxFrameSize      largest accepted declared total size
     * @param expectedFrameSize fixed total size every frame must declare, or 0 for any size
     * @param assemblyTimeout   age after which a live epoch is dropped, {@link Duration#ZERO} to keep it until superseded
     * @param lateStartWindow   longest age of an epoch still missing chunk 0 at which a same-size chunk 0 joins it
     *                          instead of restarting; {@link Duration#ZERO} means chunk 0 always restarts
     * @param observer          outcome sink, usually the relay stats
     * @param nanoClock         monotonic clock for the timeout
     */
    public FrameAssembler(final int maxChunkPayload,
                          final long maxFrameSize,
                          final long expectedFrameSize,
                          final Duration assemblyTimeout,
                          final Duration lateStartWindow,
                          final AssemblyObserver observer,
                          final LongSupplier nanoClock) {
        if (maxChunkPayload <= 0) {
            throw new IllegalArgumentException("maxChunkPayload must be positive: " + maxChunkPayload);
        }
        if (maxFrameSize <= 0 || maxFrameSize > ARRAY_LIMIT) {
            throw new IllegalArgumentException("maxFrameSize out of range: " + maxFrameSize);
        }
        if (expectedFrameSize < 0 || expectedFrameSize > maxFrameSize) {
            throw new IllegalArgumentException("expectedFrameSize out of range: " + expectedFrameSize);
        }
        if (assemblyTimeout.isNegative()) {
            throw new IllegalArgumentException("assemblyTimeout must not be negative");
        }
        if (lateStartWindow.isNegative()) {
            throw new IllegalArgumentException("lateStartWindow must not be negative");
        }
        this.maxChunkPayload = maxChunkPayload;
        this.maxFrameSize = maxFrameSize;
        this.expectedFrameSize = expectedFrameSize;
        this.timeoutNanos = assemblyTimeout.toNanos();
        this.lateStartNanos = lateStartWindow.toNanos();
        this.observer = observer;
        this.nanoClock = nanoClock;
    }

    /**
     * Feeds one chunk.
     *
     * @return the completed frame if this chunk was the last missing piece of the live epoch
     */
    public Optional<Frame> ingest(final Chunk chunk) {
        final AssemblyOutcome invalid = validate(chunk);
        if (invalid != null) {
            log.debug("Rejected chunk {} of frame size {}: {}", chunk.chunkIndex(), chunk.totalSize(), invalid);
            observer.onChunk(invalid);
            return Optional.empty();
        }

        final long now = nanoClock.getAsLong();
        expire(now);

        final long totalSize = chunk.totalSize();
        final int index = (int) chunk.chunkIndex();

        if (context == null) {
            context = open(totalSize);
        } else if (index == 0) {
            if (context.acceptsLateStart(totalSize, now, lateStartNanos)) {
                observer.onLateStart(context.received(), context.expectedChunkCount());
            } else {
                discard(DiscardReason.SUPERSEDED);
                context = open(totalSize);
            }
        } else if (context.expectedTotalSize() != totalSize) {
            log.debug("Chunk {} declares frame size {} but live epoch expects {}; dropped",
                    index, totalSize, context.expectedTotalSize());
            observer.onChunk(AssemblyOutcome.EPOCH_MISMATCH);
            return Optional.empty();
        }

        if (!context.store(index, chunk.payload())) {
            observer.onChunk(AssemblyOutcome.DUPLICATE);
            return Optional.empty();
        }

        if (!context.isComplete()) {
            observer.onChunk(AssemblyOutcome.STORED);
            return Optional.empty();
        }

        final AssemblyContext done = context;
        context = null;

        final byte[] payload = done.assemble();
        if (payload == null) {
            log.warn("Epoch of size {} counted {} chunks but did not concatenate; dropped",
                    done.expectedTotalSize(), done.received());
            observer.onDiscarded(DiscardReason.CORRUPT, done.received(), done.expectedChunkCount());
            return Optional.empty();
        }

        observer.onChunk(AssemblyOutcome.COMPLETED);
        return Optional.of(new Frame(totalSize, payload));
    }

    /**
     * Drops the live epoch if it is older than the assembly timeout.
     *
     * @return true if an epoch was dropped
     */
    public boolean expire(final long nowNanos) {
        if (timeoutNanos == 0 || context == null) return false;
        if (nowNanos - context.createdNanos() <= timeoutNanos) return false;

        discard(DiscardReason.EXPIRED);
        return true;
    }

    public boolean hasPendingEpoch() {
        return context != null;
    }

    public int pendingChunkCount() {
        return context == null ? 0 : context.received();
    }

    public long pendingTotalSize() {
        return context == null ? 0L : context.expectedTotalSize();
    }

    private AssemblyOutcome validate(final Chunk chunk) {
        final long totalSize = chunk.totalSize();
        if (totalSize == 0) return AssemblyOutcome.EMPTY_FRAME;
        if (totalSize > maxFrameSize) return AssemblyOutcome.OVERSIZED;
        if (expectedFrameSize != 0 && totalSize != expectedFrameSize) return AssemblyOutcome.UNEXPECTED_SIZE;

        final long count = FrameChunker.chunkCount(totalSize, maxChunkPayload);
        if (chunk.chunkIndex() >= count) return AssemblyOutcome.INDEX_OUT_OF_RANGE;

        final long offset = chunk.chunkIndex() * maxChunkPayload;
        final long expectedLength = Math.min(maxChunkPayload, totalSize - offset);
        if (chunk.length() != expectedLength) return AssemblyOutcome.BAD_LENGTH;

        return null;
    }

    private AssemblyContext open(final long totalSize) {
        final int count = (int) FrameChunker.chunkCount(totalSize, maxChunkPayload);
        return new AssemblyContext(totalSize, count, nanoClock.getAsLong());
    }

    private void discard(final DiscardReason reason) {
        final AssemblyContext dropped = context;
        context = null;
        log.debug("Discarded epoch of size {} with {}/{} chunks: {}",
                dropped.expectedTotalSize(), dropped.received(), dropped.expectedChunkCount(), reason);
        observer.onDiscarded(reason, dropped.received(), dropped.expectedChunkCount());
    }
}
