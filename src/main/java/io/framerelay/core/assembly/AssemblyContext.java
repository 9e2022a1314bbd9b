package io.framerelay.core.assembly;

/**
 * Buffered chunks of the single live epoch, indexed by chunk position.
 */
final class AssemblyContext {
    private final long expectedTotalSize;
    private final byte[][] slots;
    private final long createdNanos;
    private int received;

    AssemblyContext(final long expectedTotalSize, final int expectedChunkCount, final long createdNanos) {
        this.expectedTotalSize = expectedTotalSize;
        this.slots = new byte[expectedChunkCount][];
        this.createdNanos = createdNanos;
    }

    long expectedTotalSize() {
        return expectedTotalSize;
    }

    int expectedChunkCount() {
        return slots.length;
    }

    int received() {
        return received;
    }

    long createdNanos() {
        return createdNanos;
    }

    /**
     * A chunk 0 continues this epoch only as its late start: same total size, start slot still
     * empty, and the epoch opened no longer than {@code windowNanos} before {@code nowNanos}.
     * Anything else is a restart.
     */
    boolean acceptsLateStart(final long totalSize, final long nowNanos, final long windowNanos) {
        if (windowNanos == 0 || totalSize != expectedTotalSize || slots[0] != null) return false;
        return nowNanos - createdNanos <= windowNanos;
    }

    /**
     * @return false if the index was already stored (first copy wins)
     */
    boolean store(final int index, final byte[] payload) {
        if (slots[index] != null) return false;
        slots[index] = payload;
        received++;
        return true;
    }

    boolean isComplete() {
        return received == slots.length;
    }

    /**
     * Concatenates the slots in index order.
     *
     * @return the frame bytes, or {@code null} if a slot is missing or the lengths do not add up
     */
    byte[] assemble() {
        final byte[] out = new byte[(int) expectedTotalSize];
        int pos = 0;
        for (final byte[] slot : slots) {
            if (slot == null || pos + slot.length > out.length) return null;
            System.arraycopy(slot, 0, out, pos, slot.length);
            pos += slot.length;
        }
        return pos == out.length ? out : null;
    }
}
