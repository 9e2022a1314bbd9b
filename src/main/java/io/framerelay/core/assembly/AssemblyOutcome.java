package io.framerelay.core.assembly;

/**
 * What the assembler did with one chunk.
 */
public enum AssemblyOutcome {
    /** Stored; the frame is still incomplete. */
    STORED,
    /** Stored and completed a frame. */
    COMPLETED,
    /** Index already present in the live epoch; ignored. */
    DUPLICATE,
    /** Non-restart chunk whose total size disagrees with the live epoch. */
    EPOCH_MISMATCH,
    /** Declared total size is zero. */
    EMPTY_FRAME,
    /** Declared total size exceeds the configured ceiling. */
    OVERSIZED,
    /** Declared total size disagrees with the configured fixed frame size. */
    UNEXPECTED_SIZE,
    /** Chunk index outside {@code [0, chunkCount)}. */
    INDEX_OUT_OF_RANGE,
    /** Payload length inconsistent with the chunk's position in the frame. */
    BAD_LENGTH;

    public boolean rejected() {
        return this != STORED && this != COMPLETED && this != DUPLICATE;
    }
}
