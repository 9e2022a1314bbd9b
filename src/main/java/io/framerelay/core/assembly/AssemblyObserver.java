package io.framerelay.core.assembly;

/**
 * Receives per-chunk outcomes and discarded epochs from a {@link FrameAssembler}.
 * Called on the receive thread only.
 */
public interface AssemblyObserver {

    AssemblyObserver NOOP = new AssemblyObserver() {
        @Override
        public void onChunk(final AssemblyOutcome outcome) {
        }

        @Override
        public void onDiscarded(final DiscardReason reason, final int received, final int expected) {
        }
    };

    void onChunk(AssemblyOutcome outcome);

    void onDiscarded(DiscardReason reason, int received, int expected);

    /**
     * A chunk 0 joined a live epoch that had been opened by later chunks of the same size.
     * Such a merge cannot be told apart from a lost start followed by the next frame's start.
     */
    default void onLateStart(final int received, final int expected) {
    }
}
