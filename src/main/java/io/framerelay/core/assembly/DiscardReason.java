package io.framerelay.core.assembly;

/**
 * Why a partially assembled epoch was thrown away.
 */
public enum DiscardReason {
    /** A restart (index 0) for a new epoch arrived first. */
    SUPERSEDED,
    /** The epoch outlived the configured assembly timeout. */
    EXPIRED,
    /** All indices were counted but the concatenation did not add up. */
    CORRUPT
}
