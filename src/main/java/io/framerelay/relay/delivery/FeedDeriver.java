package io.framerelay.relay.delivery;

import io.framerelay.core.model.Feed;
import io.framerelay.core.model.Frame;

import java.util.List;
import java.util.function.Function;

/**
 * Derives zero or more named feeds from a completed frame.
 * <p>
 * Image transforms, encoders and detectors plug in here; the broadcaster only sees the resulting bytes.
 */
@FunctionalInterface
public interface FeedDeriver {

    List<Feed> derive(Frame frame);

    /**
     * Adapts a single transform. A {@code null} result yields no feed for that frame.
     */
    static FeedDeriver named(final String name, final Function<Frame, byte[]> transform) {
        return frame -> {
            final byte[] data = transform.apply(frame);
            return data == null ? List.of() : List.of(new Feed(name, data));
        };
    }
}
