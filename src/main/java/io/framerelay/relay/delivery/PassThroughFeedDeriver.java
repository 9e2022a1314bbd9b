package io.framerelay.relay.delivery;

import io.framerelay.core.model.Feed;
import io.framerelay.core.model.Frame;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Publishes the frame bytes unchanged under one feed name.
 */
@Getter
@RequiredArgsConstructor
public final class PassThroughFeedDeriver implements FeedDeriver {

    public static final String DEFAULT_FEED = "original";

    private final String feedName;

    public PassThroughFeedDeriver() {
        this(DEFAULT_FEED);
    }

    @Override
    public List<Feed> derive(final Frame frame) {
        return List.of(new Feed(feedName, frame.payload()));
    }
}
