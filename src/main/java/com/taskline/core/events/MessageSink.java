package com.taskline.core.events;

import java.io.IOException;

/**
 * Transport end of a subscriber channel, e.g. an SSE connection.
 * A thrown exception means the transport is gone.
 */
@FunctionalInterface
public interface MessageSink {
    void write(ChannelMessage message) throws IOException;
}
