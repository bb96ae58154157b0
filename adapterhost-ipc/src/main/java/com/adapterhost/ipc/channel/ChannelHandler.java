package com.adapterhost.ipc.channel;

import java.io.IOException;
import java.nio.channels.SelectionKey;

/** Attachment of a registered channel; called on the event loop thread only. */
public interface ChannelHandler {

    void onReady(SelectionKey key) throws IOException;

    /** {@link #onReady} threw; the handler should release the channel. */
    void onFailure(Throwable cause);
}
