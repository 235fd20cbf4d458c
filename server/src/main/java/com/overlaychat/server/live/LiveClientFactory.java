package com.overlaychat.server.live;

@FunctionalInterface
public interface LiveClientFactory {

    LiveClient create(long roomId, LiveEventListener listener);
}
