package com.overlaychat.server.live;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeLiveClientFactory implements LiveClientFactory {

    public final List<FakeLiveClient> created = new CopyOnWriteArrayList<>();

    /** When true, stop() futures complete immediately. */
    public volatile boolean completeStopImmediately = true;

    @Override
    public LiveClient create(long roomId, LiveEventListener listener) {
        FakeLiveClient client = new FakeLiveClient(roomId, listener, completeStopImmediately);
        created.add(client);
        return client;
    }

    public FakeLiveClient last() {
        return created.get(created.size() - 1);
    }

    public static DanmakuEvent text(long uid, String msg) {
        return new DanmakuEvent(uid, "user" + uid, false, 0, msg, 1_700_000_000_000L,
                12, 5_000, true, 0, 0, 0);
    }

    public static GiftEvent gift(String coinType) {
        return new GiftEvent(42, "giver", "https://i0.hdslb.com/bfs/face/giver.jpg", "Rocket", 2, 2_000, coinType, 1_700_000_000L);
    }
}
