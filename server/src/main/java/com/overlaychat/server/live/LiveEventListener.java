package com.overlaychat.server.live;

/**
 * Callbacks from a {@link LiveClient}. Implementations must return quickly: they run on the
 * upstream read loop.
 */
public interface LiveEventListener {

    /** Room metadata arrived; {@code realRoomId} may differ from the short id that was requested. */
    default void onRoomInit(long realRoomId, long ownerUid) {}

    default void onDanmaku(DanmakuEvent event) {}

    default void onGift(GiftEvent event) {}

    default void onGuardBuy(GuardBuyEvent event) {}
}
