package com.overlaychat.server.live;

/**
 * A chat (danmaku) message as decoded from the upstream room.
 *
 * @param msgType     non-zero when the text was sent together with a gift
 * @param privilegeType paid membership tier, 0 for none
 * @param rank        user rank; lower means an older account
 * @param medalRoomId room the fan medal was earned in, 0 without a medal
 */
public record DanmakuEvent(
        long uid,
        String uname,
        boolean admin,
        int privilegeType,
        String msg,
        long timestamp,
        int userLevel,
        long rank,
        boolean mobileVerified,
        int medalLevel,
        long medalRoomId,
        int msgType
) {
}
