package com.overlaychat.server.live;

public record GuardBuyEvent(long uid, String username, int guardLevel, long startTime) {
}
