package com.overlaychat.server.live;

import java.time.Duration;

public record LiveSettings(
        String roomInitUrl,        // https://api.live.bilibili.com/room/v1/Room/room_init
        String websocketUrl,       // wss://broadcastlv.chat.bilibili.com/sub
        Duration heartbeatInterval,
        Duration reconnectDelay
) {
}
