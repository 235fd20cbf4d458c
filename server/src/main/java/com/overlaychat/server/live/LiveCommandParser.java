package com.overlaychat.server.live;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps JSON commands pushed by the live room to listener callbacks. Unknown commands are ignored.
 */
public final class LiveCommandParser {
    private static final Logger log = LoggerFactory.getLogger(LiveCommandParser.class);

    private LiveCommandParser() {}

    public static void dispatch(JsonNode command, LiveEventListener listener) {
        String cmd = command.path("cmd").asText("");
        // newer servers append flags, e.g. "DANMU_MSG:4:0:2:2:2:0"
        int colon = cmd.indexOf(':');
        if (colon >= 0) cmd = cmd.substring(0, colon);

        switch (cmd) {
            case "DANMU_MSG" -> listener.onDanmaku(parseDanmaku(command.path("info")));
            case "SEND_GIFT" -> listener.onGift(parseGift(command.path("data")));
            case "GUARD_BUY" -> listener.onGuardBuy(parseGuardBuy(command.path("data")));
            default -> {
                if (log.isTraceEnabled()) log.trace("ignored cmd={}", cmd);
            }
        }
    }

    static DanmakuEvent parseDanmaku(JsonNode info) {
        JsonNode meta = info.path(0);
        JsonNode user = info.path(2);
        JsonNode medal = info.path(3);
        JsonNode level = info.path(4);
        return new DanmakuEvent(
                user.path(0).asLong(),
                user.path(1).asText(""),
                user.path(2).asInt() != 0,
                info.path(7).asInt(),
                info.path(1).asText(""),
                meta.path(4).asLong(),
                level.path(0).asInt(),
                user.path(5).asLong(),
                user.path(6).asInt() != 0,
                medal.path(0).asInt(),
                medal.path(3).asLong(),
                meta.path(9).asInt()
        );
    }

    static GiftEvent parseGift(JsonNode data) {
        return new GiftEvent(
                data.path("uid").asLong(),
                data.path("uname").asText(""),
                data.path("face").asText(""),
                data.path("giftName").asText(""),
                data.path("num").asInt(),
                data.path("total_coin").asLong(),
                data.path("coin_type").asText(""),
                data.path("timestamp").asLong()
        );
    }

    static GuardBuyEvent parseGuardBuy(JsonNode data) {
        return new GuardBuyEvent(
                data.path("uid").asLong(),
                data.path("username").asText(""),
                data.path("guard_level").asInt(),
                data.path("start_time").asLong()
        );
    }
}
