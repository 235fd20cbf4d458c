package com.overlaychat.server.avatar;

import java.time.Duration;

public record AvatarSettings(
        Duration minFetchInterval,   // 两次请求的最小间隔
        Duration banBackoff,         // 疑似被 ban 后的冷却时间
        int cacheCapacity,
        int evictionBatch,
        int pendingQueueCapacity
) {
    public static AvatarSettings defaults() {
        return new AvatarSettings(Duration.ofMillis(200), Duration.ofSeconds(3 * 60 + 3), 50_000, 100, 15);
    }
}
