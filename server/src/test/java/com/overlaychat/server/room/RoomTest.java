package com.overlaychat.server.room;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.overlaychat.server.avatar.AvatarResolver;
import com.overlaychat.server.live.DanmakuEvent;
import com.overlaychat.server.live.FakeLiveClient;
import com.overlaychat.server.live.FakeLiveClientFactory;
import com.overlaychat.server.live.GuardBuyEvent;
import com.overlaychat.server.model.AuthorType;
import com.overlaychat.server.model.GiftPayload;
import com.overlaychat.server.model.TextPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static com.overlaychat.server.live.FakeLiveClientFactory.gift;
import static com.overlaychat.server.live.FakeLiveClientFactory.text;
import static org.junit.jupiter.api.Assertions.*;

class RoomTest {

    private static final String AVATAR = "https://i0.hdslb.com/bfs/face/u.jpg@48w_48h";

    private final ObjectMapper mapper = new ObjectMapper();
    private final FakeLiveClientFactory clients = new FakeLiveClientFactory();
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private Room newRoom(AvatarResolver avatars) {
        Room room = new Room(100, clients, avatars, Runnable::run, Runnable::run, mapper);
        room.start();
        return room;
    }

    @Test
    void broadcastReachesEverySubscriberOnceWithSamePayload() throws Exception {
        Room room = newRoom(uid -> AVATAR);
        RecordingSubscriber a = new RecordingSubscriber("a");
        RecordingSubscriber b = new RecordingSubscriber("b");
        RecordingSubscriber c = new RecordingSubscriber("c");
        room.addSubscriber(a);
        room.addSubscriber(b);
        room.addSubscriber(c);

        room.broadcast(new GiftPayload(AVATAR, 1, "x", "Rocket", 1, 1000));

        for (RecordingSubscriber s : List.of(a, b, c)) {
            assertEquals(1, s.received.size());
            assertEquals(a.received.get(0), s.received.get(0));
        }
        JsonNode msg = mapper.readTree(a.received.get(0));
        assertEquals(2, msg.get("cmd").asInt());
        assertEquals("Rocket", msg.get("data").get("giftName").asText());
    }

    @Test
    void brokenSubscriberIsSkipped() {
        Room room = newRoom(uid -> AVATAR);
        RecordingSubscriber broken = new RecordingSubscriber("broken");
        broken.broken = true;
        RecordingSubscriber ok = new RecordingSubscriber("ok");
        room.addSubscriber(broken);
        room.addSubscriber(ok);

        room.broadcast(new GiftPayload(AVATAR, 1, "x", "Rocket", 1, 1000));

        assertEquals(1, ok.received.size());
    }

    @Test
    void broadcastToEmptyRoomIsNoOp() {
        Room room = newRoom(uid -> AVATAR);

        assertDoesNotThrow(() -> room.broadcast(new GiftPayload(AVATAR, 1, "x", "Rocket", 1, 1000)));
    }

    @Test
    void freeGiftsAreDropped() {
        Room room = newRoom(uid -> AVATAR);
        RecordingSubscriber s = new RecordingSubscriber("s");
        room.addSubscriber(s);

        room.onGift(gift("silver"));
        assertTrue(s.received.isEmpty());

        room.onGift(gift("gold"));
        assertEquals(1, s.received.size());
    }

    @Test
    void textEventIsEnrichedWithAvatar() throws Exception {
        Room room = newRoom(uid -> "https://i0.hdslb.com/bfs/face/" + uid + ".jpg@48w_48h");
        RecordingSubscriber s = new RecordingSubscriber("s");
        room.addSubscriber(s);

        room.onDanmaku(text(55, "hi"));

        JsonNode msg = mapper.readTree(s.received.get(0));
        assertEquals(1, msg.get("cmd").asInt());
        JsonNode data = msg.get("data");
        assertEquals("https://i0.hdslb.com/bfs/face/55.jpg@48w_48h", data.get("avatarUrl").asText());
        assertEquals("user55", data.get("authorName").asText());
        assertEquals("hi", data.get("content").asText());
        assertEquals(0, data.get("authorType").asInt());
        assertTrue(data.get("isNewbie").asBoolean());
        assertTrue(data.get("isMobileVerified").asBoolean());
        assertFalse(data.get("isGiftDanmaku").asBoolean());
        assertEquals(12, data.get("authorLevel").asInt());
    }

    @Test
    void guardPurchaseBecomesMemberMessage() throws Exception {
        Room room = newRoom(uid -> AVATAR);
        RecordingSubscriber s = new RecordingSubscriber("s");
        room.addSubscriber(s);

        room.onGuardBuy(new GuardBuyEvent(8, "erin", 3, 1_700_000_100L));

        JsonNode msg = mapper.readTree(s.received.get(0));
        assertEquals(3, msg.get("cmd").asInt());
        assertEquals("erin", msg.get("data").get("authorName").asText());
        assertEquals(1_700_000_100L, msg.get("data").get("timestamp").asLong());
        assertEquals(AVATAR, msg.get("data").get("avatarUrl").asText());
    }

    @Test
    void authorTypePrecedence() {
        long owner = 1;
        assertEquals(AuthorType.OWNER, Room.classify(danmaku(owner, true, 3), owner));
        assertEquals(AuthorType.MODERATOR, Room.classify(danmaku(2, true, 3), owner));
        assertEquals(AuthorType.MEMBER, Room.classify(danmaku(2, false, 3), owner));
        assertEquals(AuthorType.VIEWER, Room.classify(danmaku(2, false, 0), owner));
    }

    @Test
    void ownerLearnedFromRoomInit() {
        Room room = newRoom(uid -> AVATAR);
        room.onRoomInit(5050, 777);

        TextPayload p = room.toTextPayload(danmaku(777, false, 0), AVATAR);

        assertEquals(AuthorType.OWNER, p.authorType());
        assertEquals(777, room.getOwnerUid());
    }

    @Test
    void medalFromAnotherRoomIsZeroed() {
        Room room = newRoom(uid -> AVATAR);
        room.onRoomInit(5050, 1);

        DanmakuEvent here = new DanmakuEvent(2, "f", false, 0, "m", 0, 1, 20_000, false, 9, 5050, 0);
        DanmakuEvent elsewhere = new DanmakuEvent(2, "f", false, 0, "m", 0, 1, 20_000, false, 9, 6060, 0);

        assertEquals(9, room.toTextPayload(here, AVATAR).medalLevel());
        assertEquals(0, room.toTextPayload(elsewhere, AVATAR).medalLevel());
        assertFalse(room.toTextPayload(here, AVATAR).isNewbie());
    }

    @Test
    void giftCanOvertakeTextStillWaitingForAvatar() throws Exception {
        CountDownLatch lookupStarted = new CountDownLatch(1);
        CountDownLatch releaseLookup = new CountDownLatch(1);
        AvatarResolver slow = uid -> {
            lookupStarted.countDown();
            try {
                releaseLookup.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AVATAR;
        };
        Room room = new Room(100, clients, slow, pool, Runnable::run, mapper);
        room.start();
        RecordingSubscriber s = new RecordingSubscriber("s");
        room.addSubscriber(s);

        room.onDanmaku(text(3, "first"));      // returns at once, enrichment pending
        assertTrue(lookupStarted.await(5, TimeUnit.SECONDS));
        room.onGift(gift("gold"));             // broadcast inline
        releaseLookup.countDown();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (s.received.size() < 2 && System.nanoTime() < deadline) Thread.sleep(10);

        assertEquals(2, s.received.size());
        assertEquals(2, mapper.readTree(s.received.get(0)).get("cmd").asInt(), "gift first");
        assertEquals(1, mapper.readTree(s.received.get(1)).get("cmd").asInt(), "text second");
    }

    @Test
    void blockedSubscriberDoesNotHoldUpOthers() throws Exception {
        Room room = new Room(100, clients, uid -> AVATAR, Runnable::run, pool, mapper);
        room.start();
        BlockingSubscriber stuck = new BlockingSubscriber("stuck");
        RecordingSubscriber fast = new RecordingSubscriber("fast");
        room.addSubscriber(stuck);
        room.addSubscriber(fast);

        // upstream callback thread must not wait on the stuck write
        assertTimeout(Duration.ofSeconds(2), () -> {
            room.onGift(gift("gold"));
            room.broadcast(new GiftPayload(AVATAR, 2, "y", "Ship", 1, 500));
        });

        assertTrue(stuck.entered.await(5, TimeUnit.SECONDS));
        waitUntil(() -> fast.received.size() == 2);
        assertTrue(stuck.received.isEmpty());

        stuck.release.countDown();
        waitUntil(() -> stuck.received.size() == 2);
        assertEquals(fast.received, stuck.received, "same payloads in the same order");
    }

    @Test
    void closeWaitsForStopToComplete() {
        clients.completeStopImmediately = false;
        Room room = newRoom(uid -> AVATAR);
        FakeLiveClient client = clients.last();

        room.stopAndClose();
        assertEquals(List.of("start", "stop"), client.calls);
        assertEquals(RoomState.STOPPING, room.getState());

        client.stopFuture.complete(null);
        assertEquals(List.of("start", "stop", "close"), client.calls);
        assertEquals(RoomState.CLOSED, room.getState());

        room.stopAndClose();
        assertEquals(3, client.calls.size(), "second stopAndClose is a no-op");
    }

    @Test
    void clientNotRunningIsClosedDirectly() {
        Room room = newRoom(uid -> AVATAR);
        FakeLiveClient client = clients.last();
        client.stop();
        client.calls.clear();

        room.stopAndClose();

        assertEquals(List.of("close"), client.calls);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("condition not met in time");
            Thread.sleep(10);
        }
    }

    static class BlockingSubscriber extends RecordingSubscriber {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        BlockingSubscriber(String id) {
            super(id);
        }

        @Override
        public void send(String payload) throws IOException {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            super.send(payload);
        }
    }

    private static DanmakuEvent danmaku(long uid, boolean admin, int privilege) {
        return new DanmakuEvent(uid, "u", admin, privilege, "m", 0, 1, 20_000, false, 0, 0, 0);
    }
}
