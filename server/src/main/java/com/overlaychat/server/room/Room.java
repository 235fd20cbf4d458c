package com.overlaychat.server.room;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.overlaychat.server.avatar.AvatarResolver;
import com.overlaychat.server.live.DanmakuEvent;
import com.overlaychat.server.live.GiftEvent;
import com.overlaychat.server.live.GuardBuyEvent;
import com.overlaychat.server.live.LiveClient;
import com.overlaychat.server.live.LiveClientFactory;
import com.overlaychat.server.live.LiveEventListener;
import com.overlaychat.server.model.AuthorType;
import com.overlaychat.server.model.GiftPayload;
import com.overlaychat.server.model.MemberPayload;
import com.overlaychat.server.model.OverlayMessage;
import com.overlaychat.server.model.Payload;
import com.overlaychat.server.model.TextPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One upstream live room shared by all overlay connections watching it.
 * <p>
 * Text and guard events need an avatar lookup, so they are normalized on the enrichment
 * executor and the upstream callback returns at once. Gifts carry their own avatar and are
 * broadcast inline. A gift can therefore reach subscribers before a text that arrived earlier.
 */
public class Room implements LiveEventListener {
    private static final Logger log = LoggerFactory.getLogger(Room.class);

    static final long NEWBIE_RANK_THRESHOLD = 10_000;
    static final long UNKNOWN_OWNER = -1;
    static final int MAX_BACKLOG = 1000;

    private final long roomId;
    private final LiveClientFactory clientFactory;
    private final AvatarResolver avatars;
    private final Executor enrichment;
    private final Executor delivery;
    private final ObjectMapper mapper;

    private final List<DeliveryLane> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicReference<RoomState> state = new AtomicReference<>(RoomState.STARTING);

    private volatile LiveClient client;
    private volatile long realRoomId;
    private volatile long ownerUid = UNKNOWN_OWNER;

    public Room(long roomId, LiveClientFactory clientFactory, AvatarResolver avatars,
                Executor enrichment, Executor delivery, ObjectMapper mapper) {
        this.roomId = roomId;
        this.realRoomId = roomId;
        this.clientFactory = clientFactory;
        this.avatars = avatars;
        this.enrichment = enrichment;
        this.delivery = delivery;
        this.mapper = mapper;
    }

    public void start() {
        if (!state.compareAndSet(RoomState.STARTING, RoomState.ACTIVE)) return;
        client = clientFactory.create(roomId, this);
        client.start();
    }

    public void addSubscriber(Subscriber subscriber) {
        subscribers.add(new DeliveryLane(subscriber, delivery, MAX_BACKLOG, roomId));
    }

    public void removeSubscriber(Subscriber subscriber) {
        subscribers.removeIf(lane -> lane.subscriber() == subscriber);
    }

    public boolean hasSubscribers() {
        return !subscribers.isEmpty();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Stops the upstream read loop, then closes the connection once the stop has completed.
     */
    public void stopAndClose() {
        RoomState prev = state.getAndSet(RoomState.STOPPING);
        if (prev == RoomState.STOPPING || prev == RoomState.CLOSED) {
            state.set(prev);
            return;
        }
        LiveClient c = client;
        if (c == null) {
            state.set(RoomState.CLOSED);
            return;
        }
        if (c.isRunning()) {
            c.stop().whenComplete((ignored, err) -> {
                if (err != null) log.warn("[ROOM] stop failed room={}: {}", roomId, err.toString());
                closeClient(c);
            });
        } else {
            closeClient(c);
        }
    }

    private void closeClient(LiveClient c) {
        try {
            c.close();
        } catch (RuntimeException e) {
            log.warn("[ROOM] close failed room={}", roomId, e);
        } finally {
            state.set(RoomState.CLOSED);
        }
    }

    /**
     * Encodes once and hands the payload to every current subscriber's lane. Returns without
     * waiting for the writes. A subscriber whose transport fails is skipped; its connection close
     * path takes care of deregistration.
     */
    public void broadcast(Payload payload) {
        if (subscribers.isEmpty()) return;

        String body;
        try {
            body = mapper.writeValueAsString(OverlayMessage.of(payload));
        } catch (JsonProcessingException e) {
            log.error("[ROOM] cannot encode {} room={}", payload.command(), roomId, e);
            return;
        }

        int n = 0;
        for (DeliveryLane lane : subscribers) {
            lane.submit(body);
            n++;
        }
        if (log.isDebugEnabled()) {
            log.debug("[BROADCAST] room={} cmd={} subscribers={}", roomId, payload.command(), n);
        }
    }

    @Override
    public void onRoomInit(long realRoomId, long ownerUid) {
        this.realRoomId = realRoomId;
        this.ownerUid = ownerUid;
        log.info("[ROOM] init room={} real={} owner={}", roomId, realRoomId, ownerUid);
    }

    @Override
    public void onDanmaku(DanmakuEvent event) {
        spawn("text", () -> broadcast(toTextPayload(event, avatars.resolve(event.uid()))));
    }

    @Override
    public void onGift(GiftEvent event) {
        if (!event.isPaid()) return;
        broadcast(new GiftPayload(event.face(), event.timestamp(), event.uname(),
                event.giftName(), event.num(), event.totalCoin()));
    }

    @Override
    public void onGuardBuy(GuardBuyEvent event) {
        spawn("member", () -> broadcast(new MemberPayload(
                avatars.resolve(event.uid()), event.startTime(), event.username())));
    }

    /**
     * Runs an enrichment task in the background. Not awaited; a failure is logged and goes no further.
     */
    private void spawn(String kind, Runnable task) {
        try {
            enrichment.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("[ROOM] {} enrichment failed room={}", kind, roomId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[ROOM] {} event dropped room={}: {}", kind, roomId, e.getMessage());
        }
    }

    TextPayload toTextPayload(DanmakuEvent e, String avatarUrl) {
        return new TextPayload(
                avatarUrl,
                e.timestamp(),
                e.uname(),
                classify(e, ownerUid),
                e.msg(),
                e.privilegeType(),
                e.msgType() != 0,
                e.userLevel(),
                e.rank() < NEWBIE_RANK_THRESHOLD,
                e.mobileVerified(),
                e.medalRoomId() == realRoomId ? e.medalLevel() : 0
        );
    }

    static AuthorType classify(DanmakuEvent e, long ownerUid) {
        if (e.uid() == ownerUid) return AuthorType.OWNER;
        if (e.admin()) return AuthorType.MODERATOR;
        if (e.privilegeType() != 0) return AuthorType.MEMBER;   // 1总督 2提督 3舰长
        return AuthorType.VIEWER;
    }

    public long getRoomId() {
        return roomId;
    }

    public long getOwnerUid() {
        return ownerUid;
    }

    public RoomState getState() {
        return state.get();
    }
}
