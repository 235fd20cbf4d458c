package com.overlaychat.server.room;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overlaychat.server.avatar.AvatarResolver;
import com.overlaychat.server.live.LiveClientFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 管理 roomId 与 Room 的映射关系：第一个订阅者进来时创建并启动 Room，最后一个离开时停止并移除。
 * <p>
 * Create/destroy decisions for one room id run inside {@link ConcurrentHashMap#compute}, so a join
 * and a leave for the same id never interleave: there is never more than one Room per id, and a
 * Room is never torn down while a registration against it is pending.
 */
@Component
public class RoomManager {
    private static final Logger log = LoggerFactory.getLogger(RoomManager.class);

    private final Map<Long, Room> rooms = new ConcurrentHashMap<>();

    private final LiveClientFactory clientFactory;
    private final AvatarResolver avatars;
    private final Executor enrichment;
    private final Executor delivery;
    private final ObjectMapper mapper;
    private final boolean debug;

    public RoomManager(LiveClientFactory clientFactory,
                       AvatarResolver avatars,
                       @Qualifier("enrichmentExecutor") Executor enrichment,
                       @Qualifier("deliveryExecutor") Executor delivery,
                       ObjectMapper mapper,
                       @Value("${overlay.debug:false}") boolean debug) {
        this.clientFactory = clientFactory;
        this.avatars = avatars;
        this.enrichment = enrichment;
        this.delivery = delivery;
        this.mapper = mapper;
        this.debug = debug;
    }

    public void addSubscriber(long roomId, Subscriber subscriber) {
        Room room = rooms.compute(roomId, (id, existing) -> {
            Room r = existing;
            if (r == null) {
                log.info("[ROOM] creating room={}", id);
                r = new Room(id, clientFactory, avatars, enrichment, delivery, mapper);
                r.start();
            }
            r.addSubscriber(subscriber);
            return r;
        });
        log.info("[JOIN] room={} total={}", roomId, room.subscriberCount());

        if (debug) {
            SampleMessages.sendTo(room);
        }
    }

    public void removeSubscriber(long roomId, Subscriber subscriber) {
        rooms.computeIfPresent(roomId, (id, room) -> {
            room.removeSubscriber(subscriber);
            if (room.hasSubscribers()) {
                log.info("[LEAVE] room={} remaining={}", id, room.subscriberCount());
                return room;
            }
            log.info("[ROOM] removing room={}", id);
            room.stopAndClose();
            return null;
        });
    }

    public Room getRoom(long roomId) {
        return rooms.get(roomId);
    }

    public Set<Long> activeRooms() {
        return Set.copyOf(rooms.keySet());
    }

    public int subscriberCount(long roomId) {
        Room room = rooms.get(roomId);
        return room == null ? 0 : room.subscriberCount();
    }

    @PreDestroy
    public void closeAll() {
        for (Long id : rooms.keySet()) {
            rooms.computeIfPresent(id, (k, room) -> {
                room.stopAndClose();
                return null;
            });
        }
        log.info("[SHUTDOWN] all rooms closed");
    }
}
