package com.overlaychat.server.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Live danmaku client for one Bilibili room.
 * - start：room_init 查询真实房间号和主播 uid，然后连 WebSocket
 * - 连上后发送认证包，之后定时心跳
 * - 断线时如果仍在运行，延迟重连
 */
public class BilibiliLiveClient implements LiveClient {
    private static final Logger log = LoggerFactory.getLogger(BilibiliLiveClient.class);

    private final long roomId;
    private final LiveEventListener listener;
    private final LiveSettings settings;
    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;

    private volatile boolean running;
    private volatile long realRoomId;

    // guarded by this
    private Call initCall;
    private WebSocket socket;
    private ScheduledFuture<?> heartbeat;
    private ScheduledFuture<?> reconnect;
    private CompletableFuture<Void> stopped = CompletableFuture.completedFuture(null);

    public BilibiliLiveClient(long roomId, LiveEventListener listener, LiveSettings settings,
                              OkHttpClient http, ObjectMapper mapper, ScheduledExecutorService scheduler) {
        this.roomId = roomId;
        this.realRoomId = roomId;
        this.listener = listener;
        this.settings = settings;
        this.http = http;
        this.mapper = mapper;
        this.scheduler = scheduler;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        running = true;
        stopped = new CompletableFuture<>();
        connect();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized CompletableFuture<Void> stop() {
        if (!running) return stopped;
        running = false;
        cancelTimers();
        if (initCall != null) initCall.cancel();
        // an open socket completes it from onClosed / onFailure; close() is false once the socket has failed
        if (socket == null || !socket.close(1000, "stop")) {
            stopped.complete(null);
        }
        return stopped;
    }

    @Override
    public synchronized void close() {
        running = false;
        cancelTimers();
        if (initCall != null) {
            initCall.cancel();
            initCall = null;
        }
        if (socket != null) {
            socket.cancel();
            socket = null;
        }
        stopped.complete(null);
    }

    private synchronized void connect() {
        if (!running) return;
        Request req = new Request.Builder()
                .url(settings.roomInitUrl() + "?id=" + roomId)
                .build();
        initCall = http.newCall(req);
        initCall.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                if (!call.isCanceled()) {
                    log.warn("[LIVE] room_init failed room={}: {}", roomId, e.toString());
                    scheduleReconnect();
                }
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody body = response.body()) {
                    if (!response.isSuccessful() || body == null) {
                        log.warn("[LIVE] room_init status={} room={}", response.code(), roomId);
                        scheduleReconnect();
                        return;
                    }
                    JsonNode data = mapper.readTree(body.string()).path("data");
                    realRoomId = data.path("room_id").asLong(roomId);
                    listener.onRoomInit(realRoomId, data.path("uid").asLong());
                    openSocket();
                } catch (IOException e) {
                    log.warn("[LIVE] bad room_init response room={}: {}", roomId, e.toString());
                    scheduleReconnect();
                }
            }
        });
    }

    private synchronized void openSocket() {
        if (!running) return;
        Request req = new Request.Builder().url(settings.websocketUrl()).build();
        socket = http.newWebSocket(req, new PacketListener());
    }

    synchronized boolean hasSocket() {
        return socket != null;
    }

    private synchronized void detach(WebSocket ws) {
        if (socket == ws) socket = null;
    }

    private synchronized void scheduleReconnect() {
        if (!running) {
            stopped.complete(null);
            return;
        }
        cancelTimers();
        long delayMs = settings.reconnectDelay().toMillis();
        log.info("[LIVE] reconnecting room={} in {}ms", roomId, delayMs);
        reconnect = scheduler.schedule(this::connect, delayMs, TimeUnit.MILLISECONDS);
    }

    private void cancelTimers() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
        if (reconnect != null) {
            reconnect.cancel(false);
            reconnect = null;
        }
    }

    private String authBody() {
        return "{\"uid\":0,\"roomid\":" + realRoomId
                + ",\"protover\":2,\"platform\":\"web\",\"clientver\":\"1.14.3\",\"type\":2}";
    }

    private final class PacketListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket ws, Response response) {
            ws.send(ByteString.of(LivePacket.encode(LivePacket.OP_AUTH, authBody())));
            synchronized (BilibiliLiveClient.this) {
                long periodMs = settings.heartbeatInterval().toMillis();
                heartbeat = scheduler.scheduleAtFixedRate(
                        () -> ws.send(ByteString.of(LivePacket.encode(LivePacket.OP_HEARTBEAT, "{}"))),
                        periodMs, periodMs, TimeUnit.MILLISECONDS);
            }
            log.info("[LIVE] connected room={} real={}", roomId, realRoomId);
        }

        @Override
        public void onMessage(WebSocket ws, ByteString bytes) {
            List<LivePacket> packets;
            try {
                packets = LivePacket.decode(bytes.toByteArray());
            } catch (IOException e) {
                log.warn("[LIVE] undecodable frame room={}: {}", roomId, e.getMessage());
                return;
            }
            for (LivePacket packet : packets) {
                handle(packet);
            }
        }

        private void handle(LivePacket packet) {
            switch (packet.operation()) {
                case LivePacket.OP_AUTH_REPLY -> log.debug("[LIVE] auth ok room={}", roomId);
                case LivePacket.OP_HEARTBEAT_REPLY -> { }
                case LivePacket.OP_SEND_MSG_REPLY -> {
                    try {
                        LiveCommandParser.dispatch(mapper.readTree(packet.body()), listener);
                    } catch (IOException e) {
                        log.warn("[LIVE] bad command json room={}: {}", roomId, e.getMessage());
                    } catch (RuntimeException e) {
                        log.error("[LIVE] listener failed room={}", roomId, e);
                    }
                }
                default -> log.debug("[LIVE] unknown operation={} room={}", packet.operation(), roomId);
            }
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            ws.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            log.info("[LIVE] closed room={} code={}", roomId, code);
            detach(ws);
            scheduleReconnect();
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            if (running) log.warn("[LIVE] socket failure room={}: {}", roomId, t.toString());
            detach(ws);
            scheduleReconnect();
        }
    }
}
