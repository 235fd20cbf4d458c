package com.overlaychat.client;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Joins a room on a running relay and prints every broadcast, like an overlay would receive it.
 * <pre>
 *   java -cp ... com.overlaychat.client.TapClient 12345 ws://localhost:12450/chat
 * </pre>
 */
public class TapClient {
    private static final Logger log = LoggerFactory.getLogger(TapClient.class);

    private final TapConfig config;
    private final OkHttpClient client;
    private final Consumer<String> sink;

    private final CountDownLatch opened = new CountDownLatch(1);
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicInteger received = new AtomicInteger();
    private volatile boolean failed;

    public TapClient(TapConfig config, OkHttpClient client, Consumer<String> sink) {
        this.config = config;
        this.client = client;
        this.sink = sink;
    }

    static String joinMessage(long roomId) {
        return "{\"cmd\":0,\"data\":{\"roomId\":" + roomId + "}}";
    }

    /**
     * Connects and sends the join. Returns false if the socket did not open in time.
     */
    public boolean connect() throws InterruptedException {
        Request req = new Request.Builder().url(config.wsUrl()).build();
        client.newWebSocket(req, new WebSocketListener() {
            @Override public void onOpen(WebSocket ws, Response resp) {
                ws.send(joinMessage(config.roomId()));
                log.info("[TAP] joined room={} via {}", config.roomId(), config.wsUrl());
                opened.countDown();
            }

            @Override public void onMessage(WebSocket ws, String text) {
                sink.accept(text);
                int n = received.incrementAndGet();
                if (config.maxMessages() > 0 && n >= config.maxMessages()) {
                    ws.close(1000, "done");
                    done.countDown();
                }
            }

            @Override public void onClosed(WebSocket ws, int code, String reason) {
                log.info("[TAP] closed code={} reason={}", code, reason);
                done.countDown();
            }

            @Override public void onFailure(WebSocket ws, Throwable t, Response r) {
                log.error("[TAP] connection failed: {}", t.toString());
                failed = true;
                opened.countDown();
                done.countDown();
            }
        });
        return opened.await(config.openTimeoutMs(), TimeUnit.MILLISECONDS) && !failed;
    }

    public boolean awaitDone(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    public int receivedCount() {
        return received.get();
    }

    public static void main(String[] args) throws Exception {
        TapConfig cfg = TapConfig.fromArgs(args);
        OverlayLineFormatter formatter = new OverlayLineFormatter();
        OkHttpClient client = new OkHttpClient.Builder().build();

        TapClient tap = new TapClient(cfg, client, text -> System.out.println(formatter.format(text)));
        try {
            if (!tap.connect()) {
                log.error("[TAP] could not connect to {}", cfg.wsUrl());
                System.exit(1);
            }
            tap.awaitDone(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
        } finally {
            client.dispatcher().executorService().shutdown();
        }
    }
}
