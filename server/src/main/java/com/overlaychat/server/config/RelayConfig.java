package com.overlaychat.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overlaychat.server.avatar.AvatarSettings;
import com.overlaychat.server.avatar.BilibiliProfileClient;
import com.overlaychat.server.avatar.CachingAvatarResolver;
import com.overlaychat.server.avatar.ProfileClient;
import com.overlaychat.server.live.BilibiliLiveClientFactory;
import com.overlaychat.server.live.LiveClientFactory;
import com.overlaychat.server.live.LiveSettings;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the relay core: avatar resolver, enrichment and delivery pools and the upstream live client factory.
 */
@Configuration
public class RelayConfig {
    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService enrichmentExecutor(@Value("${overlay.enrichment.threads:8}") int threads,
                                              @Value("${overlay.enrichment.queue-capacity:10000}") int queueCapacity) {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity), daemonThreads("enrichment"));
        pool.allowCoreThreadTimeOut(true);
        log.info("[BOOT] enrichment pool threads={} queue={}", threads, queueCapacity);
        return pool;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService deliveryExecutor(@Value("${overlay.delivery.threads:16}") int threads,
                                            @Value("${overlay.delivery.queue-capacity:10000}") int queueCapacity) {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity), daemonThreads("delivery"));
        pool.allowCoreThreadTimeOut(true);
        log.info("[BOOT] delivery pool threads={} queue={}", threads, queueCapacity);
        return pool;
    }

    @Bean
    public AvatarSettings avatarSettings(@Value("${overlay.avatar.min-fetch-interval-ms:200}") long intervalMs,
                                         @Value("${overlay.avatar.ban-backoff-seconds:183}") long backoffSeconds,
                                         @Value("${overlay.avatar.cache-capacity:50000}") int capacity,
                                         @Value("${overlay.avatar.eviction-batch:100}") int evictionBatch,
                                         @Value("${overlay.avatar.pending-queue-capacity:15}") int queueCapacity) {
        return new AvatarSettings(Duration.ofMillis(intervalMs), Duration.ofSeconds(backoffSeconds),
                capacity, evictionBatch, queueCapacity);
    }

    @Bean
    public ProfileClient profileClient(ObjectMapper mapper,
                                       @Value("${overlay.avatar.profile-url:https://api.bilibili.com/x/space/acc/info}") String url,
                                       @Value("${overlay.avatar.timeout-ms:5000}") long timeoutMs) {
        return new BilibiliProfileClient(url, Duration.ofMillis(timeoutMs), mapper);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public CachingAvatarResolver avatarResolver(ProfileClient profileClient,
                                                AvatarSettings settings,
                                                Clock clock,
                                                @Qualifier("enrichmentExecutor") ExecutorService executor) {
        return new CachingAvatarResolver(profileClient, settings, clock, executor);
    }

    @Bean
    public OkHttpClient liveHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(60))
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService liveScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreads("live-timer"));
    }

    @Bean
    public LiveSettings liveSettings(
            @Value("${overlay.live.room-init-url:https://api.live.bilibili.com/room/v1/Room/room_init}") String roomInitUrl,
            @Value("${overlay.live.websocket-url:wss://broadcastlv.chat.bilibili.com/sub}") String websocketUrl,
            @Value("${overlay.live.heartbeat-interval-seconds:10}") long heartbeatSeconds,
            @Value("${overlay.live.reconnect-delay-seconds:5}") long reconnectSeconds) {
        return new LiveSettings(roomInitUrl, websocketUrl,
                Duration.ofSeconds(heartbeatSeconds), Duration.ofSeconds(reconnectSeconds));
    }

    @Bean
    public LiveClientFactory liveClientFactory(LiveSettings settings, OkHttpClient liveHttpClient,
                                               ObjectMapper mapper,
                                               @Qualifier("liveScheduler") ScheduledExecutorService scheduler) {
        return new BilibiliLiveClientFactory(settings, liveHttpClient, mapper, scheduler);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
