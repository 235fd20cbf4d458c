package com.overlaychat.server.avatar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Avatar lookup guarded by a cache, a minimum interval between outbound fetches and a
 * backoff window after the profile service rejects us.
 * <p>
 * Lookups that arrive inside the interval get the placeholder and are queued; a background
 * worker ({@code avatar-fetcher}) drains the queue at the allowed rate so the cache warms up
 * for those users later. The queue is small and drops on overflow.
 */
public class CachingAvatarResolver implements AvatarResolver, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CachingAvatarResolver.class);

    static final String NO_FACE_SUFFIX = "noface.gif";
    static final String THUMBNAIL_SUFFIX = "@48w_48h";

    private final ProfileClient profiles;
    private final AvatarSettings settings;
    private final Clock clock;
    private final Executor fetchExecutor;

    private final Map<Long, String> cache = new ConcurrentHashMap<>();
    private final BlockingQueue<Long> pending;

    // guarded by this
    private Instant lastFetchAt = Instant.EPOCH;
    private Instant bannedUntil;

    private Thread worker;

    public CachingAvatarResolver(ProfileClient profiles, AvatarSettings settings, Clock clock, Executor fetchExecutor) {
        this.profiles = profiles;
        this.settings = settings;
        this.clock = clock;
        this.fetchExecutor = fetchExecutor;
        this.pending = new ArrayBlockingQueue<>(settings.pendingQueueCapacity());
    }

    @Override
    public String resolve(long userId) {
        String cached = cache.get(userId);
        if (cached != null) return cached;

        Instant attemptAt = acquireFetchSlot(userId);
        if (attemptAt == null) return DEFAULT_AVATAR_URL;

        String url;
        try {
            url = profiles.fetchFaceUrl(userId);
        } catch (ProfileRejectedException e) {
            synchronized (this) {
                bannedUntil = attemptAt.plus(settings.banBackoff());
            }
            log.warn("[AVATAR] fetch rejected status={} uid={}, backing off for {}s",
                    e.getStatus(), userId, settings.banBackoff().toSeconds());
            return DEFAULT_AVATAR_URL;
        } catch (IOException e) {
            log.debug("[AVATAR] fetch failed uid={}: {}", userId, e.toString());
            return DEFAULT_AVATAR_URL;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DEFAULT_AVATAR_URL;
        } catch (RuntimeException e) {
            log.warn("[AVATAR] unexpected fetch error uid={}", userId, e);
            return DEFAULT_AVATAR_URL;
        }

        if (!url.endsWith(NO_FACE_SUFFIX)) {
            url += THUMBNAIL_SUFFIX;
        }
        store(userId, url);
        return url;
    }

    /**
     * Decides whether this call may go to the network. Returns the attempt time, or null when
     * the call must fall back to the placeholder (throttled or backing off).
     */
    private synchronized Instant acquireFetchSlot(long userId) {
        Instant now = clock.instant();
        if (Duration.between(lastFetchAt, now).compareTo(settings.minFetchInterval()) < 0) {
            if (!pending.offer(userId)) {
                log.debug("[AVATAR] pending queue full, dropped uid={}", userId);
            }
            return null;
        }
        if (bannedUntil != null) {
            if (now.isBefore(bannedUntil)) return null;
            bannedUntil = null;
        }
        lastFetchAt = now;
        return now;
    }

    /** Makes room before inserting, so the entry just stored is never the one evicted. */
    private void store(long userId, String url) {
        if (!cache.containsKey(userId) && cache.size() >= settings.cacheCapacity()) {
            int removed = 0;
            Iterator<Long> it = cache.keySet().iterator();
            while (removed < settings.evictionBatch() && it.hasNext()) {
                it.next();
                it.remove();
                removed++;
            }
            log.debug("[AVATAR] cache full, evicted {} entries", removed);
        }
        cache.put(userId, url);
    }

    private synchronized long millisUntilNextFetch() {
        Duration elapsed = Duration.between(lastFetchAt, clock.instant());
        return Math.max(0, settings.minFetchInterval().minus(elapsed).toMillis());
    }

    /** Starts the background worker that drains deferred lookups. */
    public synchronized void start() {
        if (worker != null) return;
        worker = new Thread(this::drainPending, "avatar-fetcher");
        worker.setDaemon(true);
        worker.start();
        log.info("[BOOT] avatar fetcher started interval={}ms backoff={}s capacity={}",
                settings.minFetchInterval().toMillis(), settings.banBackoff().toSeconds(), settings.cacheCapacity());
    }

    private void drainPending() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                long userId = pending.take();
                if (cache.containsKey(userId)) continue;

                long waitMs = millisUntilNextFetch();
                if (waitMs > 0) Thread.sleep(waitMs);

                // fire and forget, the next queued id does not wait for this fetch
                fetchExecutor.execute(() -> resolve(userId));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RejectedExecutionException e) {
                log.warn("[AVATAR] deferred fetch rejected by executor: {}", e.getMessage());
            }
        }
    }

    @Override
    public synchronized void close() {
        if (worker != null) {
            worker.interrupt();
            worker = null;
        }
    }

    public int cacheSize() {
        return cache.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    public synchronized boolean isBackingOff() {
        return bannedUntil != null && clock.instant().isBefore(bannedUntil);
    }
}
