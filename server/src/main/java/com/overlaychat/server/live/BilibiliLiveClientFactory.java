package com.overlaychat.server.live;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

import java.util.concurrent.ScheduledExecutorService;

public class BilibiliLiveClientFactory implements LiveClientFactory {

    private final LiveSettings settings;
    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;

    public BilibiliLiveClientFactory(LiveSettings settings, OkHttpClient http, ObjectMapper mapper,
                                     ScheduledExecutorService scheduler) {
        this.settings = settings;
        this.http = http;
        this.mapper = mapper;
        this.scheduler = scheduler;
    }

    @Override
    public LiveClient create(long roomId, LiveEventListener listener) {
        return new BilibiliLiveClient(roomId, listener, settings, http, mapper, scheduler);
    }
}
