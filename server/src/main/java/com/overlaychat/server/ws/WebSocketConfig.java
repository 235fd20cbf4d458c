package com.overlaychat.server.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatHandler chatHandler;
    private final boolean debug;

    public WebSocketConfig(ChatHandler chatHandler, @Value("${overlay.debug:false}") boolean debug) {
        this.chatHandler = chatHandler;
        this.debug = debug;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        WebSocketHandlerRegistration reg = registry.addHandler(chatHandler, "/chat");
        // 调试时允许跨域（前端 dev server 在别的端口），否则只接受同源
        if (debug) {
            reg.setAllowedOriginPatterns("*");
        }
    }
}
