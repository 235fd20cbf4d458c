package com.overlaychat.server.model;

/**
 * Outbound envelope {@code {"cmd": <int>, "data": {...}}}.
 */
public record OverlayMessage(Command cmd, Payload data) {

    public static OverlayMessage of(Payload payload) {
        return new OverlayMessage(payload.command(), payload);
    }
}
