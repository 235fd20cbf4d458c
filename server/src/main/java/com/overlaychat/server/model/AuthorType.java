package com.overlaychat.server.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a chat author inside the room. The overlay renders by the numeric code.
 */
public enum AuthorType {
    VIEWER(0),
    MEMBER(1),
    MODERATOR(2),
    OWNER(3);

    private final int code;

    AuthorType(int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }
}
