package com.overlaychat.server.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Command tags carried in the {@code cmd} field of every overlay message.
 */
public enum Command {
    JOIN_ROOM(0),
    ADD_TEXT(1),
    ADD_GIFT(2),
    ADD_MEMBER(3);

    private final int code;

    Command(int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }

    public static Command fromCode(int code) {
        for (Command c : values()) {
            if (c.code == code) return c;
        }
        return null;
    }
}
