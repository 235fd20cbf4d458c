package com.overlaychat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Paid membership (guard) purchase. */
public record MemberPayload(
        @JsonProperty("avatarUrl") String avatarUrl,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("authorName") String authorName
) implements Payload {

    @JsonIgnore
    @Override
    public Command command() {
        return Command.ADD_MEMBER;
    }
}
