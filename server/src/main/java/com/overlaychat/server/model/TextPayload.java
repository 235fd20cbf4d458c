package com.overlaychat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record TextPayload(
        @JsonProperty("avatarUrl") String avatarUrl,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("authorName") String authorName,
        @JsonProperty("authorType") AuthorType authorType,
        @JsonProperty("content") String content,
        @JsonProperty("privilegeType") int privilegeType,
        @JsonProperty("isGiftDanmaku") boolean isGiftDanmaku,
        @JsonProperty("authorLevel") int authorLevel,
        @JsonProperty("isNewbie") boolean isNewbie,
        @JsonProperty("isMobileVerified") boolean isMobileVerified,
        @JsonProperty("medalLevel") int medalLevel
) implements Payload {

    @JsonIgnore
    @Override
    public Command command() {
        return Command.ADD_TEXT;
    }
}
