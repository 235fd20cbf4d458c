package com.overlaychat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record GiftPayload(
        @JsonProperty("avatarUrl") String avatarUrl,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("authorName") String authorName,
        @JsonProperty("giftName") String giftName,
        @JsonProperty("giftNum") int giftNum,
        @JsonProperty("totalCoin") long totalCoin
) implements Payload {

    @JsonIgnore
    @Override
    public Command command() {
        return Command.ADD_GIFT;
    }
}
