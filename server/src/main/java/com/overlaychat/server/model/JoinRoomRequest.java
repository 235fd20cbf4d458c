package com.overlaychat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * {@code data} part of a JOIN_ROOM envelope. The overlay sends the room id either as a
 * string or as a number; Jackson coerces both.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JoinRoomRequest {
    @NotNull @Positive
    public Long roomId;
}
