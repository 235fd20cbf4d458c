package com.overlaychat.server.room;

public enum RoomState {
    STARTING,
    ACTIVE,
    STOPPING,
    CLOSED
}
