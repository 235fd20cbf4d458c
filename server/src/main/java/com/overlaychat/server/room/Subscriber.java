package com.overlaychat.server.room;

import java.io.IOException;

/**
 * One overlay connection attached to a room.
 */
public interface Subscriber {

    String id();

    void send(String payload) throws IOException;
}
