package com.overlaychat.server.room;

import com.overlaychat.server.model.AuthorType;
import com.overlaychat.server.model.GiftPayload;
import com.overlaychat.server.model.MemberPayload;
import com.overlaychat.server.model.TextPayload;

/**
 * Fixed messages pushed to a room on join when {@code overlay.debug=true}, so the overlay can be
 * previewed without a live stream.
 */
final class SampleMessages {

    static final String AVATAR_URL =
            "https://i0.hdslb.com/bfs/face/29b6be8aa611e70a3d3ac219cdaf5e72b604f2de.jpg@48w_48h";
    static final String AUTHOR = "overlay-preview";

    private SampleMessages() {}

    static void sendTo(Room room) {
        long now = System.currentTimeMillis() / 1000;

        room.broadcast(new TextPayload(AVATAR_URL, now, AUTHOR, AuthorType.VIEWER,
                "The quick brown fox jumps over the lazy dog", 0, false, 20, false, true, 0));
        room.broadcast(new TextPayload(AVATAR_URL, now, "Streamer", AuthorType.OWNER,
                "I can eat glass, it doesn't hurt me.", 0, false, 20, false, true, 0));
        room.broadcast(new MemberPayload(AVATAR_URL, now, AUTHOR));
        room.broadcast(new GiftPayload(AVATAR_URL, now, AUTHOR, "Fireworks", 1, 28_000));
        room.broadcast(new GiftPayload(AVATAR_URL, now, AUTHOR, "Rhythm Storm", 1, 100_000));
        room.broadcast(new GiftPayload(AVATAR_URL, now, AUTHOR, "Skyscraper", 1, 450_000));
        room.broadcast(new GiftPayload(AVATAR_URL, now, AUTHOR, "Little TV Spaceship", 1, 1_245_000));
    }
}
