package com.overlaychat.server.avatar;

import java.io.IOException;

/**
 * Remote user profile lookup.
 */
public interface ProfileClient {

    /**
     * @return the raw face image URL of the user
     * @throws ProfileRejectedException the service answered with a non-success status
     * @throws IOException transport failure or an unreadable response
     */
    String fetchFaceUrl(long userId) throws ProfileRejectedException, IOException, InterruptedException;
}
