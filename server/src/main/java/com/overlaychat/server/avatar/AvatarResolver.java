package com.overlaychat.server.avatar;

/**
 * Resolves a user's avatar URL. Implementations never fail: every degraded path yields
 * {@link #DEFAULT_AVATAR_URL}.
 */
public interface AvatarResolver {

    String DEFAULT_AVATAR_URL = "https://static.hdslb.com/images/member/noface.gif";

    String resolve(long userId);
}
