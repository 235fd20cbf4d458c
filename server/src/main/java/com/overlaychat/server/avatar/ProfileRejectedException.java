package com.overlaychat.server.avatar;

/**
 * The profile service refused a lookup (non-2xx). Usually means we are being throttled.
 */
public class ProfileRejectedException extends Exception {
    private final int status;

    public ProfileRejectedException(int status) {
        super("profile lookup rejected: status=" + status);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
