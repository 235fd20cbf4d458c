package com.overlaychat.client;

public record TapConfig(
        String wsUrl,       // ws://localhost:12450/chat
        long roomId,
        int maxMessages,    // stop after this many broadcasts, 0 = run until closed
        long openTimeoutMs
) {
    public static TapConfig fromArgs(String[] args) {
        if (args.length < 1) {
            throw new IllegalArgumentException("usage: TapClient <roomId> [wsUrl] [maxMessages] [openTimeoutMs]");
        }
        long room   = Long.parseLong(args[0]);
        String url  = args.length > 1 ? args[1] : "ws://localhost:12450/chat";
        int max     = args.length > 2 ? Integer.parseInt(args[2]) : 0;
        long open   = args.length > 3 ? Long.parseLong(args[3]) : 5000L;
        return new TapConfig(url, room, max, open);
    }
}
