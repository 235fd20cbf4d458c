package com.overlaychat.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders one relay broadcast as a single console line.
 */
public class OverlayLineFormatter {

    private static final String[] AUTHOR_TYPES = {"viewer", "member", "moderator", "owner"};

    private final ObjectMapper mapper = new ObjectMapper();

    public String format(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (Exception e) {
            return "[?] " + json;
        }
        JsonNode d = root.path("data");
        String author = d.path("authorName").asText("");
        return switch (root.path("cmd").asInt(-1)) {
            case 1 -> "[TEXT] " + author + " (" + authorType(d.path("authorType").asInt()) + ")"
                    + (d.path("isNewbie").asBoolean() ? " [new]" : "")
                    + ": " + d.path("content").asText("");
            case 2 -> "[GIFT] " + author + " x" + d.path("giftNum").asInt() + " " + d.path("giftName").asText("")
                    + " (" + d.path("totalCoin").asLong() + ")";
            case 3 -> "[MEMBER] " + author;
            default -> "[?] " + json;
        };
    }

    private static String authorType(int code) {
        return code >= 0 && code < AUTHOR_TYPES.length ? AUTHOR_TYPES[code] : String.valueOf(code);
    }
}
