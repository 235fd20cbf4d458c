package com.overlaychat.server.live;

/**
 * @param coinType "gold" for paid gifts, "silver" for free ones
 */
public record GiftEvent(
        long uid,
        String uname,
        String face,
        String giftName,
        int num,
        long totalCoin,
        String coinType,
        long timestamp
) {
    public static final String COIN_GOLD = "gold";

    public boolean isPaid() {
        return COIN_GOLD.equals(coinType);
    }
}
