package com.overlaychat.client;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OverlayLineFormatterTest {

    private final OverlayLineFormatter formatter = new OverlayLineFormatter();

    @Test
    void textLineShowsAuthorTypeAndNewbieFlag() {
        String json = "{\"cmd\":1,\"data\":{\"authorName\":\"alice\",\"authorType\":2,\"isNewbie\":true,\"content\":\"hi\"}}";

        assertThat(formatter.format(json)).isEqualTo("[TEXT] alice (moderator) [new]: hi");
    }

    @Test
    void giftAndMemberLines() {
        assertThat(formatter.format(
                "{\"cmd\":2,\"data\":{\"authorName\":\"bob\",\"giftName\":\"Rocket\",\"giftNum\":3,\"totalCoin\":3000}}"))
                .isEqualTo("[GIFT] bob x3 Rocket (3000)");
        assertThat(formatter.format("{\"cmd\":3,\"data\":{\"authorName\":\"carol\"}}"))
                .isEqualTo("[MEMBER] carol");
    }

    @Test
    void unknownOrBrokenInputIsEchoed() {
        assertThat(formatter.format("{\"cmd\":9}")).isEqualTo("[?] {\"cmd\":9}");
        assertThat(formatter.format("oops")).isEqualTo("[?] oops");
    }
}
