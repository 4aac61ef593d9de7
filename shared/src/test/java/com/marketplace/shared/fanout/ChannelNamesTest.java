package com.marketplace.shared.fanout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ChannelNamesTest {

    @Test
    @DisplayName("direct channel name does not depend on argument order")
    void directIsOrderIndependent() {
        assertThat(ChannelNames.direct("buyer_2", "seller_1"))
                .isEqualTo(ChannelNames.direct("seller_1", "buyer_2"))
                .isEqualTo("dm:buyer_2:seller_1");
    }

    @Test
    @DisplayName("only the two participants belong to a direct channel")
    void directParticipants() {
        String channel = ChannelNames.direct("b1", "s1");

        assertThat(ChannelNames.isDirectParticipant(channel, "b1")).isTrue();
        assertThat(ChannelNames.isDirectParticipant(channel, "s1")).isTrue();
        assertThat(ChannelNames.isDirectParticipant(channel, "x")).isFalse();
        assertThat(ChannelNames.isDirectParticipant("owner:b1", "b1")).isFalse();
    }

    @Test
    @DisplayName("owner id is recovered from an owner channel")
    void ownerIdOf() {
        assertThat(ChannelNames.ownerIdOf(ChannelNames.owner("sel_1"))).contains("sel_1");
        assertThat(ChannelNames.ownerIdOf(ChannelNames.REVIEWERS)).isEmpty();
        assertThat(ChannelNames.isOrder(ChannelNames.order("ord_1"))).isTrue();
        assertThat(ChannelNames.isOrder("order:")).isFalse();
    }

    @Test
    @DisplayName("ids containing the separator are refused")
    void rejectsSeparatorInId() {
        assertThatThrownBy(() -> ChannelNames.owner("a:b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChannelNames.order(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
