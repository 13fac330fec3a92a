package com.openrangelabs.ingestor.extraction;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContinuationTokenTest {

    @Test
    void parse_TrackingTokenKeepsPipesInValue() {
        ContinuationToken token = ContinuationToken.parse("dbo.events|payload|a|b|c");

        assertThat(token.isOffset()).isFalse();
        assertThat(token.getTarget()).isEqualTo("dbo.events");
        assertThat(token.getTrackingField()).isEqualTo("payload");
        assertThat(token.getValue()).isEqualTo("a|b|c");
        assertThat(token.encode()).isEqualTo("dbo.events|payload|a|b|c");
    }

    @Test
    void parse_OffsetToken() {
        ContinuationToken token = ContinuationToken.parse("orders|250");

        assertThat(token.isOffset()).isTrue();
        assertThat(token.getOffset()).isEqualTo(250L);
        assertThat(token.isFor("ORDERS")).isTrue();
    }

    @Test
    void parse_RejectsMalformedTokens() {
        assertThatThrownBy(() -> ContinuationToken.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ContinuationToken.parse("orders")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ContinuationToken.parse("orders|next")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ContinuationToken.parse("|id|5")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getOffset_OnTrackingToken_Fails() {
        assertThatThrownBy(() -> ContinuationToken.tracking("orders", "id", "5").getOffset())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void offset_RejectsNegative() {
        assertThatThrownBy(() -> ContinuationToken.offset("orders", -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
