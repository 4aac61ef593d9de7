package com.marketplace.listing.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AutoDecisionEngineTest {

    private final AutoDecisionEngine engine = new AutoDecisionEngine();

    @ParameterizedTest(name = "trusted={0}, images={1} → autoApprove={2}")
    @CsvSource({
            "true,  1, true",
            "true,  3, true",
            "true,  0, false",
            "false, 1, false",
            "false, 0, false"
    })
    @DisplayName("auto-approves only trusted owners whose listing has an image")
    void decide(boolean trusted, int imageCount, boolean expected) {
        List<String> images = new ArrayList<>();
        for (int i = 0; i < imageCount; i++) {
            images.add("img/" + i + ".jpg");
        }
        ListingDraft draft = ListingDraft.builder()
                .name("Honey")
                .price(new BigDecimal("12.00"))
                .stockQty(10)
                .images(images)
                .build();

        assertThat(engine.decide(draft, trusted).autoApprove()).isEqualTo(expected);
    }
}
