package com.bloodforecast.ml;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class SeasonTest {

    @Test
    void of_mapsMonthsToSeasons() {
        assertThat(Season.of(LocalDate.of(2025, 1, 10))).isEqualTo(Season.WINTER);
        assertThat(Season.of(LocalDate.of(2025, 12, 31))).isEqualTo(Season.WINTER);
        assertThat(Season.of(LocalDate.of(2025, 4, 1))).isEqualTo(Season.SUMMER);
        assertThat(Season.of(LocalDate.of(2025, 7, 15))).isEqualTo(Season.MONSOON);
        assertThat(Season.of(LocalDate.of(2025, 9, 30))).isEqualTo(Season.MONSOON);
        assertThat(Season.of(LocalDate.of(2025, 10, 1))).isEqualTo(Season.POST_MONSOON);
        assertThat(Season.of(LocalDate.of(2025, 11, 20))).isEqualTo(Season.POST_MONSOON);
    }

    @Test
    void fromLabel_acceptsLabelAndConstantName() {
        assertThat(Season.fromLabel("Post-Monsoon")).contains(Season.POST_MONSOON);
        assertThat(Season.fromLabel("post_monsoon")).contains(Season.POST_MONSOON);
        assertThat(Season.fromLabel(" winter ")).contains(Season.WINTER);
        assertThat(Season.fromLabel("Spring")).isEmpty();
        assertThat(Season.fromLabel(null)).isEmpty();
    }

    @Test
    void onlyRainSeasonsAreRainAdjacent() {
        assertThat(Season.MONSOON.isRainAdjacent()).isTrue();
        assertThat(Season.POST_MONSOON.isRainAdjacent()).isTrue();
        assertThat(Season.WINTER.isRainAdjacent()).isFalse();
        assertThat(Season.SUMMER.isRainAdjacent()).isFalse();
    }
}
