package com.nfltrends.query.ordinal;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CategoricalOrdinalTest {

    @Test
    void monthsAreDenseFromOne() {
        assertThat(CategoricalOrdinal.MONTHS.ordinalOf("January")).isEqualTo(1);
        assertThat(CategoricalOrdinal.MONTHS.ordinalOf("December")).isEqualTo(12);
    }

    @Test
    void nullSortsAfterRealValuesAndBeforeUnmatched() {
        CategoricalOrdinal months = CategoricalOrdinal.MONTHS;

        assertThat(months.ordinalOf(null)).isEqualTo(13);
        assertThat(months.ordinalOf("Smarch")).isEqualTo(14);
        assertThat(months.nullOrdinal()).isLessThan(months.unmatchedOrdinal());
    }

    @Test
    void weekdaysStartOnMonday() {
        assertThat(CategoricalOrdinal.WEEKDAYS.ordinalOf("Monday")).isEqualTo(1);
        assertThat(CategoricalOrdinal.WEEKDAYS.ordinalOf("Sunday")).isEqualTo(7);
        assertThat(CategoricalOrdinal.WEEKDAYS.ordinalOf(null)).isEqualTo(8);
    }

    @Test
    void sinceSeasonsCoverTwentySeasons() {
        CategoricalOrdinal seasons = CategoricalOrdinal.SEASONS_SINCE;

        assertThat(seasons.labels()).hasSize(20);
        assertThat(seasons.ordinalOf("since 2006-2007")).isEqualTo(1);
        assertThat(seasons.ordinalOf("since 2025-2026")).isEqualTo(20);
    }

    @Test
    void labelsBetweenIsInclusiveAndOpenEnded() {
        assertThat(CategoricalOrdinal.MONTHS.labelsBetween(9, 11)).containsExactly("September", "October", "November");
        assertThat(CategoricalOrdinal.MONTHS.labelsBetween(null, 2)).containsExactly("January", "February");
        assertThat(CategoricalOrdinal.MONTHS.labelsBetween(12, null)).containsExactly("December");
    }

    @Test
    void reversedBoundsDoNotWrap() {
        assertThat(CategoricalOrdinal.MONTHS.labelsBetween(11, 2)).isEmpty();
    }

    @Test
    void findOnlyKnowsRealLabels() {
        assertThat(CategoricalOrdinal.MONTHS.find("March")).contains(3);
        assertThat(CategoricalOrdinal.MONTHS.find("march")).isEmpty();
        assertThat(CategoricalOrdinal.MONTHS.find(null)).isEmpty();
    }
}
