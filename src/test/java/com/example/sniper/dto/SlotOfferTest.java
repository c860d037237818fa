package com.example.sniper.dto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SlotOfferTest {

    @Test
    void shouldTakeHourAndMinuteFromFullTimestamp() {
        assertThat(new SlotOffer("2024-06-01 19:30:00", "tok", null).timeOfDay()).isEqualTo("19:30");
    }

    @Test
    void shouldAcceptBareTime() {
        assertThat(new SlotOffer("07:15:00", "tok", null).timeOfDay()).isEqualTo("07:15");
        assertThat(new SlotOffer("21:00", "tok", null).timeOfDay()).isEqualTo("21:00");
    }

    @Test
    void shouldReturnEmptyForMissingStart() {
        assertThat(new SlotOffer(null, "tok", null).timeOfDay()).isEmpty();
        assertThat(new SlotOffer("  ", "tok", null).timeOfDay()).isEmpty();
    }

    @Test
    void shouldTreatBlankTokenAsMissing() {
        assertThat(new SlotOffer("2024-06-01 19:30:00", "", null).hasConfigToken()).isFalse();
        assertThat(new SlotOffer("2024-06-01 19:30:00", null, null).hasConfigToken()).isFalse();
        assertThat(new SlotOffer("2024-06-01 19:30:00", "tok1", null).hasConfigToken()).isTrue();
    }
}
