package io.github.jakubt4.vista.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarsLocalTimeTest {

    @Test
    void extractsTimeFromFullTimestamp() {
        assertThat(MarsLocalTime.timeOfDay("Sol-01646M15:18:15.866")).contains("M15:18:15");
    }

    @Test
    void padsSingleDigitHours() {
        assertThat(MarsLocalTime.timeOfDay("Sol-1000M9:05:00")).contains("M09:05:00");
    }

    @Test
    void omitsMissingOrMalformedTimes() {
        assertThat(MarsLocalTime.timeOfDay(null)).isEmpty();
        assertThat(MarsLocalTime.timeOfDay("")).isEmpty();
        assertThat(MarsLocalTime.timeOfDay("Sol-1000")).isEmpty();
        assertThat(MarsLocalTime.timeOfDay("Sol-1000M25:00:00")).isEmpty();
        assertThat(MarsLocalTime.timeOfDay("Sol-1000Mnoon")).isEmpty();
    }
}
