package com.taxledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxYearTest {

    @Test
    @DisplayName("boundaries are Jan 1 and Dec 31, inclusive")
    void boundaries() {
        TaxYear year = TaxYear.of(2023);

        assertThat(year.start()).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(year.end()).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(year.priorYearEnd()).isEqualTo(LocalDate.of(2022, 12, 31));
        assertThat(year.isBeforeStart(LocalDate.of(2022, 12, 31))).isTrue();
        assertThat(year.isBeforeStart(year.start())).isFalse();
        assertThat(year.isAfterEnd(year.end())).isFalse();
        assertThat(year.isAfterEnd(LocalDate.of(2024, 1, 1))).isTrue();
    }

    @Test
    @DisplayName("years outside the supported range are rejected")
    void outOfRange() {
        assertThatThrownBy(() -> TaxYear.of(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaxYear.of(10_000)).isInstanceOf(IllegalArgumentException.class);
    }
}
