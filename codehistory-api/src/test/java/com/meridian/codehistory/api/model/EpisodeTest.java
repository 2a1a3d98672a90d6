package com.meridian.codehistory.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class EpisodeTest {

    @Test
    @DisplayName("Should normalize type to lowercase and treat 'INP' as inpatient")
    void testTypeNormalization() {
        Episode episode = new Episode("P001_1", " P001 ", LocalDate.of(2024, 6, 10), " INP ");

        assertThat(episode.type()).isEqualTo("inp");
        assertThat(episode.isInpatient()).isTrue();
        assertThat(episode.patientId()).isEqualTo("P001");
    }

    @Test
    @DisplayName("Should default a missing type to empty and non-inpatient")
    void testMissingType() {
        Episode episode = new Episode("E1", "P001", LocalDate.of(2024, 6, 10));

        assertThat(episode.type()).isEmpty();
        assertThat(episode.isInpatient()).isFalse();
    }

    @Test
    @DisplayName("Should reject blank ids and a missing start date")
    void testValidation() {
        LocalDate day = LocalDate.of(2024, 6, 10);
        assertThatThrownBy(() -> new Episode(" ", "P001", day)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Episode("E1", "", day)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Episode("E1", "P001", null)).isInstanceOf(NullPointerException.class);
    }
}
