package com.meridian.codehistory.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class FeatureModeTest {

    @ParameterizedTest
    @CsvSource({
            "inp only, INP_ONLY",
            "INP_ONLY, INP_ONLY",
            "both, BOTH",
            "Both, BOTH",
            "inp ignore ed, INP_IGNORE_ED",
            "inp_ignore_ed, INP_IGNORE_ED"
    })
    @DisplayName("Should parse labels and enum names case-insensitively")
    void testFromString(String value, FeatureMode expected) {
        assertThat(FeatureMode.fromString(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should reject unknown modes with the accepted labels in the message")
    void testUnknownMode() {
        assertThatThrownBy(() -> FeatureMode.fromString("ed only"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inp ignore ed");
    }

    @Test
    @DisplayName("Should parse match backends and extraction kinds")
    void testOtherEnums() {
        assertThat(MatchBackend.fromString("linear-scan")).isEqualTo(MatchBackend.LINEAR_SCAN);
        assertThat(MatchBackend.fromString("indexed")).isEqualTo(MatchBackend.INDEXED);
        assertThat(ExtractionKind.fromString("proc")).isEqualTo(ExtractionKind.PROCEDURE);
        assertThat(ExtractionKind.fromString("Diagnosis")).isEqualTo(ExtractionKind.DIAGNOSIS);
        assertThatThrownBy(() -> MatchBackend.fromString("btree")).isInstanceOf(IllegalArgumentException.class);
    }
}
