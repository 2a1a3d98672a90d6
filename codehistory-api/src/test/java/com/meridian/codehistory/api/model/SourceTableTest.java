package com.meridian.codehistory.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SourceTableTest {

    @Test
    @DisplayName("Should build rows positionally and report missing columns")
    void testBuilderAndMissingColumns() {
        SourceTable table = SourceTable.builder("dad")
                .columns("episode_order", "PATID", "ADMITDATE_DT")
                .row("D1", "P001", "2024-06-01")
                .row("D2", "P001", null)
                .build();

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.rows().get(1).get("ADMITDATE_DT")).isNull();
        assertThat(table.missingColumns(List.of("PATID", "DISDATE_DT", "DXCODE1")))
                .containsExactly("DISDATE_DT", "DXCODE1");
    }

    @Test
    @DisplayName("Should reject rows whose width does not match the columns")
    void testRowWidth() {
        SourceTable.Builder builder = SourceTable.builder("ed").columns("PATID", "VISIT_DATE_DT");
        assertThatThrownBy(() -> builder.row("P001"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 columns");
    }

    @Test
    @DisplayName("Should reject source records that end before they start")
    void testInvertedRecord() {
        assertThatThrownBy(() -> SourceRecord.ofCodes("D1", "P001",
                LocalDate.of(2024, 6, 5), LocalDate.of(2024, 6, 1), List.of("A01")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Window should include both ends")
    void testWindowBounds() {
        Window window = new Window(LocalDate.of(2024, 5, 31), LocalDate.of(2024, 6, 9));

        assertThat(window.contains(LocalDate.of(2024, 5, 31))).isTrue();
        assertThat(window.contains(LocalDate.of(2024, 6, 9))).isTrue();
        assertThat(window.contains(LocalDate.of(2024, 6, 10))).isFalse();
        assertThat(window.overlaps(LocalDate.of(2024, 5, 20), LocalDate.of(2024, 5, 31))).isTrue();
        assertThat(window.toString()).isEqualTo("[2024-05-31, 2024-06-09]");
    }
}
