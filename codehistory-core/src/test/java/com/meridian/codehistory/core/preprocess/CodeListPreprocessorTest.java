package com.meridian.codehistory.core.preprocess;

import com.meridian.codehistory.api.model.SourceTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CodeListPreprocessorTest {

    private final CodeListPreprocessor preprocessor = new CodeListPreprocessor();
    private final CodeColumnSchema threeColumns = CodeColumnSchema.of("test", "PROCCODE1", "PROCCODE2", "PROCCODE3");

    private static List<String> codes(List<CodeListPreprocessor.PendingCode> pending) {
        return pending.stream().map(CodeListPreprocessor.PendingCode::code).toList();
    }

    @Test
    @DisplayName("Should collect non-empty codes in column order, skipping null and empty cells")
    void testBasicExtraction() {
        SourceTable table = SourceTable.builder("test")
                .columns("PROCCODE1", "PROCCODE2", "PROCCODE3")
                .row("A001", "A002", null)
                .row("B002", null, "B003")
                .row(null, "C003", "")
                .build();

        CodeListPreprocessor.CodeLists result = preprocessor.preprocess(table, threeColumns);

        assertThat(codes(result.row(0))).containsExactly("A001", "A002");
        assertThat(codes(result.row(1))).containsExactly("B002", "B003");
        assertThat(codes(result.row(2))).containsExactly("C003");
        assertThat(result.stats().records()).isEqualTo(3);
        assertThat(result.stats().recordsWithCodes()).isEqualTo(3);
        assertThat(result.stats().totalCodes()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should yield empty lists when no code column exists")
    void testNoCodeColumns() {
        SourceTable table = SourceTable.builder("test")
                .columns("other_col")
                .row(1).row(2).row(3)
                .build();

        CodeListPreprocessor.CodeLists result = preprocessor.preprocess(table, threeColumns);

        assertThat(result.perRow()).hasSize(3).allSatisfy(row -> assertThat(row).isEmpty());
        assertThat(result.stats().presentColumns()).isEmpty();
    }

    @Test
    @DisplayName("Should treat null, empty, blank and NaN cells as absent")
    void testAllNullValues() {
        SourceTable table = SourceTable.builder("test")
                .columns("PROCCODE1", "PROCCODE2")
                .row(null, "")
                .row("", null)
                .row(Double.NaN, "  ")
                .build();

        CodeListPreprocessor.CodeLists result = preprocessor.preprocess(table, threeColumns);

        assertThat(result.perRow()).allSatisfy(row -> assertThat(row).isEmpty());
        assertThat(result.stats().recordsWithCodes()).isZero();
    }

    @Test
    @DisplayName("Should trim codes and keep duplicates within a row")
    void testTrimAndDuplicates() {
        SourceTable table = SourceTable.builder("test")
                .columns("PROCCODE1", "PROCCODE2", "PROCCODE3")
                .row(" AAA ", "AAA", "BBB")
                .build();

        assertThat(codes(preprocessor.preprocess(table, threeColumns).row(0))).containsExactly("AAA", "AAA", "BBB");
    }

    @Test
    @DisplayName("Should read companion procedure date columns")
    void testCompanionDates() {
        SourceTable table = SourceTable.builder("dad")
                .columns("PROCCODE1", "PROCSTDT1_DT", "PROCCODE2")
                .row("1VA53", "2024-05-02", "2NM87")
                .build();

        List<CodeListPreprocessor.PendingCode> row =
                preprocessor.preprocess(table, CodeColumnSchema.DAD_PROCEDURE).row(0);

        assertThat(row).containsExactly(
                new CodeListPreprocessor.PendingCode("1VA53", LocalDate.of(2024, 5, 2)),
                new CodeListPreprocessor.PendingCode("2NM87", null));
    }

    @Test
    @DisplayName("Preset schemas should declare the numbered code columns")
    void testPresets() {
        assertThat(CodeColumnSchema.DAD_DIAGNOSIS.codeColumns()).hasSize(25).startsWith("DXCODE1").endsWith("DXCODE25");
        assertThat(CodeColumnSchema.ED_DIAGNOSIS.codeColumns()).hasSize(10).endsWith("DXCODE10");
        assertThat(CodeColumnSchema.DAD_PROCEDURE.dateColumns()).hasSize(20).startsWith("PROCSTDT1_DT");
        assertThat(CodeColumnSchema.DAD_DIAGNOSIS.hasDateColumns()).isFalse();
    }
}
