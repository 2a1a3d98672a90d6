package com.meridian.codehistory.core.aggregation;

import com.meridian.codehistory.api.model.CodeOccurrence;
import com.meridian.codehistory.api.model.SourceRecord;
import com.meridian.codehistory.core.index.CodeDictionary;
import com.meridian.codehistory.core.index.PartitionIndexBuilder;
import com.meridian.codehistory.core.index.PatientPartition;
import com.meridian.codehistory.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CodeAggregatorTest {

    private static final LocalDate MAY_1 = LocalDate.of(2024, 5, 1);
    private static final LocalDate MAY_9 = LocalDate.of(2024, 5, 9);

    private final List<SourceRecord> records = List.of(
            new SourceRecord("D1", "P001", MAY_1, MAY_1.plusDays(2), List.of(
                    new CodeOccurrence("ZZZ", MAY_1), new CodeOccurrence("AAA", MAY_1))),
            new SourceRecord("D2", "P001", MAY_9, MAY_9.plusDays(1), List.of(
                    new CodeOccurrence("AAA", MAY_9), new CodeOccurrence("BBB", MAY_9))));
    private final CodeDictionary dictionary = CodeDictionary.fromRecords(List.of(records));

    private PatientPartition partition(boolean retainOccurrences) {
        return new PartitionIndexBuilder(OpenTelemetry.noop().getTracer("test"), new InMemoryMetricsRegistry())
                .build("dad", records, dictionary, 0, retainOccurrences)
                .partitionFor("P001");
    }

    @Test
    @DisplayName("Should de-duplicate and sort codes across matched records")
    void testDedupAndSort() {
        PatientPartition partition = partition(false);
        CodeAggregator aggregator = new CodeAggregator(dictionary, false);

        aggregator.add(partition, 0);
        aggregator.add(partition, 1);

        assertThat(aggregator.sortedCodes()).containsExactly("AAA", "BBB", "ZZZ");
        assertThat(aggregator.matchedRecords()).isEqualTo(2);
        assertThat(aggregator.latestOccurrences()).isEmpty();
    }

    @Test
    @DisplayName("Should start empty and be reusable after reset")
    void testReset() {
        PatientPartition partition = partition(false);
        CodeAggregator aggregator = new CodeAggregator(dictionary, false);
        assertThat(aggregator.sortedCodes()).isEmpty();

        aggregator.add(partition, 0);
        aggregator.reset();
        aggregator.add(partition, 1);

        assertThat(aggregator.sortedCodes()).containsExactly("AAA", "BBB");
        assertThat(aggregator.distinctCodes()).isEqualTo(2);
        assertThat(aggregator.matchedRecords()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the latest occurrence of each code")
    void testLatestOccurrences() {
        PatientPartition partition = partition(true);
        CodeAggregator aggregator = new CodeAggregator(dictionary, true);

        aggregator.add(partition, 1);
        aggregator.add(partition, 0);

        assertThat(aggregator.latestOccurrences()).containsExactly(
                new CodeOccurrence("AAA", MAY_9),
                new CodeOccurrence("BBB", MAY_9),
                new CodeOccurrence("ZZZ", MAY_1));
    }
}
