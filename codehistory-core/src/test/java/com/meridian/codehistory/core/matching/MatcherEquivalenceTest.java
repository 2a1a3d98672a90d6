package com.meridian.codehistory.core.matching;

import com.meridian.codehistory.api.model.MatchBackend;
import com.meridian.codehistory.api.model.SourceRecord;
import com.meridian.codehistory.api.model.Window;
import com.meridian.codehistory.core.index.CodeDictionary;
import com.meridian.codehistory.core.index.PartitionIndexBuilder;
import com.meridian.codehistory.core.index.PatientPartition;
import com.meridian.codehistory.core.index.PatientPartitionIndex;
import com.meridian.codehistory.core.window.WindowResolver;
import com.meridian.codehistory.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class MatcherEquivalenceTest {

    private static final LocalDate BASE = LocalDate.of(2022, 1, 1);

    @ParameterizedTest
    @EnumSource(MatchPredicate.class)
    @DisplayName("Indexed and linear-scan matching should agree on randomized partitions")
    void testBackendsAgree(MatchPredicate predicate) {
        Random random = new Random(42);
        boolean points = predicate == MatchPredicate.POINT_IN_WINDOW;
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            LocalDate start = BASE.plusDays(random.nextInt(900));
            LocalDate end = points ? start : start.plusDays(random.nextInt(random.nextInt(10) == 0 ? 200 : 15));
            records.add(SourceRecord.ofCodes("R" + i, "P" + random.nextInt(40), start, end, List.of("C" + random.nextInt(50))));
        }
        PatientPartitionIndex index = new PartitionIndexBuilder(OpenTelemetry.noop().getTracer("test"), new InMemoryMetricsRegistry())
                .build("random", records, CodeDictionary.fromRecords(List.of(records)), 0, false);

        IntervalMatcher indexed = IntervalMatchers.forBackend(MatchBackend.INDEXED);
        IntervalMatcher linear = IntervalMatchers.forBackend(MatchBackend.LINEAR_SCAN);
        int nonEmpty = 0;
        for (int q = 0; q < 1_000; q++) {
            PatientPartition partition = index.partitionFor("P" + random.nextInt(40));
            Window window = WindowResolver.resolve(BASE.plusDays(random.nextInt(1000)), 1 + random.nextInt(120));
            String episodeId = random.nextBoolean() ? "R" + random.nextInt(2_000) : "E" + q;

            IntArrayList fromIndex = new IntArrayList();
            IntArrayList fromScan = new IntArrayList();
            indexed.match(partition, window, episodeId, predicate, fromIndex);
            linear.match(partition, window, episodeId, predicate, fromScan);

            assertThat(fromIndex.toIntArray()).as("window %s for %s", window, episodeId).isEqualTo(fromScan.toIntArray());
            if (!fromIndex.isEmpty()) {
                nonEmpty++;
            }
        }
        assertThat(nonEmpty).isGreaterThan(100);
    }
}
