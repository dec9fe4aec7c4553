package it.berlink.querywatch.aggregate;

import it.berlink.querywatch.model.PatternGroup;
import it.berlink.querywatch.model.StatementRecord;
import it.berlink.querywatch.normalizer.SqlNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups statements by normalized pattern in a single pass.
 *
 * Only the first statement text of each group is kept, so memory is bounded
 * by the number of distinct patterns rather than the number of statements.
 */
public class PatternAggregator {

    private static final Comparator<Accumulator> ORDER =
        Comparator.comparingDouble((Accumulator a) -> a.totalTime).reversed()
            .thenComparing(Comparator.comparingLong((Accumulator a) -> a.count).reversed())
            .thenComparingInt(a -> a.firstSeen);

    private final SqlNormalizer normalizer;

    public PatternAggregator(SqlNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Aggregates the records by pattern.
     *
     * @return groups ordered by total time, then count (both descending), then first appearance
     */
    public List<PatternGroup> aggregate(List<StatementRecord> records) {
        Map<String, Accumulator> byPattern = new LinkedHashMap<>();

        for (StatementRecord record : records) {
            String pattern = normalizer.normalize(record.text());
            Accumulator acc = byPattern.get(pattern);
            if (acc == null) {
                acc = new Accumulator(pattern, record.text(), byPattern.size());
                byPattern.put(pattern, acc);
            }
            acc.add(record.durationSeconds());
        }

        List<Accumulator> sorted = new ArrayList<>(byPattern.values());
        sorted.sort(ORDER);

        List<PatternGroup> groups = new ArrayList<>(sorted.size());
        for (Accumulator acc : sorted) {
            groups.add(acc.toGroup());
        }
        return groups;
    }

    public SqlNormalizer getNormalizer() {
        return normalizer;
    }

    private static final class Accumulator {
        private final String pattern;
        private final String exampleText;
        private final int firstSeen;
        private long count;
        private double totalTime;
        private double maxTime;

        private Accumulator(String pattern, String exampleText, int firstSeen) {
            this.pattern = pattern;
            this.exampleText = exampleText;
            this.firstSeen = firstSeen;
        }

        private void add(double durationSeconds) {
            count++;
            totalTime += durationSeconds;
            if (durationSeconds > maxTime) {
                maxTime = durationSeconds;
            }
        }

        private PatternGroup toGroup() {
            return PatternGroup.builder()
                .pattern(pattern)
                .count(count)
                .totalTime(totalTime)
                .maxTime(maxTime)
                .exampleText(exampleText)
                .build();
        }
    }
}
