package it.berlink.querywatch.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlowQuerySummary {

    private long count;
    private double thresholdMs;
    private double percent;
    private List<SlowQueryExample> topExamples;
}
