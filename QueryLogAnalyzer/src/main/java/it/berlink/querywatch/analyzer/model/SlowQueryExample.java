package it.berlink.querywatch.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlowQueryExample {

    private long sequenceIndex;
    private double durationMs;
    private String sql;
    private String origin;
}
