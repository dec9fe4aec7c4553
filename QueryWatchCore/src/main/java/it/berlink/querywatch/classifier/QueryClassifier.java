package it.berlink.querywatch.classifier;

import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.model.Classification;
import it.berlink.querywatch.model.PatternGroup;
import it.berlink.querywatch.model.StatementRecord;

import java.util.Comparator;
import java.util.List;

/**
 * Applies the configured thresholds to a set of statements and their groups.
 *
 * The three rules are independent:
 * <ul>
 *   <li>slow statements: any statement above {@code slowStatementMs}</li>
 *   <li>suspected N+1: any group above {@code scopeStatementCountThreshold}, or a group of at least
 *       {@code minGroupSizeForNPlusOne} statements averaging under {@code cheapStatementMs}</li>
 *   <li>slow scope: scope duration above {@code slowStatementMs * slowScopeMultiplier}</li>
 * </ul>
 * Classification is advisory and never fails the observed work.
 */
public class QueryClassifier {

    public Classification classify(List<StatementRecord> records,
                                   List<PatternGroup> groups,
                                   double scopeSeconds,
                                   ThresholdConfig config) {
        Classification.ClassificationBuilder result = Classification.builder()
            .scopeSeconds(scopeSeconds);

        List<StatementRecord> slow = records.stream()
            .filter(r -> r.durationMs() > config.getSlowStatementMs())
            .sorted(Comparator.comparingDouble(StatementRecord::durationSeconds).reversed())
            .toList();
        result.slowStatements(!slow.isEmpty()).slowStatementRecords(slow);

        List<PatternGroup> suspected = groups.stream()
            .filter(g -> isNPlusOneSuspect(g, config))
            .toList();
        result.suspectedNPlusOne(!suspected.isEmpty()).suspectedGroups(suspected);

        result.slowScope(scopeSeconds * 1000.0 > config.getSlowScopeMs());

        return result.build();
    }

    public boolean isNPlusOneSuspect(PatternGroup group, ThresholdConfig config) {
        if (group.getCount() > config.getScopeStatementCountThreshold()) {
            return true;
        }
        return group.getCount() >= config.getMinGroupSizeForNPlusOne()
            && group.getAvgTimeMs() < config.getCheapStatementMs();
    }
}
