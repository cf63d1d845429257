package com.lookup.matching.lookup;

import com.lookup.matching.core.model.LookupResult;
import com.lookup.matching.core.model.MatchType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Results of a batch lookup, in input order, with timing figures.
 *
 * @param results one result per input
 * @param metrics aggregate timing and match-rate figures
 */
public record BatchLookupResult(List<LookupResult> results, BatchMetrics metrics) {

    public BatchLookupResult {
        results = results != null ? List.copyOf(results) : List.of();
    }

    /**
     * Aggregate figures for a batch.
     *
     * @param totalExecutionTime   wall time for the whole batch
     * @param averageExecutionTime wall time per input
     * @param matchRate            matched inputs / inputs, 0 for an empty batch
     * @param throughput           inputs per second, 0 when no time elapsed
     * @param matchTypeCounts      number of results per tier
     */
    public record BatchMetrics(
            Duration totalExecutionTime,
            Duration averageExecutionTime,
            double matchRate,
            double throughput,
            Map<MatchType, Integer> matchTypeCounts
    ) {
        public BatchMetrics {
            Map<MatchType, Integer> counts = new EnumMap<>(MatchType.class);
            for (MatchType type : MatchType.values()) {
                counts.put(type, 0);
            }
            if (matchTypeCounts != null) {
                counts.putAll(matchTypeCounts);
            }
            matchTypeCounts = Map.copyOf(counts);
        }

        public int count(MatchType type) {
            return matchTypeCounts.get(type);
        }
    }
}
