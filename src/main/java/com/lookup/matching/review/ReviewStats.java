package com.lookup.matching.review;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Review progress figures, derived from the matches of a session.
 * {@code accepted + rejected + manual + pending == totalMatches} always holds.
 *
 * @param totalMatches           matches in the session
 * @param accepted               matches accepted
 * @param rejected               matches rejected
 * @param manual                 matches given a manual value
 * @param pending                matches awaiting a decision
 * @param progress               decided share as a rounded percentage, 0 for an empty session
 * @param confidenceDistribution match count per confidence bucket, every bucket present
 */
public record ReviewStats(
        int totalMatches,
        int accepted,
        int rejected,
        int manual,
        int pending,
        int progress,
        Map<ConfidenceBucket, Integer> confidenceDistribution
) {
    public ReviewStats {
        confidenceDistribution = Map.copyOf(confidenceDistribution);
    }

    public static ReviewStats of(Collection<FuzzyMatchForReview> matches) {
        int accepted = 0;
        int rejected = 0;
        int manual = 0;
        int pending = 0;
        Map<ConfidenceBucket, Integer> distribution = new EnumMap<>(ConfidenceBucket.class);
        for (ConfidenceBucket bucket : ConfidenceBucket.values()) {
            distribution.put(bucket, 0);
        }

        for (FuzzyMatchForReview match : matches) {
            switch (match.getStatus()) {
                case ACCEPTED -> accepted++;
                case REJECTED -> rejected++;
                case MANUAL -> manual++;
                case PENDING -> pending++;
            }
            distribution.merge(ConfidenceBucket.forConfidence(match.getConfidence()), 1, Integer::sum);
        }

        int total = matches.size();
        int progress = total > 0 ? (int) Math.round((total - pending) * 100.0 / total) : 0;
        return new ReviewStats(total, accepted, rejected, manual, pending, progress, distribution);
    }

    public int decided() {
        return accepted + rejected + manual;
    }

    public int count(ConfidenceBucket bucket) {
        return confidenceDistribution.getOrDefault(bucket, 0);
    }
}
