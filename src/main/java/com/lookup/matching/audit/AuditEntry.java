package com.lookup.matching.audit;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of a review decision.
 */
public record AuditEntry(
        String id,
        AuditAction action,
        List<String> matchIds,
        String value,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        matchIds = matchIds != null ? List.copyOf(matchIds) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private List<String> matchIds;
        private String value;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder matchIds(List<String> matchIds) {
            this.matchIds = matchIds;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, matchIds, value, timestamp);
        }
    }
}
