package com.lookup.matching.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lookup.matching.review.ReviewEvent;
import com.lookup.matching.review.ReviewEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only audit trail of review decisions.
 * Register it as a session's {@link ReviewEventListener} to record every decision.
 */
public class AuditService implements ReviewEventListener {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries;
    private final ObjectMapper objectMapper;

    public AuditService() {
        this(new ObjectMapper());
    }

    public AuditService(ObjectMapper objectMapper) {
        this.entries = new CopyOnWriteArrayList<>();
        this.objectMapper = objectMapper;
    }

    @Override
    public void onReviewEvent(ReviewEvent event) {
        record(AuditEntry.builder()
                .action(AuditAction.from(event.kind()))
                .matchIds(event.matchIds())
                .value(event.value())
                .timestamp(event.timestamp())
                .build());
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} for {} matches", entry.action(), entry.matchIds().size());
        return entry;
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    /**
     * Gets audit entries that touched a match, single and batch decisions alike.
     */
    public List<AuditEntry> getEntriesForMatch(String matchId) {
        return entries.stream()
                .filter(e -> e.matchIds().contains(matchId))
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Renders all entries as a JSON array, oldest first.
     * Returns {@code "[]"} if serialization fails.
     */
    public String exportJson() {
        List<Map<String, Object>> rows = new ArrayList<>(entries.size());
        for (AuditEntry entry : entries) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", entry.id());
            row.put("action", entry.action().name());
            row.put("matchIds", entry.matchIds());
            row.put("value", entry.value());
            row.put("timestamp", entry.timestamp().toString());
            rows.add(row);
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            log.warn("Failed to export audit entries: {}", e.getMessage());
            return "[]";
        }
    }
}
