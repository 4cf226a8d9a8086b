package com.errorengine.lifecycle;

import com.errorengine.config.ConfigurationException;
import com.errorengine.model.ActiveError;
import com.errorengine.model.KeySignature;
import com.errorengine.model.MonitoredQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the rows of one fetch into create/update/resolve transitions against the query's unresolved
 * errors. Pure computation: inputs are never modified and nothing is persisted here.
 */
@Component
public class ErrorLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ErrorLifecycleManager.class);

    /**
     * Diff fetched rows against currently unresolved errors.
     *
     * @param query owning query
     * @param rows fetched rows, in source order
     * @param unresolved unresolved errors of the query
     * @param now fetch time
     * @return lifecycle transitions
     * @throws KeyFieldMissingException when any row lacks a key field
     * @throws ConfigurationException when the query declares no key fields
     */
    public LifecycleDiff diff(MonitoredQuery query, List<Map<String, Object>> rows,
                              Collection<ActiveError> unresolved, Instant now) {
        List<String> keyFields = query.getKeyFields();
        if (keyFields == null || keyFields.isEmpty()) {
            throw new ConfigurationException("key_fields", "Query " + query.getName() + " declares no key fields");
        }

        // All signatures are computed before anything changes so a bad row rejects the whole fetch.
        Map<KeySignature, Map<String, Object>> present = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            KeySignature signature = KeySignatures.compute(row, keyFields);
            if (present.put(signature, new LinkedHashMap<>(row)) != null) {
                log.debug("Duplicate signature in fetch, last row wins: query_id={}, signature={}", query.getId(), signature);
            }
        }

        Map<KeySignature, ActiveError> known = new LinkedHashMap<>();
        for (ActiveError error : unresolved) {
            if (error.isResolved()) {
                continue;
            }
            ActiveError previous = known.putIfAbsent(error.getSignature(), error);
            if (previous != null) {
                log.warn("Multiple unresolved errors share a signature, keeping the first: query_id={}, signature={}, ignored_error_id={}",
                        query.getId(), error.getSignature(), error.getId());
            }
        }

        List<ActiveError> created = new ArrayList<>();
        List<ActiveError> continuing = new ArrayList<>();
        List<ActiveError> resolved = new ArrayList<>();

        for (Map.Entry<KeySignature, ActiveError> entry : known.entrySet()) {
            if (!present.containsKey(entry.getKey())) {
                ActiveError r = entry.getValue().copy();
                r.setResolved(true);
                r.setResolvedAt(r.getLastSeenAt() != null && r.getLastSeenAt().isAfter(now) ? r.getLastSeenAt() : now);
                resolved.add(r);
            }
        }

        for (Map.Entry<KeySignature, Map<String, Object>> entry : present.entrySet()) {
            ActiveError existing = known.get(entry.getKey());
            if (existing != null) {
                ActiveError updated = existing.copy();
                updated.setLastSeenAt(now);
                updated.setOccurrenceCount(existing.getOccurrenceCount() + 1);
                updated.setRow(entry.getValue());
                continuing.add(updated);
            } else {
                created.add(ActiveError.builder()
                        .queryId(query.getId())
                        .signature(entry.getKey())
                        .row(entry.getValue())
                        .firstSeenAt(now)
                        .lastSeenAt(now)
                        .occurrenceCount(1)
                        .build());
            }
        }

        log.debug("Lifecycle diff: query_id={}, rows={}, created={}, continuing={}, resolved={}",
                query.getId(), rows.size(), created.size(), continuing.size(), resolved.size());

        return LifecycleDiff.builder()
                .created(created)
                .continuing(continuing)
                .resolved(resolved)
                .rowsFetched(rows.size())
                .build();
    }
}
