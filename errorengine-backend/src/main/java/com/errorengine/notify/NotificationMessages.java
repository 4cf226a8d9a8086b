package com.errorengine.notify;

import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationKind;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Text rendering shared by the transports.
 */
final class NotificationMessages {

    private NotificationMessages() {
    }

    static String subject(String prefix, NotificationKind kind, MonitoredQuery query, int errorCount) {
        String what = kind == NotificationKind.REMINDER ? "[REMINDER] Still open" : "New errors";
        return prefix + " " + what + ": " + query.getName() + " (" + errorCount + ")";
    }

    /**
     * One-line preview of a row built from its first two fields.
     *
     * @param row row
     * @param maxLength preview length limit, longer previews end with "..."
     * @return preview
     */
    static String preview(Map<String, Object> row, int maxLength) {
        String preview = row.entrySet().stream()
                .limit(2)
                .map(e -> e.getKey() + ": " + (e.getValue() != null ? e.getValue() : ""))
                .collect(Collectors.joining(" | "));
        if (preview.length() > maxLength) {
            return preview.substring(0, maxLength - 3) + "...";
        }
        return preview;
    }

    static String plainBody(NotificationKind kind, MonitoredQuery query, List<ErrorContext> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append(kind == NotificationKind.REMINDER ? "Errors still open for " : "New errors for ")
                .append(query.getName()).append(": ").append(errors.size()).append('\n');
        for (ErrorContext e : errors) {
            sb.append("- ").append(e.getSignature())
                    .append(" (first seen ").append(e.getFirstSeenAt())
                    .append(", occurrences ").append(e.getOccurrenceCount()).append(")\n");
            e.getRow().forEach((k, v) -> sb.append("    ").append(k).append(" = ").append(v).append('\n'));
        }
        return sb.toString();
    }
}
