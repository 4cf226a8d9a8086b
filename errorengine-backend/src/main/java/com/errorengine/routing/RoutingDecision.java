package com.errorengine.routing;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Routing outcome for one error.
 */
@Value
@Builder
public class RoutingDecision {
    /** Recipients in the order rules contributed them, without duplicates. */
    List<String> recipients;
    /** Names of the rules that matched, in evaluation order. */
    List<String> firedRules;
    /** True when a stop-on-match rule ended evaluation. */
    boolean stopped;
    /** True when no rule matched and the default recipients were used. */
    boolean usedDefault;
    /** True when no rule matched and the query skips unmatched errors. */
    boolean suppressed;

    public boolean hasRecipients() {
        return !recipients.isEmpty();
    }
}
