package com.errorengine.routing;

import com.errorengine.model.ActiveError;
import com.errorengine.model.ConditionLogic;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NoMatchAction;
import com.errorengine.model.RoutingCondition;
import com.errorengine.model.RoutingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides who is notified about an error.
 *
 * <p>Active rules are evaluated in ascending priority, ties broken by rule id. Every matching rule
 * adds its recipients; a matching rule flagged stop-on-match ends evaluation. When nothing matches,
 * the default recipients are used or the error is skipped, depending on the query.
 */
@Component
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private static final Comparator<RoutingRule> EVALUATION_ORDER = Comparator
            .comparingInt(RoutingRule::getPriority)
            .thenComparing(RoutingRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ConditionEvaluator conditionEvaluator;

    public RoutingEngine(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * Route an error of a query. With routing disabled every error goes to the query's plain
     * recipient list.
     *
     * @param error error to route
     * @param query owning query
     * @param rules the query's rules, in any order
     * @return decision
     */
    public RoutingDecision route(ActiveError error, MonitoredQuery query, List<RoutingRule> rules) {
        if (!query.isRoutingEnabled()) {
            List<String> recipients = cleanRecipients(query.getRecipients());
            return RoutingDecision.builder()
                    .recipients(recipients)
                    .firedRules(List.of())
                    .usedDefault(true)
                    .suppressed(recipients.isEmpty())
                    .build();
        }
        return route(error.getRow(), rules, query.getDefaultRecipients(), query.getNoMatchAction());
    }

    public RoutingDecision route(Map<String, Object> row, List<RoutingRule> rules,
                                 List<String> defaultRecipients, NoMatchAction noMatchAction) {
        Set<String> recipients = new LinkedHashSet<>();
        List<String> fired = new ArrayList<>();
        boolean stopped = false;

        for (RoutingRule rule : orderForEvaluation(rules)) {
            if (!ruleMatches(rule, row)) {
                continue;
            }
            fired.add(rule.getName());
            recipients.addAll(cleanRecipients(rule.getRecipients()));
            if (rule.isStopOnMatch()) {
                stopped = true;
                break;
            }
        }

        if (!fired.isEmpty()) {
            return RoutingDecision.builder()
                    .recipients(List.copyOf(recipients))
                    .firedRules(List.copyOf(fired))
                    .stopped(stopped)
                    .build();
        }

        if (noMatchAction == NoMatchAction.SKIP) {
            return RoutingDecision.builder()
                    .recipients(List.of())
                    .firedRules(List.of())
                    .suppressed(true)
                    .build();
        }
        return RoutingDecision.builder()
                .recipients(cleanRecipients(defaultRecipients))
                .firedRules(List.of())
                .usedDefault(true)
                .build();
    }

    /**
     * Evaluate a rule against a row. A rule without conditions matches everything.
     *
     * @param rule rule
     * @param row row
     * @return true if the rule matches
     */
    public boolean ruleMatches(RoutingRule rule, Map<String, Object> row) {
        List<RoutingCondition> conditions = rule.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        if (rule.getLogic() == ConditionLogic.OR) {
            return conditions.stream().anyMatch(c -> conditionEvaluator.matches(c, row));
        }
        return conditions.stream().allMatch(c -> conditionEvaluator.matches(c, row));
    }

    static List<RoutingRule> orderForEvaluation(List<RoutingRule> rules) {
        if (rules == null) {
            return List.of();
        }
        return rules.stream()
                .filter(RoutingRule::isActive)
                .sorted(EVALUATION_ORDER)
                .toList();
    }

    private static List<String> cleanRecipients(List<String> recipients) {
        if (recipients == null) {
            return List.of();
        }
        return recipients.stream()
                .filter(r -> r != null && !r.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }
}
