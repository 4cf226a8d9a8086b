package com.errorengine.routing;

import com.errorengine.model.ActiveError;
import com.errorengine.model.ConditionLogic;
import com.errorengine.model.ConditionOperator;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NoMatchAction;
import com.errorengine.model.RoutingRule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.errorengine.routing.ConditionEvaluatorTest.condition;
import static com.errorengine.routing.ConditionEvaluatorTest.row;
import static org.assertj.core.api.Assertions.assertThat;

class RoutingEngineTest {

    private final RoutingEngine engine = new RoutingEngine(new ConditionEvaluator());

    @Test
    void stopOnMatchRuleSkipsDefaults() {
        RoutingRule eu = rule(1L, "EU", 1, true, "eu-team@x.com")
                .conditions(List.of(condition("WAREHOUSE", ConditionOperator.CONTAINS, "EU")))
                .build();
        RoutingRule catchAll = rule(2L, "All", 5, false, "ops@x.com").build();

        RoutingDecision decision = engine.route(row("WAREHOUSE", "EU-NORTH"), List.of(catchAll, eu),
                List.of("support@x.com"), NoMatchAction.SEND_DEFAULT);

        assertThat(decision.getRecipients()).containsExactly("eu-team@x.com");
        assertThat(decision.getFiredRules()).containsExactly("EU");
        assertThat(decision.isStopped()).isTrue();
        assertThat(decision.isUsedDefault()).isFalse();
    }

    @Test
    void matchingRulesAccumulateRecipientsInPriorityOrder() {
        RoutingRule a = rule(1L, "A", 10, false, "a@x.com", "shared@x.com").build();
        RoutingRule b = rule(2L, "B", 1, false, "b@x.com", "shared@x.com").build();

        RoutingDecision decision = engine.route(row("K", "v"), List.of(a, b), List.of(), NoMatchAction.SKIP);

        assertThat(decision.getRecipients()).containsExactly("b@x.com", "shared@x.com", "a@x.com");
        assertThat(decision.getFiredRules()).containsExactly("B", "A");
    }

    @Test
    void noMatchUsesDefaultsOrSuppresses() {
        RoutingRule never = rule(1L, "Never", 1, false, "n@x.com")
                .conditions(List.of(condition("WAREHOUSE", ConditionOperator.EQUALS, "ZZ")))
                .build();

        RoutingDecision sendDefault = engine.route(row("WAREHOUSE", "EU"), List.of(never), List.of("support@x.com"),
                NoMatchAction.SEND_DEFAULT);
        RoutingDecision skip = engine.route(row("WAREHOUSE", "EU"), List.of(never), List.of("support@x.com"),
                NoMatchAction.SKIP);

        assertThat(sendDefault.getRecipients()).containsExactly("support@x.com");
        assertThat(sendDefault.isUsedDefault()).isTrue();
        assertThat(skip.isSuppressed()).isTrue();
        assertThat(skip.hasRecipients()).isFalse();
    }

    @Test
    void orLogicNeedsOneCondition() {
        RoutingRule or = rule(1L, "Either", 1, false, "x@x.com")
                .logic(ConditionLogic.OR)
                .conditions(List.of(
                        condition("WAREHOUSE", ConditionOperator.EQUALS, "MI"),
                        condition("PRIORITY", ConditionOperator.GTE, "5")))
                .build();
        RoutingRule and = or.toBuilder().logic(ConditionLogic.AND).build();
        Map<String, Object> row = row("WAREHOUSE", "TO");
        row.put("PRIORITY", 7);

        assertThat(engine.ruleMatches(or, row)).isTrue();
        assertThat(engine.ruleMatches(and, row)).isFalse();
    }

    @Test
    void inactiveRulesAreIgnored() {
        RoutingRule inactive = rule(1L, "Off", 1, true, "off@x.com").active(false).build();

        RoutingDecision decision = engine.route(row("K", "v"), List.of(inactive), List.of("d@x.com"), NoMatchAction.SEND_DEFAULT);

        assertThat(decision.getRecipients()).containsExactly("d@x.com");
    }

    @Test
    void sameInputGivesSameDecisionWhateverTheRuleListOrder() {
        List<RoutingRule> rules = new ArrayList<>(List.of(
                rule(3L, "C", 2, false, "c@x.com").build(),
                rule(1L, "A", 2, true, "a@x.com").build(),
                rule(2L, "B", 2, false, "b@x.com").build()));

        RoutingDecision first = engine.route(row("K", "v"), rules, List.of(), NoMatchAction.SKIP);
        Collections.reverse(rules);
        RoutingDecision second = engine.route(row("K", "v"), rules, List.of(), NoMatchAction.SKIP);

        assertThat(first.getRecipients()).containsExactly("a@x.com");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void routingDisabledUsesPlainRecipients() {
        MonitoredQuery query = MonitoredQuery.builder()
                .routingEnabled(false)
                .recipients(List.of("plain@x.com"))
                .build();
        ActiveError error = ActiveError.builder().row(row("K", "v")).build();

        RoutingDecision decision = engine.route(error, query, List.of(rule(1L, "Ignored", 1, false, "r@x.com").build()));

        assertThat(decision.getRecipients()).containsExactly("plain@x.com");
        assertThat(decision.isSuppressed()).isFalse();
    }

    private static RoutingRule.RoutingRuleBuilder rule(Long id, String name, int priority, boolean stop, String... recipients) {
        return RoutingRule.builder()
                .id(id)
                .name(name)
                .priority(priority)
                .stopOnMatch(stop)
                .recipients(List.of(recipients));
    }
}
