package work.lcod.survey.navigation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.condition.ConditionEvaluator;
import work.lcod.survey.model.NavigationRule;
import work.lcod.survey.tree.DocumentTree;

/**
 * First-match resolution of navigation rules. Rule order is authoritative: default rules only
 * win because their condition always holds, so callers keep them last.
 */
public final class NavigationEngine {
    private final ConditionEvaluator conditions;
    private final DanglingTargetPolicy danglingPolicy;
    private final Logger log;

    public NavigationEngine() {
        this(new ConditionEvaluator(), DanglingTargetPolicy.SKIP, LoggerFactory.getLogger(NavigationEngine.class));
    }

    public NavigationEngine(ConditionEvaluator conditions, DanglingTargetPolicy danglingPolicy, Logger log) {
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.danglingPolicy = Objects.requireNonNull(danglingPolicy, "danglingPolicy");
        this.log = Objects.requireNonNull(log, "log");
    }

    public DanglingTargetPolicy danglingPolicy() {
        return danglingPolicy;
    }

    /** Returns the first rule whose condition holds. Targets are not checked. */
    public NavigationResult resolveNext(List<NavigationRule> rules, Map<String, ?> context) {
        return scan(null, rules, context);
    }

    /** Same as {@link #resolveNext(List, Map)}, applying the dangling-target policy against {@code tree}. */
    public NavigationResult resolveNext(DocumentTree tree, List<NavigationRule> rules, Map<String, ?> context) {
        return scan(Objects.requireNonNull(tree, "tree"), rules, context);
    }

    /** Resolves the rules carried by the node {@code nodeId}; unknown ids never match. */
    public NavigationResult resolveNext(DocumentTree tree, String nodeId, Map<String, ?> context) {
        return tree.find(nodeId)
            .map(node -> resolveNext(tree, node.navigationRules(), context))
            .orElseGet(NavigationResult::noMatch);
    }

    private NavigationResult scan(DocumentTree tree, List<NavigationRule> rules, Map<String, ?> context) {
        if (rules == null || rules.isEmpty()) {
            return NavigationResult.noMatch();
        }
        for (int i = 0; i < rules.size(); i++) {
            var rule = rules.get(i);
            if (!holds(rule, context)) {
                continue;
            }
            if (tree != null && danglingPolicy == DanglingTargetPolicy.SKIP && DanglingReferences.isDangling(tree, rule)) {
                log.warn("Navigation rule {} targets missing node {}; skipping", i, rule.target());
                continue;
            }
            log.debug("Navigation rule {} matched ({} -> {})", i, rule.condition(), rule.target());
            return NavigationResult.matched(rule.target(), rule.pageTarget(), rule.isSubmit(), i);
        }
        return NavigationResult.noMatch();
    }

    private boolean holds(NavigationRule rule, Map<String, ?> context) {
        if (rule.isDefault()) {
            return true;
        }
        try {
            return conditions.evaluate(rule.expression(), context);
        } catch (RuntimeException ex) {
            log.warn("Navigation condition '{}' failed: {}", rule.condition(), ex.getMessage());
            return false;
        }
    }
}
