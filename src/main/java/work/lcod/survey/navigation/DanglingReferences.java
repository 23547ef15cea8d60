package work.lcod.survey.navigation;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import work.lcod.survey.model.NavigationRule;
import work.lcod.survey.tree.DocumentTree;

/**
 * Finds and optionally prunes navigation rules whose target was deleted.
 */
public final class DanglingReferences {
    private DanglingReferences() {}

    public static List<DanglingReference> find(DocumentTree tree) {
        var result = new ArrayList<DanglingReference>();
        for (var node : tree.walk()) {
            var rules = node.navigationRules();
            for (int i = 0; i < rules.size(); i++) {
                var rule = rules.get(i);
                if (isDangling(tree, rule)) {
                    result.add(new DanglingReference(node.id(), i, rule.target()));
                }
            }
        }
        return result;
    }

    public static boolean isDangling(DocumentTree tree, NavigationRule rule) {
        return !rule.isSubmit() && !tree.contains(rule.target());
    }

    /**
     * Drops every dangling rule. Returns {@code tree} itself when there is nothing to prune.
     */
    public static DocumentTree prune(DocumentTree tree, Logger log) {
        var result = tree;
        for (var node : tree.walk()) {
            var kept = new ArrayList<NavigationRule>();
            for (var rule : node.navigationRules()) {
                if (isDangling(tree, rule)) {
                    log.info("Pruning rule on {} targeting missing node {}", node.id(), rule.target());
                } else {
                    kept.add(rule);
                }
            }
            if (kept.size() != node.navigationRules().size()) {
                result = result.replaceNode(node.withNavigationRules(kept));
            }
        }
        return result;
    }
}
