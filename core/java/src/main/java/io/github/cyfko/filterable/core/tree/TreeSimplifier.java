package io.github.cyfko.filterable.core.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a predicate tree into its flattest equivalent form.
 * <p>
 * The rewriting applies the boolean identities that hold for any connector:
 * </p>
 * <ul>
 *   <li>Identity: an empty nested group is removed</li>
 *   <li>Idempotence of grouping: a nested group with one child is replaced by that child</li>
 *   <li>Associativity: a nested group with the parent's connector is spliced into the parent</li>
 * </ul>
 * <p>
 * The root group is always kept, even when empty, and relation scopes are simplified as roots
 * of their own, so an empty scope still renders as an existence test.
 * </p>
 *
 * <pre>{@code
 * AND(AND(status IN ['a']), AND(age >= '18'), OR())
 * // → AND(status IN ['a'], age >= '18')
 * }</pre>
 *
 * <p>This class is designed to be used statically and cannot be instantiated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TreeSimplifier {

    private TreeSimplifier() {}

    /**
     * Simplifies a tree.
     *
     * @param root root group
     * @return equivalent group, never {@code null}
     */
    public static GroupNode simplify(GroupNode root) {
        return new GroupNode(root.connector(), simplifyChildren(root));
    }

    private static List<PredicateNode> simplifyChildren(GroupNode group) {
        List<PredicateNode> result = new ArrayList<>();
        for (PredicateNode child : group.children()) {
            PredicateNode simplified = simplifyNested(child);
            if (simplified == null) {
                continue;
            }
            if (simplified instanceof GroupNode nested && nested.connector() == group.connector()) {
                result.addAll(nested.children());
            } else {
                result.add(simplified);
            }
        }
        return result;
    }

    /**
     * @return the simplified node, {@code null} when it vanishes
     */
    private static PredicateNode simplifyNested(PredicateNode node) {
        if (node instanceof RelationNode relation) {
            return new RelationNode(relation.relationPath(), simplify(relation.scope()));
        }
        if (!(node instanceof GroupNode group)) {
            return node;
        }

        List<PredicateNode> children = simplifyChildren(group);
        if (children.isEmpty()) {
            return null;
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        return new GroupNode(group.connector(), children);
    }
}
