package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.RangeInfo;

import java.util.Map;

/**
 * Computes the output ranges of one operator kind from its input ranges.
 *
 * <p>Rules are pure: they read the store held by the context and return the
 * new range info keyed by output name instead of writing it. An output left
 * out of the result stays unresolved.
 */
public interface RangeRule {

    /**
     * Compute output range info.
     *
     * @throws io.surfworks.rangeforge.core.range.RangeAnalysisException if the
     *         node violates the rule's preconditions
     */
    Map<String, RangeInfo> apply(Node node, RangeContext context);

    /**
     * Check if this rule can handle the given node.
     */
    default boolean supports(Node node) {
        return true;
    }
}
