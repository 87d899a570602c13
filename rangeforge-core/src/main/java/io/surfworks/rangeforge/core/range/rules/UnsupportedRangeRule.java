package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;

import java.util.Map;

/**
 * Rule for operator kinds without range support. The walker skips such nodes.
 */
public final class UnsupportedRangeRule implements RangeRule {

    public static final UnsupportedRangeRule INSTANCE = new UnsupportedRangeRule();

    private UnsupportedRangeRule() {}

    @Override
    public boolean supports(Node node) {
        return false;
    }

    @Override
    public Map<String, RangeInfo> apply(Node node, RangeContext context) {
        throw new RangeAnalysisException("No range rule for " + node.opType() + " (node " + node.name() + ")");
    }
}
