package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.IntervalKernel;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Map;

/**
 * {@code Y = X * W} with a constant (K, N) weight matrix.
 */
public final class MatMulRangeRule implements RangeRule {

    @Override
    public Map<String, RangeInfo> apply(Node node, RangeContext context) {
        Range input = context.rangeOf(node.input(0));
        Tensor weights = ConstantOperands.require(node, context, 1, "weights");
        ConstantOperands.requireRank(node, weights, "weights", 2);
        // kernel expects (out, in)
        Range acc = IntervalKernel.matVec(weights.transpose(1, 0), input.min(), input.max());
        return Map.of(node.output(0), RangeInfo.of(acc));
    }
}
