package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.IntervalKernel;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Map;

/**
 * Dense layer: {@code Y = alpha * X * W^T + beta * B}.
 *
 * <p>Only the (transA=0, transB=1) layout is supported; transB defaults to 1
 * when the attribute is absent. Weights must be a constant 2-D matrix and the
 * optional bias a constant vector.
 */
public final class GemmRangeRule implements RangeRule {

    @Override
    public Map<String, RangeInfo> apply(Node node, RangeContext context) {
        double alpha = node.floatAttr("alpha", 1.0);
        double beta = node.floatAttr("beta", 1.0);
        long transA = node.intAttr("transA", 0);
        long transB = node.intAttr("transB", 1);
        if (transA != 0 || transB == 0) {
            throw new RangeAnalysisException("Unsupported Gemm layout in node " + node.name()
                + ": transA=" + transA + ", transB=" + transB + " (only transA=0, transB=1)");
        }

        Range input = context.rangeOf(node.input(0));
        Tensor weights = ConstantOperands.require(node, context, 1, "weights");
        ConstantOperands.requireRank(node, weights, "weights", 2);

        Range acc = IntervalKernel.matVec(weights, input.min(), input.max());
        // a negative alpha swaps the bounds
        Tensor lo = acc.min().multiply(alpha).minimum(acc.max().multiply(alpha));
        Tensor hi = acc.min().multiply(alpha).maximum(acc.max().multiply(alpha));

        if (!node.input(2).isEmpty()) {
            Tensor bias = ConstantOperands.require(node, context, 2, "bias");
            ConstantOperands.requireRank(node, bias, "bias", 1);
            Tensor shift = bias.multiply(beta);
            lo = lo.add(shift);
            hi = hi.add(shift);
        }
        return Map.of(node.output(0), RangeInfo.of(new Range(lo, hi)));
    }
}
