package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Map;

/**
 * Ungrouped transposed convolution without bias. Weights of shape
 * (IFM, OFM, k...) are swapped to (OFM, IFM, k...) and flattened.
 */
public final class ConvTransposeRangeRule implements RangeRule {

    @Override
    public Map<String, RangeInfo> apply(Node node, RangeContext context) {
        if (!node.input(2).isEmpty()) {
            throw new RangeAnalysisException("Found unsupported ConvTranspose with bias in node " + node.name());
        }
        long groups = node.intAttr("group", 1);
        if (groups != 1) {
            throw new RangeAnalysisException("Only dense (non-grouped) ConvTranspose is supported, node "
                + node.name() + " has group=" + groups);
        }
        Range input = context.rangeOf(node.input(0));
        Tensor weights = ConstantOperands.require(node, context, 1, "weights");
        ConstantOperands.requireMinRank(node, weights, "weights", 2);

        int ifm = weights.shape()[0];
        int ofm = weights.shape()[1];
        Tensor flat = weights.moveAxis(1, 0).reshape(ofm, -1);
        int kernelVolume = flat.shape()[1] / ifm;

        Tensor min = ChannelwiseAccumulator.replicate(input.min(), kernelVolume);
        Tensor max = ChannelwiseAccumulator.replicate(input.max(), kernelVolume);
        return Map.of(node.output(0), RangeInfo.of(ChannelwiseAccumulator.evaluate(flat, min, max, 0)));
    }
}
