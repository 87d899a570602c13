package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Map;

/**
 * Convolution without bias, treated as a matrix-vector product per output channel.
 *
 * <p>Weights of shape (OFM, IFM, k...) are flattened to (OFM, IFM * K). Dense
 * ({@code group == 1}) and fully depthwise ({@code group == OFM}) convolutions
 * are supported; in the depthwise case each output channel only sees the
 * input bounds of its own channel.
 */
public final class ConvRangeRule implements RangeRule {

    @Override
    public Map<String, RangeInfo> apply(Node node, RangeContext context) {
        if (!node.input(2).isEmpty()) {
            throw new RangeAnalysisException("Found unsupported Conv with bias in node " + node.name());
        }
        Range input = context.rangeOf(node.input(0));
        Tensor weights = ConstantOperands.require(node, context, 1, "weights");
        ConstantOperands.requireMinRank(node, weights, "weights", 2);

        int ofm = weights.shape()[0];
        int ifm = weights.shape()[1];
        Tensor flat = weights.reshape(ofm, -1);
        int kernelVolume = flat.shape()[1] / ifm;

        long groups = node.intAttr("group", 1);
        boolean depthwise = groups > 1;
        if (depthwise && groups != ofm) {
            throw new RangeAnalysisException("Unsupported grouped Conv in node " + node.name()
                + ": group=" + groups + " is neither 1 nor the output channel count " + ofm);
        }

        Tensor min = ChannelwiseAccumulator.replicate(input.min(), kernelVolume);
        Tensor max = ChannelwiseAccumulator.replicate(input.max(), kernelVolume);
        Range out = ChannelwiseAccumulator.evaluate(flat, min, max, depthwise ? kernelVolume : 0);
        return Map.of(node.output(0), RangeInfo.of(out));
    }
}
