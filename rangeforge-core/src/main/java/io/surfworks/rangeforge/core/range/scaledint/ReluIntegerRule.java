package io.surfworks.rangeforge.core.range.scaledint;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * ReLU keeps scale and bias of its input; the output integer interval is the
 * real output interval mapped back through them.
 */
final class ReluIntegerRule implements ScaledIntegerRule {

    private static final Logger LOG = Logger.getLogger(ReluIntegerRule.class.getName());

    @Override
    public void apply(Node node, ScaledIntegerContext context) {
        Optional<RangeInfo> informative = LinearIntegerRule.firstWithIntegerInfo(node, context);
        if (informative.isEmpty()) {
            LOG.warning(node.name() + " has no integer info on inputs, cannot propagate");
            return;
        }
        Tensor scale = informative.get().scale();
        Tensor bias = informative.get().bias();
        String out = node.output(0);
        Range real = context.info(out).range();
        Tensor intMin = real.min().subtract(bias).divide(scale).rint();
        Tensor intMax = real.max().subtract(bias).divide(scale).rint();
        context.attach(out, new Range(intMin, intMax), scale, bias);
    }
}
