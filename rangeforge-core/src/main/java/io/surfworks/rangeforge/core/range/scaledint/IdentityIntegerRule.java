package io.surfworks.rangeforge.core.range.scaledint;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;

import java.util.logging.Logger;

/**
 * Operators that move values without changing them (Pad, MaxPool, Reshape):
 * integer info passes through from the single dynamic input.
 */
final class IdentityIntegerRule implements ScaledIntegerRule {

    private static final Logger LOG = Logger.getLogger(IdentityIntegerRule.class.getName());

    @Override
    public void apply(Node node, ScaledIntegerContext context) {
        long dynamic = node.inputs().stream().filter(context.graph()::isDynamic).count();
        if (dynamic != 1) {
            throw new RangeAnalysisException("Identity int range prop needs a single dynamic input, node "
                + node.name() + " has " + dynamic);
        }
        RangeInfo in = context.info(node.input(0));
        if (!in.hasIntegerInfo()) {
            LOG.warning(node.name() + " has no integer info on inputs, cannot propagate");
            return;
        }
        for (String out : node.outputs()) {
            context.attach(out, in.intRange(), in.scale(), in.bias());
        }
    }
}
