package io.surfworks.rangeforge.core.range.scaledint;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.range.RangeStore;
import io.surfworks.rangeforge.core.range.rules.RangeRule;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Linear operators (Conv, MatMul, BatchNormalization, Add).
 *
 * <p>When every input has integer info, the operator's real-valued rule is
 * rerun on the integer intervals. When only some do, the integer interval of
 * the first informative input is assumed to pass through. Either way scale
 * and bias follow from matching the real output interval against the integer
 * one; a stuck channel yields NaN for that channel.
 */
final class LinearIntegerRule implements ScaledIntegerRule {

    private static final Logger LOG = Logger.getLogger(LinearIntegerRule.class.getName());

    @Override
    public void apply(Node node, ScaledIntegerContext context) {
        List<String> inputs = node.inputs().stream().filter(in -> !in.isEmpty()).toList();
        boolean all = inputs.stream().allMatch(in -> context.info(in).hasIntegerInfo());
        Optional<RangeInfo> informative = firstWithIntegerInfo(node, context);
        if (informative.isEmpty()) {
            LOG.warning(node.name() + " has no integer info on inputs, cannot propagate");
            return;
        }

        Range intOut = all
            ? recomputeInIntegerDomain(node, inputs, context)
            : informative.get().intRange();

        String out = node.output(0);
        Range real = context.info(out).range();
        Tensor scale = real.max().subtract(real.min()).divide(intOut.max().subtract(intOut.min()));
        Tensor bias = real.max().subtract(scale.multiply(intOut.max()));
        context.attach(out, intOut, scale, bias);
    }

    private static Range recomputeInIntegerDomain(Node node, List<String> inputs, ScaledIntegerContext context) {
        RangeStore scratch = new RangeStore();
        for (String in : inputs) {
            RangeInfo info = context.info(in);
            if (!info.scale().allMatch(s -> s >= 0)) {
                throw new RangeAnalysisException("Need nonnegative scale for inputs of " + node.name()
                    + ", '" + in + "' has scale " + info.scale());
            }
            if (!info.bias().allMatch(b -> b == 0)) {
                throw new RangeAnalysisException("Need zero bias for inputs of " + node.name()
                    + ", '" + in + "' has bias " + info.bias());
            }
            if (!scratch.contains(in)) {
                scratch.define(in, new RangeInfo(info.intRange(), null, null, null, info.initializer()));
            }
        }
        RangeRule rule = context.rangeRules().ruleFor(node);
        RangeInfo computed = rule.apply(node, context.rangeContext(scratch)).get(node.output(0));
        if (computed == null) {
            throw new RangeAnalysisException("Integer-domain range of " + node.output(0) + " could not be computed");
        }
        return computed.range();
    }

    static Optional<RangeInfo> firstWithIntegerInfo(Node node, ScaledIntegerContext context) {
        for (String in : node.inputs()) {
            if (!in.isEmpty() && context.info(in).hasIntegerInfo()) {
                return Optional.of(context.info(in));
            }
        }
        return Optional.empty();
    }
}
