package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Sampling rule for operators without a closed-form interval transform.
 *
 * <p>Every combination of all-minimum and all-maximum prototypes of the
 * dynamic inputs is evaluated, and the per-channel extremes of each output are
 * tracked. This is exact for operators monotonic in each input and an
 * approximation otherwise. A node with no dynamic inputs is evaluated once and
 * its outputs are recorded as constants.
 */
public final class MonotonicRangeRule implements RangeRule {

    private static final Logger LOG = Logger.getLogger(MonotonicRangeRule.class.getName());

    @Override
    public Map<String, RangeInfo> apply(Node node, RangeContext context) {
        Graph graph = context.graph();
        List<String> dynamic = new ArrayList<>(new LinkedHashSet<>(
            node.inputs().stream().filter(in -> !in.isEmpty() && !isConstant(context, in)).toList()));

        List<Tensor> inputs = new ArrayList<>(node.inputCount());
        for (String in : node.inputs()) {
            inputs.add(in.isEmpty() || !isConstant(context, in) ? null : ConstantOperands.valueOf(context, in));
        }

        Map<String, RangeInfo> result = new LinkedHashMap<>();
        if (dynamic.isEmpty()) {
            List<Tensor> outputs = context.evaluator().evaluate(node, inputs);
            for (int i = 0; i < node.outputCount(); i++) {
                result.put(node.output(i), RangeInfo.evaluatedConstant(outputs.get(i)));
            }
            return result;
        }

        List<PrototypeTensors> prototypes = new ArrayList<>(dynamic.size());
        for (String in : dynamic) {
            int[] shape = graph.shapeOf(in).orElseThrow(() -> new RangeAnalysisException(
                "Missing shape for tensor '" + in + "', run shape inference first"));
            prototypes.add(PrototypeTensors.of(context.rangeOf(in), shape, context.channelAxis()));
        }

        int combinations = 1 << dynamic.size();
        LOG.fine(() -> "Sampling " + node.name() + " over " + combinations + " prototype combinations");
        Tensor[] runningMin = new Tensor[node.outputCount()];
        Tensor[] runningMax = new Tensor[node.outputCount()];
        for (int combo = 0; combo < combinations; combo++) {
            for (int j = 0; j < dynamic.size(); j++) {
                PrototypeTensors proto = prototypes.get(j);
                Tensor value = ((combo >> j) & 1) == 1 ? proto.max() : proto.min();
                String name = dynamic.get(j);
                for (int pos = 0; pos < node.inputCount(); pos++) {
                    if (name.equals(node.input(pos))) {
                        inputs.set(pos, value);
                    }
                }
            }
            List<Tensor> outputs = context.evaluator().evaluate(node, inputs);
            for (int o = 0; o < node.outputCount(); o++) {
                Tensor out = outputs.get(o);
                Tensor chMin;
                Tensor chMax;
                if (out.rank() > 1) {
                    chMin = out.reduceMinExcept(context.channelAxis());
                    chMax = out.reduceMaxExcept(context.channelAxis());
                } else {
                    chMin = out.flatten();
                    chMax = chMin;
                }
                runningMin[o] = runningMin[o] == null ? chMin : runningMin[o].minimum(chMin);
                runningMax[o] = runningMax[o] == null ? chMax : runningMax[o].maximum(chMax);
            }
        }

        for (int o = 0; o < node.outputCount(); o++) {
            result.put(node.output(o), RangeInfo.of(new Range(runningMin[o], runningMax[o])));
        }
        return result;
    }

    /**
     * Graph initializers and tensors already resolved to constants, such as
     * the outputs of all-constant nodes.
     */
    private static boolean isConstant(RangeContext context, String tensorName) {
        if (context.graph().isInitializer(tensorName)) {
            return true;
        }
        return context.store().get(tensorName).map(RangeInfo::initializer).orElse(false);
    }
}
