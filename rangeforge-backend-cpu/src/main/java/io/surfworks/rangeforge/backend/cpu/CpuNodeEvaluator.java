package io.surfworks.rangeforge.backend.cpu;

import io.surfworks.rangeforge.backend.cpu.ops.OpDispatcher;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.graph.NodeEvaluator;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;
import java.util.logging.Logger;

/**
 * Reference {@link NodeEvaluator} running each operator with a scalar CPU kernel.
 */
public final class CpuNodeEvaluator implements NodeEvaluator {

    private static final Logger LOG = Logger.getLogger(CpuNodeEvaluator.class.getName());

    private final OpDispatcher dispatcher;

    public CpuNodeEvaluator() {
        this(new OpDispatcher());
    }

    public CpuNodeEvaluator(OpDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public List<Tensor> evaluate(Node node, List<Tensor> inputs) {
        List<Tensor> outputs = dispatcher.dispatch(node, inputs);
        if (outputs.size() != node.outputCount()) {
            throw new IllegalStateException("Kernel for " + node.opType() + " produced " + outputs.size()
                + " outputs, node " + node.name() + " declares " + node.outputCount());
        }
        LOG.finest(() -> "Evaluated " + node.name());
        return outputs;
    }

    @Override
    public boolean supports(Node node) {
        return dispatcher.supports(node);
    }

    public OpDispatcher dispatcher() {
        return dispatcher;
    }
}
