package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.range.RangeStore;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Arrays;

/**
 * Access to operands that must be constant, such as weights and biases.
 */
final class ConstantOperands {

    private ConstantOperands() {}

    /**
     * Value of a constant operand read from the store.
     *
     * @param role Operand role used in messages, e.g. "weights"
     * @throws RangeAnalysisException if the operand is not a constant
     */
    static Tensor require(Node node, RangeContext context, int inputIndex, String role) {
        String tensorName = node.input(inputIndex);
        RangeInfo info = context.store().get(tensorName).orElse(null);
        if (info == null || !info.initializer()) {
            throw new RangeAnalysisException(
                "Non-constant " + node.opType() + " " + role + " '" + tensorName + "' in node " + node.name());
        }
        if (!info.range().isDegenerate()) {
            throw new RangeAnalysisException(
                "Non-constant " + node.opType() + " " + role + " in range info of node " + node.name());
        }
        return info.range().min();
    }

    static void requireRank(Node node, Tensor value, String role, int rank) {
        if (value.rank() != rank) {
            throw new RangeAnalysisException("Malformed " + node.opType() + " " + role + " in node " + node.name()
                + ": expected rank " + rank + ", got shape " + Arrays.toString(value.shape()));
        }
    }

    static void requireMinRank(Node node, Tensor value, String role, int minRank) {
        if (value.rank() < minRank) {
            throw new RangeAnalysisException("Malformed " + node.opType() + " " + role + " in node " + node.name()
                + ": expected rank >= " + minRank + ", got shape " + Arrays.toString(value.shape()));
        }
    }

    /**
     * Value of a constant input, preferring the store so that integer-domain
     * stores substitute their own constants.
     */
    static Tensor valueOf(RangeContext context, String tensorName) {
        RangeStore store = context.store();
        RangeInfo info = store.get(tensorName).orElse(null);
        if (info != null && info.initializer()) {
            return info.range().min();
        }
        Tensor init = context.graph().initializer(tensorName);
        if (init == null) {
            throw new RangeAnalysisException("No constant value for tensor '" + tensorName + "'");
        }
        return init;
    }
}
