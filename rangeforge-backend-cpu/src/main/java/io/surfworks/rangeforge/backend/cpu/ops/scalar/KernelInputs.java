package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Arrays;
import java.util.List;

/**
 * Input validation shared by the kernels.
 */
final class KernelInputs {

    private KernelInputs() {}

    /**
     * Get a required input.
     */
    static Tensor require(Node node, List<Tensor> inputs, int index) {
        if (index >= inputs.size() || inputs.get(index) == null) {
            throw new IllegalArgumentException(
                node.opType() + " requires input " + index + " (node " + node.name() + ")");
        }
        return inputs.get(index);
    }

    /**
     * Get an optional input, or null when omitted.
     */
    static Tensor optional(List<Tensor> inputs, int index) {
        return index < inputs.size() ? inputs.get(index) : null;
    }

    static int[] toInts(Tensor tensor) {
        int[] values = new int[tensor.elementCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = (int) tensor.getFlat(i);
        }
        return values;
    }

    static int normalizeAxis(long axis, int rank) {
        int ax = (int) (axis < 0 ? axis + rank : axis);
        if (ax < 0 || ax >= Math.max(rank, 1)) {
            throw new IllegalArgumentException("Axis " + axis + " out of range for rank " + rank);
        }
        return ax;
    }

    /**
     * Shape a per-axis parameter so that it broadcasts along {@code axis} of a
     * rank-{@code rank} tensor. Single values become scalars.
     */
    static Tensor alongAxis(Tensor param, int rank, int axis) {
        if (param.elementCount() == 1) {
            return Tensor.scalar(param.getFlat(0));
        }
        if (param.rank() != 1 || rank <= 1) {
            return param;
        }
        int[] shape = new int[rank];
        Arrays.fill(shape, 1);
        shape[axis] = param.elementCount();
        return param.reshape(shape);
    }
}
