package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Arrays;

/**
 * Builds the all-minimum and all-maximum tensors that the sampling rule feeds
 * to the node evaluator.
 *
 * @param min Tensor holding the lower bound at every position
 * @param max Tensor holding the upper bound at every position
 */
public record PrototypeTensors(Tensor min, Tensor max) {

    /**
     * Expand a range to full-shaped prototypes.
     *
     * <p>A single-valued bound fills the whole tensor; a bound already of the
     * tensor's shape is used as is; a vector as long as the channel axis is
     * filled along that axis.
     *
     * @throws RangeAnalysisException for any other bound shape
     */
    public static PrototypeTensors of(Range range, int[] shape, int channelAxis) {
        return new PrototypeTensors(
            expand(range.min(), shape, channelAxis),
            expand(range.max(), shape, channelAxis));
    }

    static Tensor expand(Tensor bound, int[] shape, int channelAxis) {
        if (bound.elementCount() == 1) {
            return Tensor.full(bound.getFlat(0), shape);
        }
        if (Arrays.equals(bound.shape(), shape)) {
            return bound;
        }
        int axis = channelAxis < 0 ? channelAxis + shape.length : channelAxis;
        if (bound.rank() == 1 && axis >= 0 && axis < shape.length && bound.elementCount() == shape[axis]) {
            int[] channelShape = new int[shape.length];
            Arrays.fill(channelShape, 1);
            channelShape[axis] = shape[axis];
            return bound.reshape(channelShape).broadcastTo(shape);
        }
        throw new RangeAnalysisException("Unrecognized interval representation: bound of shape "
            + Arrays.toString(bound.shape()) + " for tensor of shape " + Arrays.toString(shape)
            + " (channel axis " + channelAxis + ")");
    }
}
