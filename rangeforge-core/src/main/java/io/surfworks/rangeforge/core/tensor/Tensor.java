package io.surfworks.rangeforge.core.tensor;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;

/**
 * An immutable multi-dimensional tensor of doubles in row-major order.
 *
 * <p>Rank 0 tensors are scalars. All operations return new tensors; the
 * backing array is never exposed.
 */
public final class Tensor {

    private final TensorSpec spec;
    private final double[] data;

    private Tensor(TensorSpec spec, double[] data) {
        this.spec = spec;
        this.data = data;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a tensor from a double array (1D or flattened).
     */
    public static Tensor of(double[] data, int... shape) {
        TensorSpec spec = TensorSpec.of(shape);
        if (data.length != spec.elementCount()) {
            throw new IllegalArgumentException(
                "Data length " + data.length + " doesn't match shape " + Arrays.toString(shape) +
                " (expected " + spec.elementCount() + " elements)");
        }
        return new Tensor(spec, data.clone());
    }

    /**
     * Create a rank-0 tensor.
     */
    public static Tensor scalar(double value) {
        return new Tensor(TensorSpec.of(), new double[]{value});
    }

    /**
     * Create a rank-1 tensor from the given values.
     */
    public static Tensor vector(double... values) {
        return new Tensor(TensorSpec.of(values.length), values.clone());
    }

    /**
     * Create a tensor filled with a constant value.
     */
    public static Tensor full(double value, int... shape) {
        TensorSpec spec = TensorSpec.of(shape);
        double[] data = new double[spec.elementCount()];
        Arrays.fill(data, value);
        return new Tensor(spec, data);
    }

    /**
     * Create a zero-initialized tensor with the given shape.
     */
    public static Tensor zeros(int... shape) {
        return full(0.0, shape);
    }

    // ==================== Accessors ====================

    public TensorSpec spec() {
        return spec;
    }

    public int[] shape() {
        return spec.shape().clone();
    }

    public int rank() {
        return spec.rank();
    }

    public int elementCount() {
        return data.length;
    }

    public boolean isScalar() {
        return spec.rank() == 0;
    }

    /**
     * Get element at multi-dimensional indices.
     */
    public double get(int... indices) {
        return data[spec.flatIndex(indices)];
    }

    /**
     * Get element at flat index.
     */
    public double getFlat(int index) {
        return data[index];
    }

    /**
     * The single value of a one-element tensor.
     */
    public double item() {
        if (data.length != 1) {
            throw new IllegalStateException("item() requires exactly one element, tensor has " + data.length);
        }
        return data[0];
    }

    /**
     * Copy tensor data to a double array.
     */
    public double[] toDoubleArray() {
        return data.clone();
    }

    // ==================== Shape Manipulation ====================

    /**
     * Create a tensor with a new shape (must have same element count).
     * A single {@code -1} dimension is inferred.
     */
    public Tensor reshape(int... newShape) {
        int[] resolved = newShape.clone();
        int inferred = -1;
        int known = 1;
        for (int i = 0; i < resolved.length; i++) {
            if (resolved[i] == -1) {
                if (inferred >= 0) {
                    throw new IllegalArgumentException("Only one dimension can be inferred: " + Arrays.toString(newShape));
                }
                inferred = i;
            } else {
                known *= resolved[i];
            }
        }
        if (inferred >= 0) {
            if (known == 0 || data.length % known != 0) {
                throw new IllegalArgumentException(
                    "Cannot reshape " + data.length + " elements to " + Arrays.toString(newShape));
            }
            resolved[inferred] = data.length / known;
        }
        TensorSpec newSpec = TensorSpec.of(resolved);
        if (newSpec.elementCount() != data.length) {
            throw new IllegalArgumentException(
                "Cannot reshape from " + data.length + " to " + newSpec.elementCount() + " elements");
        }
        return new Tensor(newSpec, data);
    }

    /**
     * Flatten to rank 1.
     */
    public Tensor flatten() {
        return new Tensor(TensorSpec.of(data.length), data);
    }

    /**
     * Permute dimensions. {@code perm[i]} names the input axis that becomes output axis {@code i}.
     */
    public Tensor transpose(int... perm) {
        int rank = rank();
        if (perm.length != rank) {
            throw new IllegalArgumentException(
                "Permutation " + Arrays.toString(perm) + " doesn't match rank " + rank);
        }
        int[] inputShape = spec.shape();
        long[] inputStrides = spec.strides();
        int[] outputShape = new int[rank];
        for (int i = 0; i < rank; i++) {
            outputShape[i] = inputShape[perm[i]];
        }
        TensorSpec outSpec = TensorSpec.of(outputShape);
        double[] out = new double[data.length];
        int[] outIdx = new int[rank];
        for (int flatOut = 0; flatOut < out.length; flatOut++) {
            outSpec.unflatten(flatOut, outIdx);
            long flatIn = 0;
            for (int d = 0; d < rank; d++) {
                flatIn += outIdx[d] * inputStrides[perm[d]];
            }
            out[flatOut] = data[(int) flatIn];
        }
        return new Tensor(outSpec, out);
    }

    /**
     * Move one axis to a new position, keeping the order of the others.
     */
    public Tensor moveAxis(int source, int destination) {
        int rank = rank();
        int src = normalizeAxis(source, rank);
        int dst = normalizeAxis(destination, rank);
        int[] order = new int[rank - 1];
        int k = 0;
        for (int i = 0; i < rank; i++) {
            if (i != src) {
                order[k++] = i;
            }
        }
        int[] perm = new int[rank];
        k = 0;
        for (int i = 0; i < rank; i++) {
            perm[i] = (i == dst) ? src : order[k++];
        }
        return transpose(perm);
    }

    /**
     * Materialize this tensor broadcast to the given shape.
     */
    public Tensor broadcastTo(int... shape) {
        int[] target = TensorSpec.broadcastShape(spec.shape(), shape);
        if (!Arrays.equals(target, shape)) {
            throw new IllegalArgumentException(
                "Cannot broadcast " + Arrays.toString(spec.shape()) + " to " + Arrays.toString(shape));
        }
        if (Arrays.equals(spec.shape(), shape)) {
            return this;
        }
        TensorSpec outSpec = TensorSpec.of(shape);
        double[] out = new double[outSpec.elementCount()];
        int[] idx = new int[shape.length];
        for (int i = 0; i < out.length; i++) {
            outSpec.unflatten(i, idx);
            out[i] = data[sourceIndex(idx, shape.length)];
        }
        return new Tensor(outSpec, out);
    }

    /**
     * NumPy {@code repeat} on the flattened tensor: each element appears {@code times} times in a row.
     */
    public Tensor repeatEach(int times) {
        double[] out = new double[data.length * times];
        for (int i = 0; i < data.length; i++) {
            Arrays.fill(out, i * times, (i + 1) * times, data[i]);
        }
        return new Tensor(TensorSpec.of(out.length), out);
    }

    /**
     * Elements {@code [from, to)} of the flattened tensor as a rank-1 tensor.
     */
    public Tensor slice(int from, int to) {
        return new Tensor(TensorSpec.of(to - from), Arrays.copyOfRange(data, from, to));
    }

    /**
     * Single-element tensors become scalars, everything else is flattened to one value per channel.
     */
    public Tensor squeezeToChannels() {
        if (data.length == 1) {
            return isScalar() ? this : scalar(data[0]);
        }
        return rank() == 1 ? this : flatten();
    }

    // ==================== Elementwise ====================

    public Tensor map(DoubleUnaryOperator fn) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = fn.applyAsDouble(data[i]);
        }
        return new Tensor(spec, out);
    }

    /**
     * Round to nearest integer, ties to even.
     */
    public Tensor rint() {
        return map(Math::rint);
    }

    public Tensor add(Tensor other) {
        return broadcast(other, Double::sum);
    }

    public Tensor subtract(Tensor other) {
        return broadcast(other, (a, b) -> a - b);
    }

    public Tensor multiply(Tensor other) {
        return broadcast(other, (a, b) -> a * b);
    }

    public Tensor divide(Tensor other) {
        return broadcast(other, (a, b) -> a / b);
    }

    public Tensor minimum(Tensor other) {
        return broadcast(other, Math::min);
    }

    public Tensor maximum(Tensor other) {
        return broadcast(other, Math::max);
    }

    public Tensor add(double value) {
        return map(x -> x + value);
    }

    public Tensor multiply(double value) {
        return map(x -> x * value);
    }

    /**
     * Apply a binary function with NumPy broadcasting semantics.
     */
    public Tensor broadcast(Tensor other, DoubleBinaryOperator fn) {
        if (Arrays.equals(spec.shape(), other.spec.shape())) {
            double[] out = new double[data.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = fn.applyAsDouble(data[i], other.data[i]);
            }
            return new Tensor(spec, out);
        }
        int[] outShape = TensorSpec.broadcastShape(spec.shape(), other.spec.shape());
        TensorSpec outSpec = TensorSpec.of(outShape);
        double[] out = new double[outSpec.elementCount()];
        int[] idx = new int[outShape.length];
        for (int i = 0; i < out.length; i++) {
            outSpec.unflatten(i, idx);
            double a = data[sourceIndex(idx, outShape.length)];
            double b = other.data[other.sourceIndex(idx, outShape.length)];
            out[i] = fn.applyAsDouble(a, b);
        }
        return new Tensor(outSpec, out);
    }

    // ==================== Reductions ====================

    /**
     * Minimum over all axes except {@code axis}, giving one value per index along it.
     */
    public Tensor reduceMinExcept(int axis) {
        return reduceExcept(axis, Double.POSITIVE_INFINITY, Math::min);
    }

    /**
     * Maximum over all axes except {@code axis}, giving one value per index along it.
     */
    public Tensor reduceMaxExcept(int axis) {
        return reduceExcept(axis, Double.NEGATIVE_INFINITY, Math::max);
    }

    public double min() {
        double m = Double.POSITIVE_INFINITY;
        for (double v : data) {
            m = Math.min(m, v);
        }
        return m;
    }

    public double max() {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : data) {
            m = Math.max(m, v);
        }
        return m;
    }

    public boolean allMatch(DoublePredicate predicate) {
        for (double v : data) {
            if (!predicate.test(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when every element equals the first one.
     */
    public boolean isUniform() {
        for (double v : data) {
            if (v != data[0]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Elementwise equality with broadcasting, as a flat boolean mask over the broadcast shape.
     */
    public boolean[] elementwiseEquals(Tensor other) {
        Tensor eq = broadcast(other, (a, b) -> a == b ? 1.0 : 0.0);
        boolean[] mask = new boolean[eq.data.length];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = eq.data[i] != 0.0;
        }
        return mask;
    }

    // ==================== Internal Helpers ====================

    private Tensor reduceExcept(int axis, double identity, DoubleBinaryOperator reducer) {
        int rank = rank();
        int ax = normalizeAxis(axis, rank);
        int[] shape = spec.shape();
        long stride = spec.strides()[ax];
        int extent = shape[ax];
        double[] out = new double[extent];
        Arrays.fill(out, identity);
        for (int i = 0; i < data.length; i++) {
            int c = (int) ((i / stride) % extent);
            out[c] = reducer.applyAsDouble(out[c], data[i]);
        }
        return new Tensor(TensorSpec.of(extent), out);
    }

    /**
     * Map an index in a broadcast output of rank {@code outRank} to this tensor's flat index.
     */
    private int sourceIndex(int[] outIdx, int outRank) {
        int[] shape = spec.shape();
        long[] strides = spec.strides();
        int offset = outRank - shape.length;
        long flat = 0;
        for (int d = 0; d < shape.length; d++) {
            int i = shape[d] == 1 ? 0 : outIdx[d + offset];
            flat += i * strides[d];
        }
        return (int) flat;
    }

    private static int normalizeAxis(int axis, int rank) {
        int ax = axis < 0 ? axis + rank : axis;
        if (ax < 0 || ax >= rank) {
            throw new IllegalArgumentException("Axis " + axis + " out of range for rank " + rank);
        }
        return ax;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tensor that)) return false;
        return spec.shapeEquals(that.spec) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(spec.shape()) + Arrays.hashCode(data);
    }

    /**
     * Every value in row-major order, or the bare value for a scalar. Unlike
     * {@link #toString()} this never abbreviates.
     */
    public String formatValues() {
        return isScalar() ? Double.toString(data[0]) : Arrays.toString(data);
    }

    @Override
    public String toString() {
        if (isScalar()) {
            return Double.toString(data[0]);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Tensor[shape=").append(Arrays.toString(spec.shape()));
        if (data.length <= 16) {
            sb.append(", data=").append(Arrays.toString(data));
        } else {
            sb.append(", elements=").append(data.length);
        }
        sb.append("]");
        return sb.toString();
    }
}
