package io.surfworks.rangeforge.core.tensor;

import java.util.Arrays;

/**
 * Tensor shape together with its computed row-major strides.
 * Immutable metadata describing tensor layout.
 */
public record TensorSpec(
    int[] shape,
    long[] strides
) {
    /**
     * Create a TensorSpec with row-major (C-contiguous) strides.
     */
    public static TensorSpec of(int... shape) {
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
        }
        return new TensorSpec(shape.clone(), computeRowMajorStrides(shape));
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return shape.length;
    }

    /**
     * Total number of elements.
     */
    public int elementCount() {
        return elementCount(shape);
    }

    /**
     * Compute flat index from multi-dimensional indices.
     */
    public int flatIndex(int... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + indices.length);
        }
        long idx = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " out of bounds for dimension " + i + " with size " + shape[i]);
            }
            idx += indices[i] * strides[i];
        }
        return (int) idx;
    }

    /**
     * Convert a flat index back into multi-dimensional indices, written into {@code result}.
     */
    public void unflatten(int flatIndex, int[] result) {
        long remaining = flatIndex;
        for (int i = 0; i < strides.length; i++) {
            result[i] = (int) (remaining / strides[i]);
            remaining %= strides[i];
        }
    }

    /**
     * Check if shapes are equal.
     */
    public boolean shapeEquals(TensorSpec other) {
        return Arrays.equals(this.shape, other.shape);
    }

    /**
     * Check if shapes are broadcastable.
     */
    public boolean isBroadcastableWith(TensorSpec other) {
        int maxRank = Math.max(this.rank(), other.rank());
        for (int i = 0; i < maxRank; i++) {
            int thisDim = i < this.rank() ? this.shape[this.rank() - 1 - i] : 1;
            int otherDim = i < other.rank() ? other.shape[other.rank() - 1 - i] : 1;
            if (thisDim != otherDim && thisDim != 1 && otherDim != 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * NumPy-style broadcast of two shapes.
     *
     * @throws IllegalArgumentException if the shapes are not broadcastable
     */
    public static int[] broadcastShape(int[] a, int[] b) {
        int maxRank = Math.max(a.length, b.length);
        int[] result = new int[maxRank];
        for (int i = 0; i < maxRank; i++) {
            int aDim = i < a.length ? a[a.length - 1 - i] : 1;
            int bDim = i < b.length ? b[b.length - 1 - i] : 1;
            if (aDim != bDim && aDim != 1 && bDim != 1) {
                throw new IllegalArgumentException(
                    "Shapes " + Arrays.toString(a) + " and " + Arrays.toString(b) + " are not broadcastable");
            }
            result[maxRank - 1 - i] = aDim == 1 ? bDim : aDim;
        }
        return result;
    }

    public static int elementCount(int[] shape) {
        int count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Compute row-major (C-contiguous) strides for a shape.
     */
    public static long[] computeRowMajorStrides(int[] shape) {
        if (shape.length == 0) {
            return new long[0];
        }
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorSpec that)) return false;
        return Arrays.equals(shape, that.shape) && Arrays.equals(strides, that.strides);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(strides);
    }

    @Override
    public String toString() {
        return "TensorSpec[shape=" + Arrays.toString(shape) +
               ", strides=" + Arrays.toString(strides) + "]";
    }
}
