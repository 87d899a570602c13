package io.surfworks.rangeforge.core.graph;

import io.surfworks.rangeforge.core.tensor.DataType;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared metadata for a named tensor: its shape (when known) and
 * its element datatype annotation (when present).
 *
 * @param name     Tensor name, unique per graph
 * @param shape    Declared shape, or null if not yet inferred
 * @param dataType Declared element datatype, or null if not annotated
 */
public record ValueInfo(
    String name,
    int[] shape,
    DataType dataType
) {
    public ValueInfo {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("ValueInfo requires a non-empty name");
        }
        shape = shape == null ? null : shape.clone();
    }

    public static ValueInfo of(String name, int... shape) {
        return new ValueInfo(name, shape, null);
    }

    public static ValueInfo of(String name, DataType dataType, int... shape) {
        return new ValueInfo(name, shape, dataType);
    }

    @Override
    public int[] shape() {
        return shape == null ? null : shape.clone();
    }

    public boolean hasShape() {
        return shape != null;
    }

    public Optional<DataType> declaredDataType() {
        return Optional.ofNullable(dataType);
    }

    public ValueInfo withShape(int... newShape) {
        return new ValueInfo(name, newShape, dataType);
    }

    public ValueInfo withDataType(DataType newDataType) {
        return new ValueInfo(name, shape, newDataType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueInfo that)) return false;
        return name.equals(that.name) && Arrays.equals(shape, that.shape)
            && Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + Arrays.hashCode(shape)) + Objects.hashCode(dataType);
    }

    @Override
    public String toString() {
        return "ValueInfo[" + name + ", shape=" + (shape == null ? "?" : Arrays.toString(shape))
            + (dataType == null ? "" : ", dtype=" + dataType) + "]";
    }
}
