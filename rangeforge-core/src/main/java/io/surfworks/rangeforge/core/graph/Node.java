package io.surfworks.rangeforge.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node in the dataflow graph: one operator application.
 *
 * <p>Inputs and outputs are tensor names in operator order. An empty input
 * name marks an omitted optional input. Attribute values are numbers,
 * strings, or lists of numbers.
 *
 * @param name       Node name (used in diagnostics)
 * @param opType     Operator kind, e.g. {@code Conv} or {@code Quant}
 * @param inputs     Ordered input tensor names
 * @param outputs    Ordered output tensor names
 * @param attributes Declared operator attributes
 */
public record Node(
    String name,
    String opType,
    List<String> inputs,
    List<String> outputs,
    Map<String, Object> attributes
) {
    public Node {
        if (opType == null || opType.isEmpty()) {
            throw new IllegalArgumentException("Node requires an operator type");
        }
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (name == null || name.isEmpty()) {
            name = opType + "_" + (outputs.isEmpty() ? "?" : outputs.get(0));
        }
    }

    public static Node of(String opType, List<String> inputs, List<String> outputs) {
        return new Node(null, opType, inputs, outputs, Map.of());
    }

    public static Node of(String opType, List<String> inputs, List<String> outputs, Map<String, Object> attributes) {
        return new Node(null, opType, inputs, outputs, attributes);
    }

    /**
     * Get the input tensor name at a position, or the empty string if absent.
     */
    public String input(int index) {
        return index < inputs.size() ? inputs.get(index) : "";
    }

    public String output(int index) {
        return outputs.get(index);
    }

    public int inputCount() {
        return inputs.size();
    }

    public int outputCount() {
        return outputs.size();
    }

    public boolean hasAttr(String key) {
        return attributes.containsKey(key);
    }

    public long intAttr(String key, long defaultValue) {
        Object value = attributes.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        throw new IllegalArgumentException(
            "Attribute '" + key + "' of " + name + " is not an integer: " + value);
    }

    public double floatAttr(String key, double defaultValue) {
        Object value = attributes.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException(
            "Attribute '" + key + "' of " + name + " is not a number: " + value);
    }

    public String stringAttr(String key, String defaultValue) {
        Object value = attributes.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value.toString();
    }

    /**
     * Get an integer list attribute, or {@code defaultValue} if absent.
     */
    public int[] intsAttr(String key, int[] defaultValue) {
        Object value = attributes.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof int[] arr) {
            return arr.clone();
        }
        if (value instanceof List<?> list) {
            int[] result = new int[list.size()];
            for (int i = 0; i < result.length; i++) {
                Object element = list.get(i);
                if (!(element instanceof Number n)) {
                    throw new IllegalArgumentException(
                        "Attribute '" + key + "' of " + name + " has non-integer element: " + element);
                }
                result[i] = n.intValue();
            }
            return result;
        }
        throw new IllegalArgumentException(
            "Attribute '" + key + "' of " + name + " is not an integer list: " + value);
    }

    @Override
    public String toString() {
        return name + " (" + opType + ") inputs=" + inputs + " outputs=" + outputs;
    }
}
