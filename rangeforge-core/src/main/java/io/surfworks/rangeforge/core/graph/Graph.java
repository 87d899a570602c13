package io.surfworks.rangeforge.core.graph;

import io.surfworks.rangeforge.core.tensor.DataType;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A static, cycle-free dataflow graph.
 *
 * <p>Nodes are kept in declared (topological) order. Tensors are identified by
 * name; constants are held as initializers. Graphs are immutable: passes that
 * rewrite a graph return a new instance built with {@link #toBuilder()}.
 */
public final class Graph {

    private final String name;
    private final List<Node> nodes;
    private final List<String> inputs;
    private final List<String> outputs;
    private final Map<String, ValueInfo> valueInfos;
    private final Map<String, Tensor> initializers;

    private Graph(Builder builder) {
        this.name = builder.name;
        this.nodes = List.copyOf(builder.nodes);
        this.inputs = List.copyOf(builder.inputs);
        this.outputs = List.copyOf(builder.outputs);
        this.valueInfos = Collections.unmodifiableMap(new LinkedHashMap<>(builder.valueInfos));
        this.initializers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.initializers));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Get the graph name.
     */
    public String name() {
        return name;
    }

    /**
     * Get the nodes in declared topological order.
     */
    public List<Node> nodes() {
        return nodes;
    }

    /**
     * Get the names of the graph inputs.
     */
    public List<String> inputs() {
        return inputs;
    }

    /**
     * Get the names of the graph outputs.
     */
    public List<String> outputs() {
        return outputs;
    }

    public Map<String, Tensor> initializers() {
        return initializers;
    }

    public Map<String, ValueInfo> valueInfos() {
        return valueInfos;
    }

    /**
     * Get the constant value of a tensor, or null if it is not an initializer.
     */
    public Tensor initializer(String tensorName) {
        return initializers.get(tensorName);
    }

    public boolean isInitializer(String tensorName) {
        return initializers.containsKey(tensorName);
    }

    /**
     * A tensor is dynamic if it is named (not an omitted optional input) and not a constant.
     */
    public boolean isDynamic(String tensorName) {
        return !tensorName.isEmpty() && !initializers.containsKey(tensorName);
    }

    public Optional<ValueInfo> valueInfo(String tensorName) {
        return Optional.ofNullable(valueInfos.get(tensorName));
    }

    /**
     * Declared shape of a tensor. Initializers report the shape of their value.
     */
    public Optional<int[]> shapeOf(String tensorName) {
        Tensor init = initializers.get(tensorName);
        if (init != null) {
            return Optional.of(init.shape());
        }
        ValueInfo info = valueInfos.get(tensorName);
        return info != null && info.hasShape() ? Optional.of(info.shape()) : Optional.empty();
    }

    public Optional<DataType> dataTypeOf(String tensorName) {
        ValueInfo info = valueInfos.get(tensorName);
        return info == null ? Optional.empty() : info.declaredDataType();
    }

    /**
     * Find the node producing the given tensor.
     */
    public Optional<Node> producer(String tensorName) {
        for (Node node : nodes) {
            if (node.outputs().contains(tensorName)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * All tensor names referenced by the graph, in first-seen order.
     */
    public Set<String> allTensorNames() {
        Set<String> names = new LinkedHashSet<>(inputs);
        names.addAll(initializers.keySet());
        for (Node node : nodes) {
            for (String in : node.inputs()) {
                if (!in.isEmpty()) {
                    names.add(in);
                }
            }
            names.addAll(node.outputs());
        }
        names.addAll(valueInfos.keySet());
        return names;
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name);
        builder.nodes.addAll(nodes);
        builder.inputs.addAll(inputs);
        builder.outputs.addAll(outputs);
        builder.valueInfos.putAll(valueInfos);
        builder.initializers.putAll(initializers);
        return builder;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Graph '").append(name).append("'\n");
        sb.append("  Inputs: ").append(inputs).append("\n");
        sb.append("  Outputs: ").append(outputs).append("\n");
        sb.append("  Initializers: ").append(initializers.size()).append("\n");
        sb.append("  Nodes:\n");
        for (int i = 0; i < nodes.size(); i++) {
            sb.append("    [").append(i).append("] ").append(nodes.get(i)).append("\n");
        }
        return sb.toString();
    }

    /**
     * Builder for {@link Graph}.
     */
    public static final class Builder {
        private final String name;
        private final List<Node> nodes = new ArrayList<>();
        private final List<String> inputs = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();
        private final Map<String, ValueInfo> valueInfos = new LinkedHashMap<>();
        private final Map<String, Tensor> initializers = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name == null ? "graph" : name;
        }

        /**
         * Declare a graph input with its shape.
         */
        public Builder input(String tensorName, int... shape) {
            return input(ValueInfo.of(tensorName, shape));
        }

        public Builder input(ValueInfo info) {
            inputs.add(info.name());
            valueInfos.put(info.name(), info);
            return this;
        }

        public Builder output(String tensorName) {
            outputs.add(tensorName);
            return this;
        }

        /**
         * Declare (or replace) the metadata of an intermediate tensor.
         */
        public Builder valueInfo(ValueInfo info) {
            valueInfos.put(info.name(), info);
            return this;
        }

        public Builder valueInfo(String tensorName, int... shape) {
            return valueInfo(ValueInfo.of(tensorName, shape));
        }

        public Builder initializer(String tensorName, Tensor value) {
            initializers.put(tensorName, value);
            return this;
        }

        public Builder node(Node node) {
            nodes.add(node);
            return this;
        }

        public Builder nodes(List<Node> newNodes) {
            nodes.clear();
            nodes.addAll(newNodes);
            return this;
        }

        public Builder removeValueInfo(String tensorName) {
            valueInfos.remove(tensorName);
            return this;
        }

        public Graph build() {
            Set<String> produced = new LinkedHashSet<>();
            for (Node node : nodes) {
                for (String out : node.outputs()) {
                    if (!produced.add(out)) {
                        throw new IllegalArgumentException("Tensor '" + out + "' is produced more than once");
                    }
                }
            }
            return new Graph(this);
        }
    }
}
