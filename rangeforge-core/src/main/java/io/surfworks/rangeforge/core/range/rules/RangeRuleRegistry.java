package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps operator kinds to their {@link RangeRule}.
 *
 * <p>Unknown kinds resolve to {@link UnsupportedRangeRule}.
 */
public final class RangeRuleRegistry {

    private static final List<String> MONOTONIC_OPS = List.of(
        "Transpose", "Flatten", "Reshape", "Quant", "BipolarQuant",
        "Mul", "Sub", "Div", "Add", "BatchNormalization", "Relu", "Pad",
        "AveragePool", "MaxPool", "Resize", "Upsample", "GlobalAveragePool",
        "QuantizeLinear", "DequantizeLinear", "Clip", "Sigmoid", "Concat", "Split"
    );

    private final Map<String, RangeRule> rules = new LinkedHashMap<>();

    /**
     * Registry with the built-in rules.
     */
    public static RangeRuleRegistry defaults() {
        RangeRuleRegistry registry = new RangeRuleRegistry();
        MonotonicRangeRule monotonic = new MonotonicRangeRule();
        for (String op : MONOTONIC_OPS) {
            registry.register(op, monotonic);
        }
        registry.register("MatMul", new MatMulRangeRule());
        registry.register("Gemm", new GemmRangeRule());
        registry.register("Conv", new ConvRangeRule());
        registry.register("ConvTranspose", new ConvTransposeRangeRule());
        DeclaredDataTypeRangeRule declared = new DeclaredDataTypeRangeRule();
        registry.register("QuantMaxNorm", declared);
        registry.register("Trunc", declared);
        return registry;
    }

    /**
     * Register (or replace) the rule for an operator kind.
     */
    public RangeRuleRegistry register(String opType, RangeRule rule) {
        rules.put(opType, rule);
        return this;
    }

    public RangeRule ruleFor(String opType) {
        return rules.getOrDefault(opType, UnsupportedRangeRule.INSTANCE);
    }

    public RangeRule ruleFor(Node node) {
        return ruleFor(node.opType());
    }

    public boolean hasRule(Node node) {
        return ruleFor(node).supports(node);
    }

    public Set<String> opTypes() {
        return Collections.unmodifiableSet(rules.keySet());
    }
}
