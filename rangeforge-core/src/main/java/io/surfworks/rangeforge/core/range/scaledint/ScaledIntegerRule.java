package io.surfworks.rangeforge.core.range.scaledint;

import io.surfworks.rangeforge.core.graph.Node;

/**
 * Recovers integer info (integer interval, scale and bias) for the outputs
 * of one operator kind.
 */
@FunctionalInterface
public interface ScaledIntegerRule {

    void apply(Node node, ScaledIntegerContext context);
}
