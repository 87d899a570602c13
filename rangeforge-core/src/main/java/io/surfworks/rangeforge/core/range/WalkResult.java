package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.graph.Graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a range walk.
 *
 * @param graph         The graph that was walked (after normalization, if any)
 * @param store         Range info of every resolved tensor
 * @param stuckChannels Stuck channels per dynamic tensor, in node order
 * @param skippedNodes  Names of nodes left without range info
 */
public record WalkResult(
    Graph graph,
    RangeStore store,
    Map<String, List<StuckChannel>> stuckChannels,
    List<String> skippedNodes
) {
    public WalkResult {
        stuckChannels = Collections.unmodifiableMap(new LinkedHashMap<>(stuckChannels));
        skippedNodes = List.copyOf(skippedNodes);
    }
}
