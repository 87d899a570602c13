package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tensor name to {@link RangeInfo} mapping, in definition order.
 *
 * <p>Each tensor is defined once, by its producer. The scaled-integer pass
 * may later attach integer info to an existing entry; the real-valued range
 * is never replaced. Once {@linkplain #seal() sealed} the store rejects both.
 */
public final class RangeStore {

    private final Map<String, RangeInfo> entries = new LinkedHashMap<>();
    private boolean sealed;

    /**
     * Define the range info of a tensor.
     *
     * @throws IllegalStateException if the tensor already has range info or the store is sealed
     */
    public void define(String tensorName, RangeInfo info) {
        checkOpen();
        if (entries.putIfAbsent(tensorName, info) != null) {
            throw new IllegalStateException("Range of '" + tensorName + "' is already defined");
        }
    }

    /**
     * Attach integer info to an already-defined tensor, keeping its range.
     */
    public void attachIntegerInfo(String tensorName, Range intRange, Tensor scale, Tensor bias) {
        checkOpen();
        RangeInfo existing = entries.get(tensorName);
        if (existing == null) {
            throw new IllegalStateException("Range of '" + tensorName + "' is not defined");
        }
        entries.put(tensorName, existing.withIntegerInfo(intRange, scale, bias));
    }

    /**
     * Reject any further writes. Irreversible.
     */
    public RangeStore seal() {
        sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("Range store is sealed");
        }
    }

    public boolean contains(String tensorName) {
        return entries.containsKey(tensorName);
    }

    public Optional<RangeInfo> get(String tensorName) {
        return Optional.ofNullable(entries.get(tensorName));
    }

    /**
     * Get the range info of a tensor that must already be resolved.
     */
    public RangeInfo require(String tensorName) {
        RangeInfo info = entries.get(tensorName);
        if (info == null) {
            throw new RangeAnalysisException("No range information for tensor '" + tensorName + "'");
        }
        return info;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, RangeInfo> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }
}
