package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.tensor.DataType;

import java.util.Map;

/**
 * Output range is the representable range of the output's declared datatype,
 * independent of the inputs. Used for saturating quantizers and truncation.
 */
public final class DeclaredDataTypeRangeRule implements RangeRule {

    @Override
    public Map<String, RangeInfo> apply(Node node, RangeContext context) {
        String output = node.output(0);
        DataType dataType = context.graph().dataTypeOf(output).orElseThrow(() ->
            new RangeAnalysisException("Cannot infer " + output + " range, dtype annotation is missing"));
        return Map.of(output, RangeInfo.of(dataType.min(), dataType.max()));
    }
}
