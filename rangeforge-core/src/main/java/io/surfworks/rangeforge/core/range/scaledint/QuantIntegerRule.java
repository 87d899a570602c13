package io.surfworks.rangeforge.core.range.scaledint;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.tensor.DataType;
import io.surfworks.rangeforge.core.tensor.Tensor;

/**
 * Quantizer {@code q = S * (x - Z)} with inputs (x, S, Z, bitwidth).
 *
 * <p>In {@code real = scale * int + bias} form, {@code scale = S} and
 * {@code bias = -S * Z}. A constant output is inverted exactly; otherwise the
 * integer interval is the one of the quantizer's integer datatype.
 */
final class QuantIntegerRule implements ScaledIntegerRule {

    @Override
    public void apply(Node node, ScaledIntegerContext context) {
        Tensor scale = constant(node, context, 1, "scale");
        Tensor zeroPoint = constant(node, context, 2, "zeropoint");
        Tensor bitWidth = constant(node, context, 3, "bitwidth");
        if (bitWidth.rank() > 1) {
            throw new RangeAnalysisException("Quant bitwidth of node " + node.name() + " must be a scalar");
        }

        String out = node.output(0);
        RangeInfo outInfo = context.info(out);
        Tensor bias = scale.multiply(zeroPoint).multiply(-1.0);

        Range intRange;
        if (outInfo.initializer()) {
            // round half to even
            Tensor q = outInfo.range().min();
            Tensor qInt = q.divide(scale).add(zeroPoint).rint();
            intRange = Range.degenerate(qInt);
        } else {
            boolean signed = node.intAttr("signed", 1) != 0;
            boolean narrow = node.intAttr("narrow", 0) != 0;
            DataType dataType = DataType.quantized((int) bitWidth.getFlat(0), signed);
            double narrowAdjust = narrow && dataType.kind() == DataType.Kind.INT ? 1 : 0;
            intRange = Range.of(dataType.min() + narrowAdjust, dataType.max());
        }
        context.attach(out, intRange, scale, bias);
    }

    private static Tensor constant(Node node, ScaledIntegerContext context, int index, String role) {
        Tensor value = context.graph().initializer(node.input(index));
        if (value == null) {
            throw new RangeAnalysisException("Quant " + role + " of node " + node.name() + " must be a constant");
        }
        return value;
    }
}
