package io.surfworks.rangeforge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.range.StuckChannel;
import io.surfworks.rangeforge.core.report.RangeReport;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.io.IOException;

/**
 * Renders a {@link RangeReport} as JSON.
 *
 * <p>The top-level object carries {@code mode} and {@code tensors}, keyed by
 * tensor name in report order. Tensors are written as {@code shape} plus
 * flat row-major {@code data}.
 */
public final class ReportJsonWriter {

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ReportJsonWriter() {
    }

    public static String write(RangeReport report) throws IOException {
        return JSON.writeValueAsString(toJson(report));
    }

    static ObjectNode toJson(RangeReport report) {
        ObjectNode root = JSON.createObjectNode();
        root.put("mode", report.mode().label());
        ObjectNode tensors = root.putObject("tensors");

        if (report instanceof RangeReport.Ranges ranges) {
            ranges.entries().forEach((name, info) -> tensors.set(name, rangeInfo(info)));
        } else if (report instanceof RangeReport.StuckChannels stuck) {
            stuck.entries().forEach((name, channels) -> {
                ArrayNode array = tensors.putArray(name);
                for (StuckChannel channel : channels) {
                    array.addObject()
                        .put("channel", channel.channel())
                        .put("value", channel.value());
                }
            });
        } else if (report instanceof RangeReport.ZeroStuckChannels zero) {
            zero.entries().forEach((name, channels) -> {
                ArrayNode array = tensors.putArray(name);
                channels.forEach(array::add);
            });
        }
        return root;
    }

    private static ObjectNode rangeInfo(RangeInfo info) {
        ObjectNode node = JSON.createObjectNode();
        node.set("range", range(info.range()));
        if (info.intRange() != null) {
            node.set("intRange", range(info.intRange()));
        }
        if (info.scale() != null) {
            node.set("scale", tensor(info.scale()));
        }
        if (info.bias() != null) {
            node.set("bias", tensor(info.bias()));
        }
        node.put("initializer", info.initializer());
        return node;
    }

    private static ObjectNode range(Range range) {
        ObjectNode node = JSON.createObjectNode();
        node.set("min", tensor(range.min()));
        node.set("max", tensor(range.max()));
        return node;
    }

    private static ObjectNode tensor(Tensor tensor) {
        ObjectNode node = JSON.createObjectNode();
        ArrayNode shape = node.putArray("shape");
        for (int dim : tensor.shape()) {
            shape.add(dim);
        }
        ArrayNode data = node.putArray("data");
        for (double value : tensor.toDoubleArray()) {
            data.add(value);
        }
        return node;
    }
}
