package io.surfworks.rangeforge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.graph.ValueInfo;
import io.surfworks.rangeforge.core.io.NpyIO;
import io.surfworks.rangeforge.core.tensor.DataType;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link Graph} from its JSON description.
 *
 * <pre>{@code
 * {
 *   "name": "tfc",
 *   "inputs": ["x"],
 *   "outputs": ["y"],
 *   "valueInfo": [{"name": "x", "shape": [1, 4], "dtype": "INT8"}],
 *   "initializers": [
 *     {"name": "w", "shape": [4, 2], "data": [1, 0, 0, 1, 1, 0, 0, 1]},
 *     {"name": "b", "npy": "b.npy"}
 *   ],
 *   "nodes": [{"name": "mm", "opType": "MatMul", "inputs": ["x", "w"], "outputs": ["y"],
 *              "attributes": {}}]
 * }
 * }</pre>
 *
 * <p>{@code npy} paths are resolved against the directory of the graph file.
 */
public final class GraphJsonReader {

    private static final ObjectMapper JSON = new ObjectMapper();

    private GraphJsonReader() {
    }

    public static Graph read(Path graphFile) throws IOException {
        if (!Files.exists(graphFile)) {
            throw new IOException("Graph file not found: " + graphFile);
        }
        JsonNode root = JSON.readTree(graphFile.toFile());
        Path baseDir = graphFile.toAbsolutePath().getParent();
        return parse(root, baseDir);
    }

    /**
     * Parse a graph from JSON text. Initializers must be given inline.
     */
    public static Graph parse(String json) throws IOException {
        return parse(JSON.readTree(json), null);
    }

    static Graph parse(JsonNode root, Path baseDir) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Graph JSON must be an object");
        }
        Graph.Builder builder = Graph.builder(root.path("name").asText("graph"));

        Map<String, ValueInfo> infos = new LinkedHashMap<>();
        for (JsonNode info : root.path("valueInfo")) {
            ValueInfo parsed = parseValueInfo(info);
            infos.put(parsed.name(), parsed);
        }

        for (JsonNode input : root.path("inputs")) {
            String name = input.asText();
            ValueInfo info = infos.remove(name);
            builder.input(info != null ? info : new ValueInfo(name, null, null));
        }
        infos.values().forEach(builder::valueInfo);

        for (JsonNode output : root.path("outputs")) {
            builder.output(output.asText());
        }

        for (JsonNode init : root.path("initializers")) {
            String name = requireText(init, "name", "initializer");
            builder.initializer(name, parseInitializer(init, name, baseDir));
        }

        for (JsonNode node : root.path("nodes")) {
            builder.node(parseNode(node));
        }
        return builder.build();
    }

    private static ValueInfo parseValueInfo(JsonNode info) throws IOException {
        String name = requireText(info, "name", "valueInfo");
        int[] shape = info.has("shape") ? toInts(info.get("shape")) : null;
        DataType dataType = null;
        if (info.hasNonNull("dtype")) {
            try {
                dataType = DataType.parse(info.get("dtype").asText());
            } catch (IllegalArgumentException e) {
                throw new IOException("Bad dtype for '" + name + "': " + e.getMessage(), e);
            }
        }
        return new ValueInfo(name, shape, dataType);
    }

    private static Tensor parseInitializer(JsonNode init, String name, Path baseDir) throws IOException {
        if (init.has("npy")) {
            String file = init.get("npy").asText();
            if (baseDir == null) {
                throw new IOException("Initializer '" + name + "' refers to " + file
                    + " but the graph was not read from a file");
            }
            return NpyIO.read(baseDir.resolve(file));
        }
        if (!init.has("data")) {
            throw new IOException("Initializer '" + name + "' needs either 'data' or 'npy'");
        }
        JsonNode data = init.get("data");
        double[] values;
        if (data.isArray()) {
            values = new double[data.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = data.get(i).asDouble();
            }
        } else {
            values = new double[] {data.asDouble()};
        }
        int[] shape = init.has("shape") ? toInts(init.get("shape")) : new int[] {values.length};
        try {
            return Tensor.of(values, shape);
        } catch (IllegalArgumentException e) {
            throw new IOException("Initializer '" + name + "': " + e.getMessage(), e);
        }
    }

    private static Node parseNode(JsonNode node) throws IOException {
        String opType = requireText(node, "opType", "node");
        Map<String, Object> attributes = new LinkedHashMap<>();
        node.path("attributes").fields().forEachRemaining(
            field -> attributes.put(field.getKey(), toAttribute(field.getValue())));
        return new Node(
            node.path("name").asText(null),
            opType,
            toStrings(node.path("inputs")),
            toStrings(node.path("outputs")),
            attributes);
    }

    private static Object toAttribute(JsonNode value) {
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isArray()) {
            List<Object> list = new ArrayList<>();
            value.forEach(element -> list.add(toAttribute(element)));
            return list;
        }
        return value.asText();
    }

    private static String requireText(JsonNode node, String field, String what) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.asText().isEmpty()) {
            throw new IOException("Every " + what + " needs a '" + field + "': " + node);
        }
        return value.asText();
    }

    private static List<String> toStrings(JsonNode array) {
        List<String> result = new ArrayList<>();
        array.forEach(element -> result.add(element.asText()));
        return result;
    }

    private static int[] toInts(JsonNode array) {
        int[] result = new int[array.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = array.get(i).asInt();
        }
        return result;
    }
}
