package io.surfworks.rangeforge.cli;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.io.NpyIO;
import io.surfworks.rangeforge.core.tensor.DataType;
import io.surfworks.rangeforge.core.tensor.Tensor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphJsonReaderTest {

    @TempDir
    Path tempDir;

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(GraphJsonReaderTest.class.getResource("/graphs/" + name).toURI());
    }

    @Test
    void readsGraphFixture() throws Exception {
        Graph graph = GraphJsonReader.read(fixture("dense.json"));

        assertEquals("dense", graph.name());
        assertEquals(List.of("x"), graph.inputs());
        assertEquals(List.of("r"), graph.outputs());
        assertEquals(2, graph.nodes().size());
        assertEquals(Tensor.of(new double[]{1, -1, 2, 3}, 2, 2), graph.initializer("w"));
        assertArrayEquals(new int[]{2}, graph.initializer("b").shape());
        assertEquals(DataType.BINARY, graph.dataTypeOf("x").orElseThrow());
        assertArrayEquals(new int[]{1, 2}, graph.shapeOf("y").orElseThrow());
    }

    @Test
    void readsNodeAttributes() throws Exception {
        Node fc = GraphJsonReader.read(fixture("dense.json")).nodes().get(0);

        assertEquals("fc", fc.name());
        assertEquals("Gemm", fc.opType());
        assertEquals(List.of("x", "w", "b"), fc.inputs());
        assertEquals(1, fc.intAttr("transB", 0));
        assertEquals(1.0, fc.floatAttr("alpha", 0.0));
    }

    @Test
    void listAndStringAttributes() throws IOException {
        Graph graph = GraphJsonReader.parse("""
            {"inputs": ["x"],
             "nodes": [{"opType": "MaxPool", "inputs": ["x"], "outputs": ["y"],
                        "attributes": {"kernel_shape": [2, 2], "auto_pad": "NOTSET"}}]}
            """);

        Node pool = graph.nodes().get(0);
        assertArrayEquals(new int[]{2, 2}, pool.intsAttr("kernel_shape", null));
        assertEquals("NOTSET", pool.stringAttr("auto_pad", ""));
        assertEquals("MaxPool_y", pool.name());
    }

    @Test
    void inputsWithoutValueInfoHaveNoShape() throws IOException {
        Graph graph = GraphJsonReader.parse("{\"inputs\": [\"x\"]}");

        assertTrue(graph.valueInfo("x").isPresent());
        assertFalse(graph.shapeOf("x").isPresent());
        assertFalse(graph.dataTypeOf("x").isPresent());
    }

    @Test
    void npyInitializerIsResolvedNextToTheGraph() throws IOException {
        Tensor bias = Tensor.vector(0.5, -1.5);
        NpyIO.write(bias, tempDir.resolve("bias.npy"));
        Path graphFile = tempDir.resolve("graph.json");
        Files.writeString(graphFile, """
            {"inputs": ["x"], "initializers": [{"name": "b", "npy": "bias.npy"}]}
            """);

        Graph graph = GraphJsonReader.read(graphFile);

        assertEquals(bias, graph.initializer("b"));
    }

    @Test
    void npyInitializerNeedsAGraphFile() {
        IOException e = assertThrows(IOException.class, () -> GraphJsonReader.parse(
            "{\"initializers\": [{\"name\": \"b\", \"npy\": \"bias.npy\"}]}"));
        assertTrue(e.getMessage().contains("bias.npy"));
    }

    @Test
    void scalarInitializer() throws IOException {
        Graph graph = GraphJsonReader.parse(
            "{\"initializers\": [{\"name\": \"s\", \"shape\": [], \"data\": 0.25}]}");

        assertTrue(graph.initializer("s").isScalar());
        assertEquals(0.25, graph.initializer("s").item());
    }

    @Test
    void rejectsInitializerShapeMismatch() {
        IOException e = assertThrows(IOException.class, () -> GraphJsonReader.parse(
            "{\"initializers\": [{\"name\": \"w\", \"shape\": [2, 2], \"data\": [1, 2, 3]}]}"));
        assertTrue(e.getMessage().contains("'w'"));
    }

    @Test
    void rejectsInitializerWithoutData() {
        assertThrows(IOException.class, () -> GraphJsonReader.parse(
            "{\"initializers\": [{\"name\": \"w\"}]}"));
    }

    @Test
    void rejectsNodeWithoutOperatorType() {
        assertThrows(IOException.class, () -> GraphJsonReader.parse(
            "{\"nodes\": [{\"inputs\": [\"x\"], \"outputs\": [\"y\"]}]}"));
    }

    @Test
    void rejectsUnknownDatatype() {
        IOException e = assertThrows(IOException.class, () -> GraphJsonReader.parse(
            "{\"valueInfo\": [{\"name\": \"x\", \"dtype\": \"QUATERNARY\"}]}"));
        assertTrue(e.getMessage().contains("Bad dtype"));
    }

    @Test
    void rejectsNonObjectRoot() {
        assertThrows(IOException.class, () -> GraphJsonReader.parse("[1, 2]"));
    }

    @Test
    void missingFile() {
        IOException e = assertThrows(IOException.class,
            () -> GraphJsonReader.read(tempDir.resolve("absent.json")));
        assertTrue(e.getMessage().startsWith("Graph file not found"));
    }
}
