package io.surfworks.rangeforge.backend.cpu.ops;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.surfworks.rangeforge.backend.cpu.ops.scalar.AddKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.BatchNormalizationKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.BipolarQuantKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.ClipKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.ConcatKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.ConvKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.DequantizeLinearKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.DivKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.FlattenKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.GemmKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.GlobalAveragePoolKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.IdentityKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.MatMulKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.MulKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.PadKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.PoolKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.QuantKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.QuantizeLinearKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.ReluKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.ReshapeKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.ResizeKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.SigmoidKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.SplitKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.SubKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.TransposeKernel;
import io.surfworks.rangeforge.backend.cpu.ops.scalar.TruncKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

/**
 * Dispatches nodes to the kernel registered for their operator kind.
 */
public final class OpDispatcher {

    private final Map<String, OpKernel> kernels = new ConcurrentHashMap<>();

    public OpDispatcher() {
        registerDefaultKernels();
    }

    /**
     * Register a kernel for an operator kind.
     */
    public void register(String opType, OpKernel kernel) {
        kernels.put(opType, kernel);
    }

    /**
     * Execute a node.
     *
     * @param node   The node to execute
     * @param inputs Input tensors
     * @return Output tensors
     * @throws UnsupportedOperationException if no kernel is registered
     */
    public List<Tensor> dispatch(Node node, List<Tensor> inputs) {
        OpKernel kernel = kernels.get(node.opType());
        if (kernel == null) {
            throw new UnsupportedOperationException(
                "No kernel registered for operation: " + node.opType());
        }
        return kernel.execute(node, inputs);
    }

    /**
     * Check if a node is supported.
     */
    public boolean supports(Node node) {
        OpKernel kernel = kernels.get(node.opType());
        return kernel != null && kernel.supports(node);
    }

    private void registerDefaultKernels() {
        // Binary elementwise operations
        register("Add", new AddKernel());
        register("Sub", new SubKernel());
        register("Mul", new MulKernel());
        register("Div", new DivKernel());

        // Activations
        register("Relu", new ReluKernel());
        register("Sigmoid", new SigmoidKernel());
        register("Clip", new ClipKernel());

        // Shape manipulation
        register("Identity", new IdentityKernel());
        register("Transpose", new TransposeKernel());
        register("Reshape", new ReshapeKernel());
        register("Flatten", new FlattenKernel());
        register("Concat", new ConcatKernel());
        register("Split", new SplitKernel());
        register("Pad", new PadKernel());
        ResizeKernel resize = new ResizeKernel();
        register("Resize", resize);
        register("Upsample", resize);

        // Pooling
        register("MaxPool", new PoolKernel(true));
        register("AveragePool", new PoolKernel(false));
        register("GlobalAveragePool", new GlobalAveragePoolKernel());

        // Linear algebra and neural network
        register("MatMul", new MatMulKernel());
        register("Gemm", new GemmKernel());
        register("Conv", new ConvKernel());
        register("BatchNormalization", new BatchNormalizationKernel());

        // Quantization
        register("Quant", new QuantKernel());
        register("BipolarQuant", new BipolarQuantKernel());
        register("Trunc", new TruncKernel());
        register("QuantizeLinear", new QuantizeLinearKernel());
        register("DequantizeLinear", new DequantizeLinearKernel());
    }
}
