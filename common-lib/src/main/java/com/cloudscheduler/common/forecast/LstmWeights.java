package com.cloudscheduler.common.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable parameters of a stacked LSTM with a linear output head.
 *
 * <p>Gate rows are laid out input / forget / cell / output, {@code hiddenSize} rows each, the
 * same layout a PyTorch {@code nn.LSTM} state dict exports. Artifacts are JSON documents shaped
 * like {@link Artifact}.
 */
public final class LstmWeights {

    public static final int INPUT_SIZE  = 4;
    public static final int HIDDEN_SIZE = 64;
    public static final int NUM_LAYERS  = 2;
    public static final int OUTPUT_SIZE = 4;

    private final int inputSize;
    private final int hiddenSize;
    private final int outputSize;
    private final List<Layer> layers;
    private final double[][] outputWeights;
    private final double[] outputBias;

    record Layer(double[][] inputWeights, double[][] recurrentWeights,
                 double[] inputBias, double[] recurrentBias) {}

    /**
     * JSON shape of a weight artifact.
     */
    public record Artifact(
        @JsonProperty("inputSize")  int inputSize,
        @JsonProperty("hiddenSize") int hiddenSize,
        @JsonProperty("outputSize") int outputSize,
        @JsonProperty("layers")     List<ArtifactLayer> layers,
        @JsonProperty("fcWeight")   double[][] fcWeight,
        @JsonProperty("fcBias")     double[] fcBias
    ) {}

    public record ArtifactLayer(
        @JsonProperty("weightIh") double[][] weightIh,
        @JsonProperty("weightHh") double[][] weightHh,
        @JsonProperty("biasIh")   double[] biasIh,
        @JsonProperty("biasHh")   double[] biasHh
    ) {}

    private LstmWeights(int inputSize, int hiddenSize, int outputSize, List<Layer> layers,
                        double[][] outputWeights, double[] outputBias) {
        this.inputSize = inputSize;
        this.hiddenSize = hiddenSize;
        this.outputSize = outputSize;
        this.layers = List.copyOf(layers);
        this.outputWeights = outputWeights;
        this.outputBias = outputBias;
    }

    /**
     * Deterministic stand-in for a trained artifact: every parameter drawn from
     * U(-1/√hidden, 1/√hidden) with the given seed.
     */
    public static LstmWeights seeded(long seed) {
        RandomGenerator random = new Well19937c(seed);
        double bound = 1.0 / Math.sqrt(HIDDEN_SIZE);
        int gateRows = 4 * HIDDEN_SIZE;
        List<Layer> layers = new ArrayList<>(NUM_LAYERS);
        for (int l = 0; l < NUM_LAYERS; l++) {
            int layerInput = l == 0 ? INPUT_SIZE : HIDDEN_SIZE;
            layers.add(new Layer(
                uniform(random, gateRows, layerInput, bound),
                uniform(random, gateRows, HIDDEN_SIZE, bound),
                uniform(random, 1, gateRows, bound)[0],
                uniform(random, 1, gateRows, bound)[0]));
        }
        return new LstmWeights(INPUT_SIZE, HIDDEN_SIZE, OUTPUT_SIZE, layers,
                               uniform(random, OUTPUT_SIZE, HIDDEN_SIZE, bound),
                               uniform(random, 1, OUTPUT_SIZE, bound)[0]);
    }

    /**
     * Reads and validates a JSON artifact.
     *
     * @throws IOException              if the stream cannot be read or parsed
     * @throws IllegalArgumentException if any matrix has the wrong shape
     */
    public static LstmWeights fromJson(InputStream in, ObjectMapper mapper) throws IOException {
        return fromArtifact(mapper.readValue(in, Artifact.class));
    }

    public static LstmWeights fromArtifact(Artifact artifact) {
        if (artifact.layers() == null || artifact.layers().isEmpty()) {
            throw new IllegalArgumentException("LSTM artifact has no layers");
        }
        if (artifact.inputSize() != artifact.outputSize()) {
            throw new IllegalArgumentException("LSTM artifact must predict its own input width, got input="
                + artifact.inputSize() + " output=" + artifact.outputSize());
        }
        int gateRows = 4 * artifact.hiddenSize();
        List<Layer> layers = new ArrayList<>(artifact.layers().size());
        for (int l = 0; l < artifact.layers().size(); l++) {
            ArtifactLayer layer = artifact.layers().get(l);
            int layerInput = l == 0 ? artifact.inputSize() : artifact.hiddenSize();
            String prefix = "layers[" + l + "].";
            layers.add(new Layer(
                requireShape(prefix + "weightIh", layer.weightIh(), gateRows, layerInput),
                requireShape(prefix + "weightHh", layer.weightHh(), gateRows, artifact.hiddenSize()),
                requireLength(prefix + "biasIh", layer.biasIh(), gateRows),
                requireLength(prefix + "biasHh", layer.biasHh(), gateRows)));
        }
        return new LstmWeights(artifact.inputSize(), artifact.hiddenSize(), artifact.outputSize(), layers,
            requireShape("fcWeight", artifact.fcWeight(), artifact.outputSize(), artifact.hiddenSize()),
            requireLength("fcBias", artifact.fcBias(), artifact.outputSize()));
    }

    public int inputSize()  { return inputSize; }
    public int hiddenSize() { return hiddenSize; }
    public int outputSize() { return outputSize; }
    public int numLayers()  { return layers.size(); }

    Layer layer(int index)       { return layers.get(index); }
    double[][] outputWeights()   { return outputWeights; }
    double[] outputBias()        { return outputBias; }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static double[][] uniform(RandomGenerator random, int rows, int cols, double bound) {
        double[][] matrix = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                matrix[r][c] = (random.nextDouble() * 2.0 - 1.0) * bound;
            }
        }
        return matrix;
    }

    private static double[][] requireShape(String name, double[][] matrix, int rows, int cols) {
        if (matrix == null || matrix.length != rows) {
            throw new IllegalArgumentException(name + " must have " + rows + " rows");
        }
        double[][] copy = new double[rows][];
        for (int r = 0; r < rows; r++) {
            copy[r] = requireLength(name + "[" + r + "]", matrix[r], cols);
        }
        return copy;
    }

    private static double[] requireLength(String name, double[] vector, int length) {
        if (vector == null || vector.length != length) {
            throw new IllegalArgumentException(name + " must have length " + length);
        }
        return vector.clone();
    }
}
