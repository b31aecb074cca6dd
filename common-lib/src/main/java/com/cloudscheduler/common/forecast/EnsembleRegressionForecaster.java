package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.exception.ModelInferenceException;
import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.model.ForecastOutcome;
import com.cloudscheduler.common.model.ForecastPoint;
import com.cloudscheduler.common.stats.WindowStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

/**
 * Window-statistics random-forest forecaster, trained from scratch on every call.
 *
 * <h3>Training</h3>
 * <pre>
 *   W = min(12, floor(n / 2))
 *   for i in [W, n):  x = descriptor(rows[i-W, i))   y = base metrics of row i
 * </pre>
 * The descriptor is mean(cpu), stdev(cpu), mean(mem), stdev(mem), max(cpu), max(mem).
 * One Weka {@link RandomForest} is fit per target metric.
 *
 * <h3>Inference</h3>
 * Starting from the last W rows, predict the next base-metric vector from the window's
 * descriptor, append it (unclamped) and drop the oldest row, {@code horizon} times.
 *
 * <p>Fewer than {@value #MIN_ROWS} rows or fewer than {@value #MIN_SAMPLES} training samples
 * hand the whole horizon to {@link FallbackTrendEstimator}; a prediction failure hands it
 * the remaining steps. Models never outlive the call that built them.
 */
public class EnsembleRegressionForecaster implements Forecaster {

    private static final Logger log = LoggerFactory.getLogger(EnsembleRegressionForecaster.class);

    static final int MIN_ROWS    = 10;
    static final int MIN_SAMPLES = 5;
    static final int MAX_WINDOW  = 12;

    public static final int DEFAULT_NUM_TREES = 100;
    public static final int DEFAULT_SEED      = 42;

    private static final String[] DESCRIPTOR_NAMES =
        {"cpu_mean", "cpu_std", "memory_mean", "memory_std", "cpu_max", "memory_max"};

    private final int numTrees;
    private final int seed;

    public EnsembleRegressionForecaster() {
        this(DEFAULT_NUM_TREES, DEFAULT_SEED);
    }

    public EnsembleRegressionForecaster(int numTrees, int seed) {
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be positive, got " + numTrees);
        }
        this.numTrees = numTrees;
        this.seed = seed;
    }

    @Override
    public String name() { return "EnsembleRegressionForecaster"; }

    @Override
    public ForecastOutcome forecast(FeatureMatrix features, int horizon, ForecastContext context) {
        int n = features.rowCount();
        if (n < MIN_ROWS) {
            log.info("[EnsembleForecaster] Only {} rows (< {}), using fallback", n, MIN_ROWS);
            return ForecastOutcome.fromFallback(FallbackTrendEstimator.estimate(features, horizon, context));
        }

        int window = Math.min(MAX_WINDOW, n / 2);
        double[][] base = features.baseRows();
        if (n - window < MIN_SAMPLES) {
            log.info("[EnsembleForecaster] Only {} training samples (< {}), using fallback", n - window, MIN_SAMPLES);
            return ForecastOutcome.fromFallback(FallbackTrendEstimator.estimate(features, horizon, context));
        }

        TrainedEnsemble ensemble;
        try {
            ensemble = train(base, window);
        } catch (RuntimeException e) {
            log.warn("[EnsembleForecaster] Training failed, using fallback: {}", e.getMessage());
            return ForecastOutcome.fromFallback(FallbackTrendEstimator.estimate(features, horizon, context));
        }

        List<ForecastPoint> points = new ArrayList<>(horizon);
        double[][] current = features.lastBaseRows(window);
        try {
            for (int step = 0; step < horizon; step++) {
                double[] next = ensemble.predict(descriptor(current));
                points.add(ForecastPoint.clamped(context.now(), step + 1, next));
                current = slide(current, next);
            }
            return ForecastOutcome.fromModel(points);
        } catch (RuntimeException e) {
            log.warn("[EnsembleForecaster] Prediction failed after {} of {} steps, falling back: {}",
                points.size(), horizon, e.getMessage());
        }

        int produced = points.size();
        points.addAll(FallbackTrendEstimator.estimateRemaining(features, produced, horizon, context));
        return new ForecastOutcome(points, horizon - produced);
    }

    // ── training ─────────────────────────────────────────────────────────────

    private TrainedEnsemble train(double[][] base, int window) {
        List<double[]> descriptors = new ArrayList<>();
        List<double[]> labels = new ArrayList<>();
        for (int i = window; i < base.length; i++) {
            descriptors.add(descriptor(slice(base, i - window, i)));
            labels.add(base[i]);
        }

        Instances[] datasets = new Instances[FeatureMatrix.BASE_COLUMN_COUNT];
        RandomForest[] models = new RandomForest[FeatureMatrix.BASE_COLUMN_COUNT];
        for (int target = 0; target < models.length; target++) {
            Instances data = emptyDataset("target_" + target, descriptors.size());
            for (int s = 0; s < descriptors.size(); s++) {
                data.add(new DenseInstance(1.0, withLabel(descriptors.get(s), labels.get(s)[target])));
            }
            RandomForest forest = newForest();
            forest.setNumIterations(numTrees);
            forest.setSeed(seed);
            try {
                forest.buildClassifier(data);
            } catch (Exception e) {
                throw new ModelInferenceException(name(), "Failed to fit forest for target " + target, e);
            }
            datasets[target] = data;
            models[target] = forest;
        }
        log.debug("[EnsembleForecaster] Trained {} forests on {} samples, window={}",
            models.length, descriptors.size(), window);
        return new TrainedEnsemble(datasets, models);
    }

    /**
     * Per-call fitted forests, one per base metric. Never shared between calls.
     */
    private final class TrainedEnsemble {
        private final Instances[] datasets;
        private final RandomForest[] models;

        TrainedEnsemble(Instances[] datasets, RandomForest[] models) {
            this.datasets = datasets;
            this.models = models;
        }

        double[] predict(double[] descriptor) {
            double[] prediction = new double[models.length];
            for (int target = 0; target < models.length; target++) {
                Instance instance = new DenseInstance(1.0, withLabel(descriptor, 0.0));
                instance.setDataset(datasets[target]);
                instance.setClassMissing();
                try {
                    prediction[target] = models[target].classifyInstance(instance);
                } catch (Exception e) {
                    throw new ModelInferenceException(name(), "Prediction failed for target " + target, e);
                }
                if (!Double.isFinite(prediction[target])) {
                    throw new ModelInferenceException(name(), "Non-finite prediction for target " + target);
                }
            }
            return prediction;
        }
    }

    /** One unfitted forest per target metric. */
    RandomForest newForest() {
        return new RandomForest();
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    static double[] descriptor(double[][] window) {
        double[] cpu = WindowStatistics.column(window, FeatureMatrix.CPU);
        double[] memory = WindowStatistics.column(window, FeatureMatrix.MEMORY);
        return new double[] {
            WindowStatistics.mean(cpu),
            WindowStatistics.stdDev(cpu),
            WindowStatistics.mean(memory),
            WindowStatistics.stdDev(memory),
            WindowStatistics.max(cpu),
            WindowStatistics.max(memory)
        };
    }

    private static Instances emptyDataset(String relation, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>(DESCRIPTOR_NAMES.length + 1);
        for (String name : DESCRIPTOR_NAMES) {
            attributes.add(new Attribute(name));
        }
        attributes.add(new Attribute("label"));
        Instances data = new Instances(relation, attributes, capacity);
        data.setClassIndex(attributes.size() - 1);
        return data;
    }

    private static double[] withLabel(double[] descriptor, double label) {
        double[] values = new double[descriptor.length + 1];
        System.arraycopy(descriptor, 0, values, 0, descriptor.length);
        values[descriptor.length] = label;
        return values;
    }

    private static double[][] slice(double[][] rows, int from, int to) {
        double[][] slice = new double[to - from][];
        System.arraycopy(rows, from, slice, 0, to - from);
        return slice;
    }

    private static double[][] slide(double[][] window, double[] next) {
        double[][] shifted = new double[window.length][];
        System.arraycopy(window, 1, shifted, 0, window.length - 1);
        shifted[window.length - 1] = next.clone();
        return shifted;
    }
}
