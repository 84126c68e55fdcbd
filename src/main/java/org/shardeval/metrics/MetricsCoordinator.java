package org.shardeval.metrics;

import java.util.List;
import java.util.Objects;

import org.shardeval.api.dispatch.ITaskDispatcher;
import org.shardeval.api.partition.IPartitionedSequence;
import org.shardeval.config.MetricsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for computing classification metrics over partitioned label sequences.
 * <p>
 * Each operation is a sequence of scatter/gather rounds run by a {@link ScatterGatherDriver}:
 * label-space discovery first (where the metric needs it), then one round per metric. Local
 * statistics are computed on the worker owning each partition; only the small partial results
 * travel back and are combined by {@link GlobalReducer}.
 * <p>
 * Every failure is fatal for the whole operation and surfaces as a {@link MetricsException};
 * no partial metric is ever returned.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try (LocalWorkerPool pool = LocalWorkerPool.fromConfig(config)) {
 *     MetricsCoordinator metrics = new MetricsCoordinator(pool, config);
 *     double accuracy = metrics.computeAccuracy(yTrue, yPred);
 *     double precision = metrics.computePrecision(yTrue, yPred, AveragingMode.MACRO);
 *     ConfusionMatrix cm = metrics.computeConfusionMatrix(yTrue, yPred, NormalizeMode.TRUE);
 * }
 * }</pre>
 */
public class MetricsCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MetricsCoordinator.class);

    private final ScatterGatherDriver driver;
    private final LabelSpaceResolver labelSpaceResolver;
    private final MetricsConfig config;

    /**
     * Creates a coordinator.
     *
     * @param dispatcher submits partition-local units to workers.
     * @param config     round timeout and default modes.
     */
    public MetricsCoordinator(ITaskDispatcher dispatcher, MetricsConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.driver = new ScatterGatherDriver(dispatcher, config.getRoundTimeout());
        this.labelSpaceResolver = new LabelSpaceResolver(driver);
    }

    /**
     * Discovers the sorted distinct labels of a partitioned sequence.
     *
     * @param trueLabels the partitioned labels.
     * @return the label space.
     */
    public LabelSpace resolveLabelSpace(IPartitionedSequence<int[]> trueLabels) {
        return labelSpaceResolver.resolve(trueLabels);
    }

    /**
     * Computes the fraction of rows whose prediction equals the true label.
     *
     * @param yTrue true labels.
     * @param yPred predicted labels, partition-aligned with {@code yTrue}.
     * @return accuracy in {@code [0, 1]}.
     */
    public double computeAccuracy(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred) {
        AlignedLabels aligned = AlignedLabels.of(yTrue, yPred);
        requireRows(aligned);
        return accuracy(aligned);
    }

    /**
     * Computes precision with the configured default averaging mode.
     *
     * @param yTrue true labels.
     * @param yPred predicted labels, partition-aligned with {@code yTrue}.
     * @return the precision.
     */
    public double computePrecision(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred) {
        return computePrecision(yTrue, yPred, config.getDefaultAveraging());
    }

    /**
     * Computes precision over the label space of {@code yTrue}.
     *
     * @param yTrue true labels.
     * @param yPred predicted labels, partition-aligned with {@code yTrue}.
     * @param mode  averaging mode.
     * @return the precision.
     * @throws MetricsException {@link ErrorKind#INVALID_AVERAGING_MODE} for binary averaging over more
     *                          than two classes, {@link ErrorKind#DEGENERATE_LABEL_SPACE} for a
     *                          single class.
     */
    public double computePrecision(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred,
                                   AveragingMode mode) {
        Objects.requireNonNull(mode, "mode");
        AlignedLabels aligned = AlignedLabels.of(yTrue, yPred);
        requireRows(aligned);
        LabelSpace labelSpace = labelSpaceResolver.resolve(aligned.yTrue());
        GlobalReducer.checkPrecisionDefined(labelSpace.size(), mode);
        return GlobalReducer.precision(tpFp(aligned, labelSpace), mode);
    }

    /**
     * Computes the confusion matrix with the configured default normalization.
     *
     * @param yTrue true labels.
     * @param yPred predicted labels, partition-aligned with {@code yTrue}.
     * @return the matrix over the label space of {@code yTrue}.
     */
    public ConfusionMatrix computeConfusionMatrix(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred) {
        return computeConfusionMatrix(yTrue, yPred, config.getDefaultNormalize(), null);
    }

    public ConfusionMatrix computeConfusionMatrix(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred,
                                                  NormalizeMode mode) {
        return computeConfusionMatrix(yTrue, yPred, mode, null);
    }

    /**
     * Computes the (weighted) confusion matrix over the label space of {@code yTrue}.
     * <p>
     * Rows whose true or predicted label lies outside the label space are dropped.
     *
     * @param yTrue   true labels.
     * @param yPred   predicted labels, partition-aligned with {@code yTrue}.
     * @param mode    normalization.
     * @param weights per-row weights aligned with {@code yTrue}, or {@code null} for weight 1.
     * @return the matrix.
     */
    public ConfusionMatrix computeConfusionMatrix(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred,
                                                  NormalizeMode mode, IPartitionedSequence<double[]> weights) {
        Objects.requireNonNull(mode, "mode");
        AlignedLabels aligned = AlignedLabels.of(yTrue, yPred, weights);
        requireRows(aligned);
        LabelSpace labelSpace = labelSpaceResolver.resolve(aligned.yTrue());
        return confusion(aligned, labelSpace, mode);
    }

    /**
     * Computes accuracy, macro precision, per-class precision and the raw confusion matrix over a
     * single resolved label space, and logs the result.
     *
     * @param yTrue true labels.
     * @param yPred predicted labels, partition-aligned with {@code yTrue}.
     * @return the report.
     */
    public ClassificationReport evaluate(IPartitionedSequence<int[]> yTrue, IPartitionedSequence<int[]> yPred) {
        AlignedLabels aligned = AlignedLabels.of(yTrue, yPred);
        requireRows(aligned);
        LabelSpace labelSpace = labelSpaceResolver.resolve(aligned.yTrue());
        GlobalReducer.checkPrecisionDefined(labelSpace.size(), AveragingMode.MACRO);

        double accuracy = accuracy(aligned);
        TpFpTable table = tpFp(aligned, labelSpace);
        ConfusionMatrix matrix = confusion(aligned, labelSpace, NormalizeMode.NONE);

        ClassificationReport report = new ClassificationReport(labelSpace, accuracy,
            GlobalReducer.precision(table, AveragingMode.MACRO), GlobalReducer.perClassPrecision(table), matrix);
        log.info("Evaluated {} rows over {} partitions: accuracy={}, macro precision={}",
            aligned.totalLength(), aligned.partitions().size(), accuracy, report.getMacroPrecision());
        return report;
    }

    private double accuracy(AlignedLabels aligned) {
        List<Long> correct = driver.dispatch("accuracy", aligned.partitions(),
            partition -> LocalStatComputer.countCorrect(aligned.trueSlice(partition), aligned.predSlice(partition)));
        return GlobalReducer.accuracy(correct, aligned.totalLength());
    }

    private TpFpTable tpFp(AlignedLabels aligned, LabelSpace labelSpace) {
        List<TpFpTable> partials = driver.dispatch("precision", aligned.partitions(),
            partition -> LocalStatComputer.sumTpFp(aligned.trueSlice(partition), aligned.predSlice(partition), labelSpace));
        return GlobalReducer.sumTpFp(partials, labelSpace.size());
    }

    private ConfusionMatrix confusion(AlignedLabels aligned, LabelSpace labelSpace, NormalizeMode mode) {
        List<ConfusionMatrix> partials = driver.dispatch("confusion-matrix", aligned.partitions(),
            partition -> LocalStatComputer.localConfusion(aligned.trueSlice(partition), aligned.predSlice(partition),
                aligned.weightSlice(partition), labelSpace));
        return GlobalReducer.confusionMatrix(partials, labelSpace, mode);
    }

    private static void requireRows(AlignedLabels aligned) {
        if (aligned.totalLength() == 0) {
            throw new MetricsException(ErrorKind.EMPTY_INPUT, "y_true and y_pred hold no rows");
        }
    }
}
