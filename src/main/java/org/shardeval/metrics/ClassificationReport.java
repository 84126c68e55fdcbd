package org.shardeval.metrics;

import java.util.Locale;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Summary of a classifier's quality over one label space: accuracy, macro precision,
 * per-class precision and the raw confusion matrix.
 */
public final class ClassificationReport {

    private final LabelSpace labelSpace;
    private final double accuracy;
    private final double macroPrecision;
    private final double[] classPrecision;
    private final ConfusionMatrix confusionMatrix;

    ClassificationReport(LabelSpace labelSpace, double accuracy, double macroPrecision, double[] classPrecision,
                         ConfusionMatrix confusionMatrix) {
        this.labelSpace = Objects.requireNonNull(labelSpace, "labelSpace");
        this.accuracy = accuracy;
        this.macroPrecision = macroPrecision;
        this.classPrecision = classPrecision.clone();
        this.confusionMatrix = Objects.requireNonNull(confusionMatrix, "confusionMatrix");
    }

    public LabelSpace getLabelSpace() {
        return labelSpace;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public double getMacroPrecision() {
        return macroPrecision;
    }

    /**
     * Returns the precision of one class.
     *
     * @param classIndex class index in the label space.
     * @return TP / (TP + FP), or 0 if the class was never predicted.
     */
    public double getClassPrecision(int classIndex) {
        return classPrecision[classIndex];
    }

    public ConfusionMatrix getConfusionMatrix() {
        return confusionMatrix;
    }

    /**
     * Renders the report with numeric labels.
     *
     * @return multi-line text.
     */
    public String format() {
        return format(String::valueOf);
    }

    /**
     * Renders the report, naming each label with {@code labelNames}.
     *
     * @param labelNames maps a label (not a class index) to its display name.
     * @return multi-line text.
     */
    public String format(IntFunction<String> labelNames) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "Accuracy: %.4f%n", accuracy));
        sb.append(String.format(Locale.ROOT, "Precision (macro): %.4f%n", macroPrecision));
        for (int c = 0; c < labelSpace.size(); c++) {
            sb.append(String.format(Locale.ROOT, "  %-8s %.4f%n", labelNames.apply(labelSpace.labelAt(c)), classPrecision[c]));
        }
        sb.append("Confusion Matrix (rows: true, columns: predicted)").append(System.lineSeparator());
        sb.append(String.format(Locale.ROOT, "  %-8s", ""));
        for (int p = 0; p < labelSpace.size(); p++) {
            sb.append(String.format(Locale.ROOT, " %10s", labelNames.apply(labelSpace.labelAt(p))));
        }
        sb.append(System.lineSeparator());
        for (int t = 0; t < labelSpace.size(); t++) {
            sb.append(String.format(Locale.ROOT, "  %-8s", labelNames.apply(labelSpace.labelAt(t))));
            for (int p = 0; p < labelSpace.size(); p++) {
                sb.append(String.format(Locale.ROOT, " %10.1f", confusionMatrix.get(t, p)));
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ClassificationReport{classes=%d, accuracy=%.4f, macroPrecision=%.4f}",
            labelSpace.size(), accuracy, macroPrecision);
    }
}
