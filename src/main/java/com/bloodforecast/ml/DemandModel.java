package com.bloodforecast.ml;

import smile.data.DataFrame;
import smile.data.Tuple;
import smile.data.formula.Formula;
import smile.regression.RandomForest;
import smile.regression.RegressionTree;

import java.io.Serial;
import java.io.Serializable;

/**
 * Random-forest demand regressor over the encoded feature row produced by
 * {@link TrainedModel#featureRow}. Immutable once fitted.
 */
public final class DemandModel implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    static final String TARGET = "demand_units";

    static final String[] FEATURES = {
        "blood_type", "region", "season", "day_of_week", "month", "disease_outbreak", "is_monsoon"
    };

    private static final String[] COLUMNS = columns();

    private final RandomForest forest;
    private final double trainingScore;

    private DemandModel(RandomForest forest, double trainingScore) {
        this.forest = forest;
        this.trainingScore = trainingScore;
    }

    /**
     * Fits the forest. {@code featuresPerSplit} is the number of candidate predictors drawn at
     * each split; values outside {@code 1..FEATURES.length} mean all of them.
     */
    public static DemandModel fit(double[][] features, double[] targets,
                                  int trees, int featuresPerSplit, int maxDepth, int nodeSize) {
        if (features.length == 0 || features.length != targets.length) {
            throw new IllegalArgumentException(
                "features and targets must be non-empty and of equal length: " + features.length + " vs " + targets.length);
        }
        double[][] rows = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            rows[i] = withTarget(features[i], targets[i]);
        }
        DataFrame data = DataFrame.of(rows, COLUMNS);
        int mtry = featuresPerSplit >= 1 && featuresPerSplit <= FEATURES.length ? featuresPerSplit : FEATURES.length;
        int maxNodes = Math.max(2, rows.length / nodeSize);
        RandomForest forest = RandomForest.fit(
            Formula.lhs(TARGET), data, trees, mtry, maxDepth, maxNodes, nodeSize, 1.0);

        DemandModel model = new DemandModel(forest, 0.0);
        return new DemandModel(forest, model.score(features, targets));
    }

    /** Mean of the per-tree predictions. */
    public double predict(double[] features) {
        double[] perTree = predictPerTree(features);
        double sum = 0.0;
        for (double p : perTree) {
            sum += p;
        }
        return sum / perTree.length;
    }

    public double[] predictPerTree(double[] features) {
        Tuple xt = toTuple(features);
        RegressionTree[] trees = forest.trees();
        double[] predictions = new double[trees.length];
        for (int i = 0; i < trees.length; i++) {
            predictions[i] = trees[i].predict(xt);
        }
        return predictions;
    }

    /** Coefficient of determination on the training rows. */
    public double trainingScore() {
        return trainingScore;
    }

    public int size() {
        return forest.size();
    }

    private double score(double[][] features, double[] targets) {
        double mean = 0.0;
        for (double t : targets) {
            mean += t;
        }
        mean /= targets.length;

        double residual = 0.0;
        double total = 0.0;
        for (int i = 0; i < features.length; i++) {
            double error = targets[i] - predict(features[i]);
            residual += error * error;
            total += (targets[i] - mean) * (targets[i] - mean);
        }
        return total > 0.0 ? 1.0 - residual / total : 0.0;
    }

    // The target is the last training column, so the trees index predictors in FEATURES order.
    private static Tuple toTuple(double[] features) {
        if (features.length != FEATURES.length) {
            throw new IllegalArgumentException("expected " + FEATURES.length + " features, got " + features.length);
        }
        return DataFrame.of(new double[][] {features}, FEATURES).get(0);
    }

    private static double[] withTarget(double[] features, double target) {
        if (features.length != FEATURES.length) {
            throw new IllegalArgumentException("expected " + FEATURES.length + " features, got " + features.length);
        }
        double[] row = new double[FEATURES.length + 1];
        System.arraycopy(features, 0, row, 0, features.length);
        row[FEATURES.length] = target;
        return row;
    }

    private static String[] columns() {
        String[] columns = new String[FEATURES.length + 1];
        System.arraycopy(FEATURES, 0, columns, 0, FEATURES.length);
        columns[FEATURES.length] = TARGET;
        return columns;
    }
}
