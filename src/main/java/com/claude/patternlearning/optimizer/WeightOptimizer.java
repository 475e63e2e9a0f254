package com.claude.patternlearning.optimizer;

import com.claude.patternlearning.pattern.ScoringWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Learns the scoring weight vector from normalized component scores and conversion labels.
 *
 * <p>Model: {@code p = sigmoid(SLOPE * (x·w - CENTER))}. Objective: mean binary
 * cross-entropy plus {@code L2 * |w|²}, minimized over the polytope
 * {@code MIN_WEIGHT <= w_i <= MAX_WEIGHT, sum(w) = TARGET_SUM} by projected gradient
 * descent from the default vector with a fixed step of {@code 1/L}, L being an upper bound
 * on the gradient's Lipschitz constant. The objective is convex and nothing is random,
 * so the same matrix always converges to the same vector.
 *
 * <p>Any failure falls back to {@link ScoringWeights#DEFAULT}.
 */
@Component
@Slf4j
public class WeightOptimizer {

    public static final int MIN_ROWS = 30;

    static final double SLOPE = 8.0;
    static final double CENTER = ScoringWeights.TARGET_SUM / 2.0;
    static final double L2 = 0.05;
    static final double TOLERANCE = 1e-9;
    static final int MAX_ITERATIONS = 100_000;

    private static final int DIMENSIONS = 4;
    private static final int BISECTION_STEPS = 200;
    private static final double ROUNDING_UNIT = 1e-4;
    private static final double ROUNDING_SCALE = 10_000.0;

    public OptimizationResult optimize(double[][] features, boolean[] labels) {
        return optimize(features, labels, MAX_ITERATIONS);
    }

    OptimizationResult optimize(double[][] features, boolean[] labels, int maxIterations) {
        int rows = features.length;
        if (rows < MIN_ROWS || !hasBothClasses(labels)) {
            return OptimizationResult.fallback(OptimizationStatus.INSUFFICIENT_DATA, 0, rows);
        }

        double step = 1.0 / lipschitzBound(features);
        double[] w = ScoringWeights.DEFAULT.toArray();
        double[] gradient = new double[DIMENSIONS];
        double[] candidate = new double[DIMENSIONS];

        int iteration = 0;
        boolean converged = false;
        while (iteration < maxIterations) {
            iteration++;
            gradient(features, labels, w, gradient);
            for (int i = 0; i < DIMENSIONS; i++) {
                candidate[i] = w[i] - step * gradient[i];
            }
            double[] next = project(candidate);
            if (!isFinite(next)) {
                log.warn("Weight optimizer produced a non-finite vector at iteration {}", iteration);
                return OptimizationResult.fallback(OptimizationStatus.INVALID_RESULT, iteration, rows);
            }
            double change = maxAbsDifference(next, w);
            w = next;
            if (change < TOLERANCE) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.warn("Weight optimizer did not converge in {} iterations over {} rows, using defaults",
                    maxIterations, rows);
            return OptimizationResult.fallback(OptimizationStatus.NOT_CONVERGED, iteration, rows);
        }

        ScoringWeights weights = ScoringWeights.of(roundToTarget(w));
        if (!weights.isWithinBounds(1e-9)) {
            log.warn("Weight optimizer result {} is outside the feasible set, using defaults", weights);
            return OptimizationResult.fallback(OptimizationStatus.INVALID_RESULT, iteration, rows);
        }
        return new OptimizationResult(weights, OptimizationStatus.CONVERGED, iteration,
                loss(features, labels, w), rows);
    }

    double loss(double[][] features, boolean[] labels, double[] w) {
        double total = 0.0;
        for (int r = 0; r < features.length; r++) {
            double p = predict(features[r], w);
            p = Math.max(1e-12, Math.min(1 - 1e-12, p));
            total += labels[r] ? -Math.log(p) : -Math.log(1 - p);
        }
        double penalty = 0.0;
        for (double wi : w) {
            penalty += wi * wi;
        }
        return total / features.length + L2 * penalty;
    }

    private void gradient(double[][] features, boolean[] labels, double[] w, double[] out) {
        Arrays.fill(out, 0.0);
        for (int r = 0; r < features.length; r++) {
            double error = predict(features[r], w) - (labels[r] ? 1.0 : 0.0);
            for (int i = 0; i < DIMENSIONS; i++) {
                out[i] += error * SLOPE * features[r][i];
            }
        }
        for (int i = 0; i < DIMENSIONS; i++) {
            out[i] = out[i] / features.length + 2.0 * L2 * w[i];
        }
    }

    private double predict(double[] x, double[] w) {
        double dot = 0.0;
        for (int i = 0; i < DIMENSIONS; i++) {
            dot += x[i] * w[i];
        }
        return 1.0 / (1.0 + Math.exp(-SLOPE * (dot - CENTER)));
    }

    // sigmoid' <= 1/4, so the BCE Hessian is bounded by SLOPE²/4 * max|x|²
    private double lipschitzBound(double[][] features) {
        double maxNormSquared = 0.0;
        for (double[] row : features) {
            double norm = 0.0;
            for (double v : row) {
                norm += v * v;
            }
            maxNormSquared = Math.max(maxNormSquared, norm);
        }
        return SLOPE * SLOPE / 4.0 * maxNormSquared + 2.0 * L2;
    }

    /**
     * Euclidean projection onto the box-constrained simplex: {@code clamp(v_i - tau)} with
     * the shift {@code tau} found by bisection so the components sum to the target.
     */
    static double[] project(double[] v) {
        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        for (double vi : v) {
            low = Math.min(low, vi - ScoringWeights.MAX_WEIGHT);
            high = Math.max(high, vi - ScoringWeights.MIN_WEIGHT);
        }
        for (int i = 0; i < BISECTION_STEPS; i++) {
            double mid = (low + high) / 2.0;
            if (shiftedSum(v, mid) > ScoringWeights.TARGET_SUM) {
                low = mid;
            } else {
                high = mid;
            }
        }
        double tau = (low + high) / 2.0;
        double[] projected = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            projected[i] = clamp(v[i] - tau);
        }
        return projected;
    }

    /**
     * Rounds to four decimals and pushes the rounding residual onto the components with
     * the most room, so the published vector still sums to the target exactly.
     */
    static double[] roundToTarget(double[] w) {
        double[] rounded = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            rounded[i] = roundUnit(w[i]);
        }
        long residualUnits = Math.round((ScoringWeights.TARGET_SUM - sum(rounded)) / ROUNDING_UNIT);
        while (residualUnits != 0) {
            int direction = residualUnits > 0 ? 1 : -1;
            int target = 0;
            double bestSlack = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < rounded.length; i++) {
                double slack = direction > 0
                        ? ScoringWeights.MAX_WEIGHT - rounded[i]
                        : rounded[i] - ScoringWeights.MIN_WEIGHT;
                if (slack > bestSlack) {
                    bestSlack = slack;
                    target = i;
                }
            }
            rounded[target] = roundUnit(rounded[target] + direction * ROUNDING_UNIT);
            residualUnits -= direction;
        }
        return rounded;
    }

    private static double shiftedSum(double[] v, double tau) {
        double total = 0.0;
        for (double vi : v) {
            total += clamp(vi - tau);
        }
        return total;
    }

    private static double clamp(double value) {
        return Math.max(ScoringWeights.MIN_WEIGHT, Math.min(ScoringWeights.MAX_WEIGHT, value));
    }

    private static double roundUnit(double value) {
        return Math.round(value * ROUNDING_SCALE) / ROUNDING_SCALE;
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    private static double maxAbsDifference(double[] a, double[] b) {
        double max = 0.0;
        for (int i = 0; i < a.length; i++) {
            max = Math.max(max, Math.abs(a[i] - b[i]));
        }
        return max;
    }

    private static boolean isFinite(double[] values) {
        for (double v : values) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasBothClasses(boolean[] labels) {
        boolean positive = false;
        boolean negative = false;
        for (boolean label : labels) {
            if (label) {
                positive = true;
            } else {
                negative = true;
            }
        }
        return positive && negative;
    }
}
