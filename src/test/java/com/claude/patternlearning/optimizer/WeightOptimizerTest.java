package com.claude.patternlearning.optimizer;

import com.claude.patternlearning.pattern.ScoringWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("WeightOptimizer")
class WeightOptimizerTest {

    private final WeightOptimizer optimizer = new WeightOptimizer();

    // authority separates the classes, every other component is flat
    private static double[][] authorityPredictive(int rows, boolean[] labels) {
        double[][] features = new double[rows][];
        for (int r = 0; r < rows; r++) {
            labels[r] = r % 3 == 0;
            features[r] = new double[]{0.5, labels[r] ? 0.9 : 0.2, 0.5, 0.5};
        }
        return features;
    }

    @Test
    @DisplayName("raises the weight of the predictive component inside the feasible set")
    void learnsPredictiveComponent() {
        boolean[] labels = new boolean[120];
        double[][] features = authorityPredictive(120, labels);

        OptimizationResult result = optimizer.optimize(features, labels);

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.CONVERGED);
        assertThat(result.getIterations()).isPositive().isLessThan(WeightOptimizer.MAX_ITERATIONS);
        assertThat(result.getRows()).isEqualTo(120);
        ScoringWeights weights = result.getWeights();
        assertThat(weights.isWithinBounds(1e-9)).isTrue();
        assertThat(weights.sum()).isCloseTo(ScoringWeights.TARGET_SUM, within(1e-9));
        assertThat(weights.getAuthority()).isGreaterThan(ScoringWeights.DEFAULT.getAuthority());
    }

    @Test
    @DisplayName("returns the same vector for the same input")
    void deterministic() {
        boolean[] labels = new boolean[90];
        double[][] features = authorityPredictive(90, labels);

        OptimizationResult first = optimizer.optimize(features, labels);
        OptimizationResult second = optimizer.optimize(features, labels);

        assertThat(second.getWeights()).isEqualTo(first.getWeights());
        assertThat(second.getIterations()).isEqualTo(first.getIterations());
    }

    @Test
    @DisplayName("falls back to defaults below the row minimum")
    void tooFewRows() {
        boolean[] labels = new boolean[WeightOptimizer.MIN_ROWS - 1];
        double[][] features = authorityPredictive(labels.length, labels);

        OptimizationResult result = optimizer.optimize(features, labels);

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.INSUFFICIENT_DATA);
        assertThat(result.getWeights()).isEqualTo(ScoringWeights.DEFAULT);
        assertThat(result.getIterations()).isZero();
    }

    @Test
    @DisplayName("falls back to defaults when only one class is present")
    void singleClass() {
        double[][] features = new double[50][];
        Arrays.fill(features, new double[]{0.4, 0.6, 0.3, 0.2});
        boolean[] labels = new boolean[50];

        OptimizationResult result = optimizer.optimize(features, labels);

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.INSUFFICIENT_DATA);
        assertThat(result.getWeights()).isEqualTo(ScoringWeights.DEFAULT);
    }

    @Test
    @DisplayName("falls back to defaults when the iteration cap is hit")
    void notConverged() {
        boolean[] labels = new boolean[60];
        double[][] features = authorityPredictive(60, labels);

        OptimizationResult result = optimizer.optimize(features, labels, 1);

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.NOT_CONVERGED);
        assertThat(result.isConverged()).isFalse();
        assertThat(result.getWeights()).isEqualTo(ScoringWeights.DEFAULT);
    }

    @Test
    @DisplayName("projects onto the bounded simplex")
    void projection() {
        double[] equal = WeightOptimizer.project(new double[]{1.0, 1.0, 1.0, 1.0});
        assertThat(equal).containsExactly(new double[]{0.2125, 0.2125, 0.2125, 0.2125}, within(1e-9));

        double[] skewed = WeightOptimizer.project(new double[]{0.9, 0.0, 0.0, 0.0});
        assertThat(skewed[0]).isCloseTo(ScoringWeights.MAX_WEIGHT, within(1e-12));
        assertThat(skewed[1]).isCloseTo(0.35 / 3, within(1e-9));
        assertThat(Arrays.stream(skewed).sum()).isCloseTo(ScoringWeights.TARGET_SUM, within(1e-9));
    }

    @Test
    @DisplayName("rounds to four decimals without losing the target sum")
    void roundingKeepsSum() {
        double[] rounded = WeightOptimizer.roundToTarget(new double[]{0.21234, 0.21234, 0.21234, 0.21298});

        assertThat(rounded).containsExactly(new double[]{0.2124, 0.2123, 0.2123, 0.2130}, within(1e-12));
        assertThat(ScoringWeights.of(rounded).isWithinBounds(1e-9)).isTrue();
    }
}
