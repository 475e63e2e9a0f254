package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.extractor.SizeBucket;
import com.claude.patternlearning.extractor.TitleNormalizer;
import com.claude.patternlearning.optimizer.OptimizationResult;
import com.claude.patternlearning.optimizer.WeightOptimizer;
import com.claude.patternlearning.pattern.RankedValue;
import com.claude.patternlearning.pattern.ScoreComponent;
import com.claude.patternlearning.pattern.WhoPatternPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * WHO detector - which leads convert.
 *
 * <p>Ranks title, industry and company-size values by conversion rate, measures the lift of
 * the timing signals and learns a scoring weight vector from the component-score snapshots.
 */
@Component
@Slf4j
public class WhoDetector implements PatternDetector {

    static final int MIN_CONVERTED = 10;
    static final int MIN_TOTAL = 30;
    static final int MIN_VALUE_SAMPLE = 5;
    static final int MIN_SIGNAL_SAMPLE = 5;
    static final int TOP_VALUES = 10;

    private final WeightOptimizer weightOptimizer;
    private final TitleNormalizer titleNormalizer;

    public WhoDetector(WeightOptimizer weightOptimizer, TitleNormalizer titleNormalizer) {
        this.weightOptimizer = weightOptimizer;
        this.titleNormalizer = titleNormalizer;
    }

    @Override
    public PatternType getPatternType() {
        return PatternType.WHO;
    }

    @Override
    public DetectionResult detect(LearningDataset dataset) {
        List<LeadSample> leads = dataset.getLeads();
        int total = leads.size();
        int converted = (int) leads.stream().filter(LeadSample::isConverted).count();

        if (converted < MIN_CONVERTED || total < MIN_TOTAL) {
            log.info("[{}] WHO: insufficient data ({} converted of {} leads)",
                    dataset.getTenantId(), converted, total);
            return DetectionResult.insufficient(WhoPatternPayload.defaults(converted, total), total);
        }

        double overallRate = ConversionStats.rate(converted, total);

        List<RankedValue> titles = ConversionStats.rank(
                tally(leads, lead -> titleNormalizer.normalize(lead.getTitle())),
                overallRate, MIN_VALUE_SAMPLE, TOP_VALUES);
        List<RankedValue> industries = ConversionStats.rank(
                tally(leads, lead -> normalizeIndustry(lead.getIndustry())),
                overallRate, MIN_VALUE_SAMPLE, TOP_VALUES);
        List<RankedValue> sizes = ConversionStats.rank(
                tally(leads, lead -> SizeBucket.labelOf(lead.getEmployeeCount())),
                overallRate, MIN_VALUE_SAMPLE, Integer.MAX_VALUE);

        WhoPatternPayload.TimingSignals timingSignals = WhoPatternPayload.TimingSignals.builder()
                .newRoleLift(signalLift(leads, LeadSample::isNewRole))
                .hiringLift(signalLift(leads, LeadSample::isHiring))
                .fundedLift(signalLift(leads, LeadSample::isRecentlyFunded))
                .build();

        OptimizationResult optimization = optimizeWeights(leads);
        log.info("[{}] WHO: {} converted of {} leads, optimizer {} after {} iterations on {} rows",
                dataset.getTenantId(), converted, total, optimization.getStatus(),
                optimization.getIterations(), optimization.getRows());

        WhoPatternPayload payload = WhoPatternPayload.builder()
                .titleRankings(titles)
                .industryRankings(industries)
                .sizeAnalysis(WhoPatternPayload.SizeAnalysis.builder()
                        .sweetSpot(sizes.isEmpty() ? null : sizes.get(0).getValue())
                        .distribution(sizes)
                        .build())
                .timingSignals(timingSignals)
                .recommendedWeights(optimization.getWeights())
                .optimizerStatus(optimization.getStatus().name())
                .overallConversionRate(overallRate)
                .convertedCount(converted)
                .totalCount(total)
                .build();

        return DetectionResult.of(payload, total, ConversionStats.confidence(converted));
    }

    private Map<String, Tally> tally(List<LeadSample> leads, Function<LeadSample, String> field) {
        Map<String, Tally> tallies = new TreeMap<>();
        for (LeadSample lead : leads) {
            String value = field.apply(lead);
            if (value != null) {
                tallies.computeIfAbsent(value, v -> new Tally()).add(lead.isConverted());
            }
        }
        return tallies;
    }

    /**
     * Rate among flagged leads over rate among unflagged ones; 1.0 when either side is too thin.
     */
    double signalLift(List<LeadSample> leads, Predicate<LeadSample> signal) {
        Tally flagged = new Tally();
        Tally unflagged = new Tally();
        for (LeadSample lead : leads) {
            (signal.test(lead) ? flagged : unflagged).add(lead.isConverted());
        }
        if (flagged.getTotal() < MIN_SIGNAL_SAMPLE || unflagged.getTotal() < MIN_SIGNAL_SAMPLE) {
            return 1.0;
        }
        return ConversionStats.lift(flagged.rate(), unflagged.rate());
    }

    private OptimizationResult optimizeWeights(List<LeadSample> leads) {
        List<double[]> rows = new ArrayList<>();
        List<Boolean> labels = new ArrayList<>();
        ScoreComponent[] components = ScoreComponent.values();
        for (LeadSample lead : leads) {
            double[] row = new double[components.length];
            boolean complete = true;
            for (int i = 0; i < components.length; i++) {
                Double points = lead.getScoreComponents().get(components[i].getKey());
                if (points == null || points.isNaN()) {
                    complete = false;
                    break;
                }
                row[i] = Math.max(0.0, Math.min(1.0, points / components[i].getMaxPoints()));
            }
            if (complete) {
                rows.add(row);
                labels.add(lead.isConverted());
            }
        }
        boolean[] labelArray = new boolean[labels.size()];
        for (int i = 0; i < labelArray.length; i++) {
            labelArray[i] = labels.get(i);
        }
        return weightOptimizer.optimize(rows.toArray(new double[0][]), labelArray);
    }

    private String normalizeIndustry(String industry) {
        if (industry == null || industry.isBlank()) {
            return null;
        }
        return industry.trim();
    }
}
