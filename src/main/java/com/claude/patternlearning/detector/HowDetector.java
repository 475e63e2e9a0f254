package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.Channel;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.extractor.LeadTier;
import com.claude.patternlearning.pattern.ChannelStat;
import com.claude.patternlearning.pattern.HowPatternPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HOW detector - which channels and channel sequences convert.
 *
 * <p>Works on one journey per terminal lead: the time-ordered channels of its touches,
 * whether it converted, the channel of its booking touch and its score tier.
 */
@Component
@Slf4j
public class HowDetector implements PatternDetector {

    static final int MIN_CONVERTED = 5;
    static final int MIN_JOURNEYS = 20;
    static final int MIN_CHANNEL_SAMPLE = 3;
    static final int MIN_SEQUENCE_SAMPLE = 5;
    static final int MIN_TRANSITIONS = 3;
    static final int SEQUENCE_LENGTH = 3;
    static final int TOP_SEQUENCES = 5;

    static final Comparator<HowPatternPayload.SequenceStat> SEQUENCE_ORDER = Comparator
            .comparingDouble(HowPatternPayload.SequenceStat::getConversionRate).reversed()
            .thenComparing(Comparator.comparingInt(HowPatternPayload.SequenceStat::getSampleSize).reversed())
            .thenComparing(stat -> String.join(">", stat.getSequence()));

    private static final String[] CHANNEL_COUNT_BUCKETS = {"1", "2", "3", "4+"};

    @Override
    public PatternType getPatternType() {
        return PatternType.HOW;
    }

    @Override
    public DetectionResult detect(LearningDataset dataset) {
        List<Journey> journeys = journeys(dataset);
        int total = journeys.size();
        int converted = (int) journeys.stream().filter(j -> j.converted).count();

        if (converted < MIN_CONVERTED || total < MIN_JOURNEYS) {
            log.info("[{}] HOW: insufficient data ({} converted of {} journeys)",
                    dataset.getTenantId(), converted, total);
            return DetectionResult.insufficient(HowPatternPayload.defaults(), total);
        }

        double overallRate = ConversionStats.rate(converted, total);
        Map<String, ChannelStat> firstTouch = firstTouchEffectiveness(journeys, overallRate);
        Map<String, ChannelStat> multiChannel = multiChannelLift(journeys);

        HowPatternPayload payload = HowPatternPayload.builder()
                .bookingChannelDistribution(bookingDistribution(journeys))
                .firstTouchEffectiveness(firstTouch)
                .bestFirstChannel(best(firstTouch))
                .multiChannelLift(multiChannel)
                .optimalChannelCount(best(multiChannel))
                .winningSequences(winningSequences(journeys))
                .channelEffectivenessByTier(effectivenessByTier(journeys))
                .channelTransitions(transitions(journeys))
                .build();

        log.info("[{}] HOW: {} converted of {} journeys", dataset.getTenantId(), converted, total);
        return DetectionResult.of(payload, total, ConversionStats.confidence(converted));
    }

    private List<Journey> journeys(LearningDataset dataset) {
        Map<Long, LeadSample> leads = dataset.leadsById();
        List<Journey> journeys = new ArrayList<>();
        for (Map.Entry<Long, List<TouchSample>> entry : dataset.sequencesByLead().entrySet()) {
            LeadSample lead = leads.get(entry.getKey());
            if (lead == null || entry.getValue().isEmpty()) {
                continue;
            }
            List<Channel> channels = new ArrayList<>();
            Channel bookingChannel = null;
            for (TouchSample touch : entry.getValue()) {
                channels.add(touch.getChannel());
                if (touch.isBookingTouch()) {
                    bookingChannel = touch.getChannel();
                }
            }
            journeys.add(new Journey(channels, lead.isConverted(), bookingChannel, LeadTier.fromScore(lead.getScore())));
        }
        return journeys;
    }

    private Map<String, Double> bookingDistribution(List<Journey> journeys) {
        Map<String, Integer> counts = new TreeMap<>();
        int bookings = 0;
        for (Journey journey : journeys) {
            if (journey.bookingChannel != null) {
                counts.merge(journey.bookingChannel.getCode(), 1, Integer::sum);
                bookings++;
            }
        }
        Map<String, Double> distribution = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            distribution.put(entry.getKey(), ConversionStats.rate(entry.getValue(), bookings));
        }
        return distribution;
    }

    private Map<String, ChannelStat> firstTouchEffectiveness(List<Journey> journeys, double overallRate) {
        Map<String, Tally> tallies = new TreeMap<>();
        for (Journey journey : journeys) {
            tallies.computeIfAbsent(journey.channels.get(0).getCode(), c -> new Tally()).add(journey.converted);
        }
        return channelStats(tallies, overallRate);
    }

    /**
     * Buckets journeys by distinct channel count and compares each bucket with single-channel journeys.
     */
    private Map<String, ChannelStat> multiChannelLift(List<Journey> journeys) {
        Map<String, Tally> tallies = new TreeMap<>();
        for (Journey journey : journeys) {
            int distinct = new LinkedHashSet<>(journey.channels).size();
            tallies.computeIfAbsent(CHANNEL_COUNT_BUCKETS[Math.min(distinct, 4) - 1], b -> new Tally())
                    .add(journey.converted);
        }
        Tally single = tallies.get(CHANNEL_COUNT_BUCKETS[0]);
        double baseline = single != null && single.getTotal() >= MIN_CHANNEL_SAMPLE ? single.rate() : 0.0;
        return channelStats(tallies, baseline);
    }

    List<HowPatternPayload.SequenceStat> winningSequences(List<Journey> journeys) {
        Map<List<ChannelSlot>, Tally> tallies = new TreeMap<>(HowDetector::compareSlots);
        for (Journey journey : journeys) {
            tallies.computeIfAbsent(ChannelSlot.fixedLength(journey.channels, SEQUENCE_LENGTH), k -> new Tally())
                    .add(journey.converted);
        }
        List<HowPatternPayload.SequenceStat> stats = new ArrayList<>();
        for (Map.Entry<List<ChannelSlot>, Tally> entry : tallies.entrySet()) {
            Tally tally = entry.getValue();
            if (tally.getTotal() < MIN_SEQUENCE_SAMPLE) {
                continue;
            }
            stats.add(HowPatternPayload.SequenceStat.builder()
                    .sequence(entry.getKey().stream().map(ChannelSlot::getCode).collect(Collectors.toList()))
                    .conversionRate(tally.rate())
                    .conversions(tally.getConversions())
                    .sampleSize(tally.getTotal())
                    .build());
        }
        stats.sort(SEQUENCE_ORDER);
        return stats.size() > TOP_SEQUENCES ? new ArrayList<>(stats.subList(0, TOP_SEQUENCES)) : stats;
    }

    private Map<String, Map<String, ChannelStat>> effectivenessByTier(List<Journey> journeys) {
        Map<LeadTier, List<Journey>> byTier = new EnumMap<>(LeadTier.class);
        for (Journey journey : journeys) {
            if (journey.tier != null) {
                byTier.computeIfAbsent(journey.tier, t -> new ArrayList<>()).add(journey);
            }
        }
        Map<String, Map<String, ChannelStat>> result = new TreeMap<>();
        for (Map.Entry<LeadTier, List<Journey>> entry : byTier.entrySet()) {
            List<Journey> tierJourneys = entry.getValue();
            int tierConverted = (int) tierJourneys.stream().filter(j -> j.converted).count();
            double tierRate = ConversionStats.rate(tierConverted, tierJourneys.size());
            Map<String, Tally> tallies = new TreeMap<>();
            for (Journey journey : tierJourneys) {
                for (Channel channel : new LinkedHashSet<>(journey.channels)) {
                    tallies.computeIfAbsent(channel.getCode(), c -> new Tally()).add(journey.converted);
                }
            }
            Map<String, ChannelStat> stats = channelStats(tallies, tierRate);
            if (!stats.isEmpty()) {
                result.put(entry.getKey().name().toLowerCase(Locale.ROOT), stats);
            }
        }
        return result;
    }

    /**
     * P(next channel | current channel) over adjacent pairs of converted sequences.
     */
    private Map<String, Map<String, Double>> transitions(List<Journey> journeys) {
        Map<String, Map<String, Integer>> counts = new TreeMap<>();
        for (Journey journey : journeys) {
            if (!journey.converted) {
                continue;
            }
            for (int i = 0; i + 1 < journey.channels.size(); i++) {
                counts.computeIfAbsent(journey.channels.get(i).getCode(), c -> new TreeMap<>())
                        .merge(journey.channels.get(i + 1).getCode(), 1, Integer::sum);
            }
        }
        Map<String, Map<String, Double>> matrix = new TreeMap<>();
        for (Map.Entry<String, Map<String, Integer>> source : counts.entrySet()) {
            int outgoing = source.getValue().values().stream().mapToInt(Integer::intValue).sum();
            if (outgoing < MIN_TRANSITIONS) {
                continue;
            }
            Map<String, Double> row = new TreeMap<>();
            for (Map.Entry<String, Integer> target : source.getValue().entrySet()) {
                row.put(target.getKey(), ConversionStats.rate(target.getValue(), outgoing));
            }
            matrix.put(source.getKey(), row);
        }
        return matrix;
    }

    private Map<String, ChannelStat> channelStats(Map<String, Tally> tallies, double baseline) {
        Map<String, ChannelStat> stats = new TreeMap<>();
        for (Map.Entry<String, Tally> entry : tallies.entrySet()) {
            Tally tally = entry.getValue();
            if (tally.getTotal() < MIN_CHANNEL_SAMPLE) {
                continue;
            }
            stats.put(entry.getKey(), ChannelStat.builder()
                    .conversionRate(tally.rate())
                    .lift(ConversionStats.lift(tally.rate(), baseline))
                    .conversions(tally.getConversions())
                    .sampleSize(tally.getTotal())
                    .build());
        }
        return stats;
    }

    // highest rate, then larger sample, then the first key in sorted order
    private String best(Map<String, ChannelStat> stats) {
        String best = null;
        ChannelStat bestStat = null;
        for (Map.Entry<String, ChannelStat> entry : stats.entrySet()) {
            ChannelStat stat = entry.getValue();
            if (bestStat == null
                    || stat.getConversionRate() > bestStat.getConversionRate()
                    || (stat.getConversionRate() == bestStat.getConversionRate()
                        && stat.getSampleSize() > bestStat.getSampleSize())) {
                best = entry.getKey();
                bestStat = stat;
            }
        }
        return best;
    }

    private static int compareSlots(List<ChannelSlot> a, List<ChannelSlot> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).getCode().compareTo(b.get(i).getCode());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    static final class Journey {
        final List<Channel> channels;
        final boolean converted;
        final Channel bookingChannel;
        final LeadTier tier;

        Journey(List<Channel> channels, boolean converted, Channel bookingChannel, LeadTier tier) {
            this.channels = channels;
            this.converted = converted;
            this.bookingChannel = bookingChannel;
            this.tier = tier;
        }
    }
}
