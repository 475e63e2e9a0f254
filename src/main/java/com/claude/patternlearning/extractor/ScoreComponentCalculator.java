package com.claude.patternlearning.extractor;

import com.claude.patternlearning.entity.Lead;
import com.claude.patternlearning.pattern.ScoreComponent;
import com.claude.patternlearning.pattern.ScoringWeights;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Recomputes a lead's raw component points from its stored attributes. Used by backfill
 * for leads scored before component snapshots were recorded.
 */
@Component
public class ScoreComponentCalculator {

    private static final Map<String, Integer> AUTHORITY_POINTS = new LinkedHashMap<>();

    private static final List<String> TARGET_INDUSTRIES = List.of(
            "technology", "software", "saas", "fintech", "marketing", "professional services",
            "consulting", "healthcare", "real estate", "construction", "manufacturing");

    private static final List<String> PARTIAL_COUNTRIES = List.of(
            "new zealand", "nz", "united states", "us", "usa", "united kingdom", "uk", "gb");

    static {
        // first match wins, so longer titles come before their substrings
        AUTHORITY_POINTS.put("co-founder", 25);
        AUTHORITY_POINTS.put("founder", 25);
        AUTHORITY_POINTS.put("owner", 25);
        AUTHORITY_POINTS.put("ceo", 25);
        AUTHORITY_POINTS.put("chief", 22);
        AUTHORITY_POINTS.put("c-suite", 22);
        AUTHORITY_POINTS.put("vice president", 18);
        AUTHORITY_POINTS.put("president", 22);
        AUTHORITY_POINTS.put("vp", 18);
        AUTHORITY_POINTS.put("director", 15);
        AUTHORITY_POINTS.put("head", 15);
        AUTHORITY_POINTS.put("senior manager", 10);
        AUTHORITY_POINTS.put("manager", 7);
        AUTHORITY_POINTS.put("lead", 7);
    }

    public Map<String, Double> calculate(Lead lead) {
        Map<String, Double> components = new TreeMap<>();
        components.put(ScoreComponent.DATA_QUALITY.getKey(), (double) dataQuality(lead));
        components.put(ScoreComponent.AUTHORITY.getKey(), (double) authority(lead));
        components.put(ScoreComponent.COMPANY_FIT.getKey(), (double) companyFit(lead));
        components.put(ScoreComponent.TIMING.getKey(), (double) timing(lead));
        return components;
    }

    /**
     * Weighted score on the 0-100 scale: each component's share of its maximum times its weight.
     */
    public int score(Map<String, Double> components, ScoringWeights weights) {
        double[] w = weights.toArray();
        double total = 0.0;
        ScoreComponent[] order = ScoreComponent.values();
        for (int i = 0; i < order.length; i++) {
            Double points = components.get(order[i].getKey());
            if (points != null) {
                total += points / order[i].getMaxPoints() * w[i] * 100.0;
            }
        }
        return (int) Math.max(0, Math.min(100, Math.round(total)));
    }

    int dataQuality(Lead lead) {
        int score = 0;
        if (Boolean.TRUE.equals(lead.getEmailVerified())) {
            score += 8;
        }
        if (Boolean.TRUE.equals(lead.getHasPhone())) {
            score += 6;
        }
        if (Boolean.TRUE.equals(lead.getHasLinkedin())) {
            score += 4;
        }
        return Math.min(ScoreComponent.DATA_QUALITY.getMaxPoints(), score);
    }

    int authority(Lead lead) {
        if (lead.getTitle() == null || lead.getTitle().isBlank()) {
            return 0;
        }
        String title = lead.getTitle().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Integer> entry : AUTHORITY_POINTS.entrySet()) {
            if (title.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return 5;
    }

    int companyFit(Lead lead) {
        int score = 0;
        if (lead.getIndustry() != null) {
            String industry = lead.getIndustry().toLowerCase(Locale.ROOT);
            for (String target : TARGET_INDUSTRIES) {
                if (industry.contains(target)) {
                    score += 10;
                    break;
                }
            }
        }
        Integer employees = lead.getEmployeeCount();
        if (employees != null) {
            if (employees >= 5 && employees <= 50) {
                score += 8;
            } else if (employees >= 51 && employees <= 200) {
                score += 5;
            } else if (employees >= 1 && employees <= 4) {
                score += 3;
            }
        }
        if (lead.getCountry() != null) {
            String country = lead.getCountry().trim().toLowerCase(Locale.ROOT);
            if (country.equals("australia") || country.equals("au") || country.equals("aus")) {
                score += 7;
            } else if (PARTIAL_COUNTRIES.contains(country)) {
                score += 4;
            }
        }
        return Math.min(ScoreComponent.COMPANY_FIT.getMaxPoints(), score);
    }

    int timing(Lead lead) {
        int score = 0;
        if (Boolean.TRUE.equals(lead.getNewRole())) {
            score += 6;
        }
        if (Boolean.TRUE.equals(lead.getHiring())) {
            score += 5;
        }
        if (Boolean.TRUE.equals(lead.getRecentlyFunded())) {
            score += 4;
        }
        return Math.min(ScoreComponent.TIMING.getMaxPoints(), score);
    }
}
