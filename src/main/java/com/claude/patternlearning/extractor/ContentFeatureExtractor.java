package com.claude.patternlearning.extractor;

import com.claude.patternlearning.entity.Lead;
import com.claude.patternlearning.entity.Touch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw message text into the signals mined by the WHAT detector.
 * All methods are pure; the same text always yields the same features.
 */
@Component
public class ContentFeatureExtractor {

    public static final String HAS_COMPANY_MENTION = "has_company_mention";
    public static final String HAS_FIRST_NAME = "has_first_name";
    public static final String HAS_RECENT_NEWS = "has_recent_news";
    public static final String HAS_MUTUAL_CONNECTION = "has_mutual_connection";
    public static final String HAS_INDUSTRY_SPECIFIC = "has_industry_specific";

    private static final Map<String, List<Pattern>> PAIN_POINTS = new LinkedHashMap<>();
    private static final Map<String, List<Pattern>> ANGLES = new LinkedHashMap<>();
    private static final Map<String, Pattern> SUBJECT_PATTERNS = new LinkedHashMap<>();

    // checked in order, the first phrase found wins
    private static final List<String> CTA_PHRASES = List.of(
            "open to a quick chat",
            "worth 15 minutes",
            "worth a conversation",
            "free audit",
            "free analysis",
            "quick call",
            "schedule a call",
            "book a time",
            "interested in learning",
            "happy to share",
            "let me know",
            "thoughts?",
            "make sense to connect",
            "grab 15 minutes",
            "coffee chat",
            "worth exploring",
            "quick question");

    private static final Pattern RECENT_NEWS = Pattern.compile(
            "\\b(noticed|saw|congrats|congratulations|just saw|read about|heard about)\\b");
    private static final Pattern MUTUAL_CONNECTION = Pattern.compile(
            "\\b(mutual|connection|referred|introduced|recommended)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static {
        PAIN_POINTS.put("leads", keywords("leads", "pipeline", "prospects", "opportunities",
                "qualified", "mql", "sql", "inbound", "lead gen"));
        PAIN_POINTS.put("revenue", keywords("revenue", "sales", "growth", "roi", "profit",
                "income", "deals", "closed", "won", "booking"));
        PAIN_POINTS.put("time", keywords("time", "hours", "manual", "automate", "efficiency",
                "busy", "bandwidth", "overwhelmed", "tedious", "repetitive"));
        PAIN_POINTS.put("scaling", keywords("scale", "scaling", "growth", "capacity", "bandwidth",
                "hire", "team", "expand", "growing", "bottleneck"));
        PAIN_POINTS.put("competition", keywords("competitors", "competition", "market share", "behind",
                "catching up", "losing", "threat", "outpace"));
        PAIN_POINTS.put("cost", keywords("cost", "expensive", "budget", "waste", "spending",
                "save", "afford", "price", "investment", "roi"));
        PAIN_POINTS.put("quality", keywords("quality", "results", "performance", "outcomes",
                "better", "improve", "consistent", "reliable"));
        PAIN_POINTS.put("clients", keywords("clients", "customers", "retention", "churn",
                "satisfaction", "referrals", "testimonials", "reviews"));

        ANGLES.put("roi_focused", keywords("roi", "return", "revenue", "profit", "save", "increase", "boost"));
        ANGLES.put("social_proof", keywords("clients like", "companies like", "case study", "helped", "worked with"));
        ANGLES.put("curiosity", keywords("noticed", "wondering", "quick question", "curious", "saw that"));
        ANGLES.put("fear_based", keywords("missing out", "losing", "behind", "risk", "problem", "struggle"));
        ANGLES.put("value_add", keywords("free", "complimentary", "audit", "analysis", "no cost"));
        ANGLES.put("authority", keywords("expert", "specialist", "experience", "trusted", "leading"));

        SUBJECT_PATTERNS.put("question_about", Pattern.compile("question.*(about|for|regarding)"));
        SUBJECT_PATTERNS.put("quick_question", Pattern.compile("^quick\\s+question"));
        SUBJECT_PATTERNS.put("reply_style", Pattern.compile("^re:"));
        SUBJECT_PATTERNS.put("idea_for", Pattern.compile("idea\\s+for"));
        SUBJECT_PATTERNS.put("thought_about", Pattern.compile("thought\\s+(about|for)"));
        SUBJECT_PATTERNS.put("personalized", Pattern.compile("\\{company\\}|\\{first_name\\}"));
    }

    private static List<Pattern> keywords(String... words) {
        List<Pattern> patterns = new ArrayList<>(words.length);
        for (String word : words) {
            patterns.add(Pattern.compile("\\b" + Pattern.quote(word) + "\\b"));
        }
        return patterns;
    }

    public ContentSnapshot extract(Touch touch, Lead lead) {
        String subject = touch.getSubject();
        String body = touch.getBody() != null ? touch.getBody() : "";
        String fullText = subject != null ? subject + "\n" + body : body;
        Map<String, Boolean> flags = detectPersonalization(body,
                lead != null ? lead.getFirstName() : null,
                lead != null ? lead.getCompanyName() : null,
                lead != null ? lead.getIndustry() : null);

        return ContentSnapshot.builder()
                .channel(touch.getChannel() != null ? touch.getChannel().getCode() : null)
                .subject(subject)
                .painPoints(detectPainPoints(fullText))
                .cta(detectCta(body))
                .angles(detectAngles(fullText))
                .hasCompanyMention(flags.get(HAS_COMPANY_MENTION))
                .hasFirstName(flags.get(HAS_FIRST_NAME))
                .hasRecentNews(flags.get(HAS_RECENT_NEWS))
                .hasMutualConnection(flags.get(HAS_MUTUAL_CONNECTION))
                .hasIndustrySpecific(flags.get(HAS_INDUSTRY_SPECIFIC))
                .wordCount(wordCount(body))
                .charCount(body.length())
                .touchNumber(touch.getTouchNumber())
                .sequenceId(touch.getSequenceId())
                .build();
    }

    /**
     * Pain-point categories mentioned in the text, one entry per category, in vocabulary order.
     */
    public List<String> detectPainPoints(String text) {
        return matchGroups(PAIN_POINTS, text);
    }

    public List<String> detectAngles(String text) {
        return matchGroups(ANGLES, text);
    }

    public String detectCta(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : CTA_PHRASES) {
            if (lower.contains(phrase)) {
                return phrase;
            }
        }
        return null;
    }

    public List<String> detectSubjectPatterns(String subject) {
        if (subject == null || subject.isBlank()) {
            return Collections.emptyList();
        }
        String lower = subject.trim().toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : SUBJECT_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(lower).find()) {
                found.add(entry.getKey());
            }
        }
        return found;
    }

    public Map<String, Boolean> detectPersonalization(String text, String firstName, String companyName, String industry) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        String lower = text != null ? text.toLowerCase(Locale.ROOT) : "";
        flags.put(HAS_COMPANY_MENTION, mentions(lower, companyName));
        flags.put(HAS_FIRST_NAME, mentions(lower, firstName));
        flags.put(HAS_RECENT_NEWS, RECENT_NEWS.matcher(lower).find());
        flags.put(HAS_MUTUAL_CONNECTION, MUTUAL_CONNECTION.matcher(lower).find());
        flags.put(HAS_INDUSTRY_SPECIFIC, mentions(lower, industry));
        return flags;
    }

    public int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return (int) Arrays.stream(WHITESPACE.split(text.trim())).filter(s -> !s.isEmpty()).count();
    }

    private List<String> matchGroups(Map<String, List<Pattern>> groups, String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        for (Map.Entry<String, List<Pattern>> group : groups.entrySet()) {
            for (Pattern keyword : group.getValue()) {
                if (keyword.matcher(lower).find()) {
                    found.add(group.getKey());
                    break;
                }
            }
        }
        return found;
    }

    private boolean mentions(String lowerText, String term) {
        if (term == null || term.isBlank()) {
            return false;
        }
        return lowerText.contains(term.trim().toLowerCase(Locale.ROOT));
    }
}
