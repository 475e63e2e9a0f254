package com.claude.patternlearning.extractor;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collapses free-text job titles into canonical groups so that
 * "Chief Executive Officer" and "CEO & Founder" rank together.
 */
@Component
public class TitleNormalizer {

    private static final Map<Pattern, String> CANONICAL = new LinkedHashMap<>();

    static {
        CANONICAL.put(word("ceo|chief executive"), "CEO");
        CANONICAL.put(word("cmo|chief marketing"), "CMO");
        CANONICAL.put(word("cfo|chief financial"), "CFO");
        CANONICAL.put(word("coo|chief operating"), "COO");
        CANONICAL.put(word("cto|chief technology"), "CTO");
        CANONICAL.put(word("owner|founder|co-founder"), "Owner");
        CANONICAL.put(word("marketing director|director of marketing"), "Marketing Director");
        CANONICAL.put(word("sales director|director of sales"), "Sales Director");
    }

    private static Pattern word(String alternatives) {
        return Pattern.compile("\\b(" + alternatives + ")\\b");
    }

    /**
     * @return the canonical group, the title in title case, or {@code null} for a blank title
     */
    public String normalize(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        String lower = title.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> entry : CANONICAL.entrySet()) {
            if (entry.getKey().matcher(lower).find()) {
                return entry.getValue();
            }
        }
        return titleCase(lower);
    }

    private String titleCase(String lower) {
        StringBuilder sb = new StringBuilder(lower.length());
        boolean startOfWord = true;
        for (char c : lower.toCharArray()) {
            if (Character.isWhitespace(c)) {
                if (!startOfWord) {
                    sb.append(' ');
                }
                startOfWord = true;
                continue;
            }
            sb.append(startOfWord ? Character.toUpperCase(c) : c);
            startOfWord = false;
        }
        return sb.toString();
    }
}
