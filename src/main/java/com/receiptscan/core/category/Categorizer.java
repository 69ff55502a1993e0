package com.receiptscan.core.category;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Подсчёт ключевых слов по категориям на тексте "продавец + весь текст".
 * Побеждает максимальный ненулевой счёт; при равенстве: категория, объявленная раньше.
 */
public final class Categorizer {
    private static final Logger log = LoggerFactory.getLogger(Categorizer.class);

    private final Map<Category, List<Pattern>> patterns = new EnumMap<>(Category.class);

    public Categorizer() {
        for (Category c : Category.values()) {
            List<Pattern> ps = new ArrayList<>(c.keywords().size());
            for (String kw : c.keywords()) {
                ps.add(keywordPattern(kw));
            }
            patterns.put(c, Collections.unmodifiableList(ps));
        }
    }

    /** "home depot" → \bhome\s+depot(?:s|es)?\b, без учёта регистра. */
    static Pattern keywordPattern(String keyword) {
        String[] parts = keyword.toLowerCase(Locale.ROOT).trim().split("\\s+");
        StringBuilder re = new StringBuilder("\\b");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) re.append("\\s+");
            re.append(Pattern.quote(parts[i]));
        }
        re.append("(?:s|es)?\\b");
        return Pattern.compile(re.toString(), Pattern.CASE_INSENSITIVE);
    }

    public Category categorize(String vendor, String text) {
        Map<Category, Integer> scores = score(vendor, text);
        Category best = Category.MISCELLANEOUS;
        int bestScore = 0;
        // values() идут в порядке объявления, строгое ">" даёт приоритет более ранней категории
        for (Category c : Category.values()) {
            int s = scores.getOrDefault(c, 0);
            if (s > bestScore) {
                best = c;
                bestScore = s;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("categorize: {} (scores={})", best.wireName(), scores);
        }
        return best;
    }

    /** Счёт по каждой категории (без нулевых). */
    public Map<Category, Integer> score(String vendor, String text) {
        String combined = (vendor == null ? "" : vendor) + " " + (text == null ? "" : text);
        Map<Category, Integer> out = new EnumMap<>(Category.class);
        for (Map.Entry<Category, List<Pattern>> e : patterns.entrySet()) {
            int n = 0;
            for (Pattern p : e.getValue()) {
                Matcher m = p.matcher(combined);
                while (m.find()) n++;
            }
            if (n > 0) out.put(e.getKey(), n);
        }
        return out;
    }
}
