package com.receiptscan.core.extract;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Упорядоченный список правил определения продавца.
 * Порядок важен: конкретные сети раньше общих шаблонов, иначе
 * "CVS PHARMACY" ушло бы в generic "pharmacy".
 */
public final class VendorRules {

    public static final List<VendorRule> DEFAULT = List.of(
            VendorRule.chain("\\bwalgreens?\\b", "Walgreens"),
            VendorRule.chain("\\bcvs\\b", "CVS"),
            VendorRule.chain("\\bwal-?mart\\b", "Walmart"),
            VendorRule.chain("\\btarget\\b", "Target"),
            VendorRule.chain("\\bcostco\\b", "Costco"),
            VendorRule.chain("\\bamazon\\b", "Amazon"),
            VendorRule.chain("\\bhome\\s+depot\\b", "Home Depot"),
            VendorRule.chain("\\boffice\\s+depot\\b", "Office Depot"),
            VendorRule.chain("\\blowe'?s\\b", "Lowe's"),
            VendorRule.chain("\\bstaples\\b", "Staples"),
            VendorRule.chain("\\bshell\\b", "Shell"),
            VendorRule.chain("\\b(?:chevron|texaco)\\b", "Chevron"),
            // общие: строго в конце
            VendorRule.generic("pharmacy", "\\b(?:pharmacy|drug\\s*store)\\b"),
            VendorRule.generic("gas station", "\\b(?:gas\\s+station|fuel)\\b")
    );

    private static final Pattern STORE_SUFFIX = Pattern.compile(
            "(?i)\\s*(?:#\\s*\\d+|\\bstore\\s*(?:#|no\\.?)?\\s*\\d+|\\bno\\.\\s*\\d+)\\s*$");
    private static final Pattern TRAILING_JUNK = Pattern.compile("[\\s\\-:,*]+$");

    private final List<VendorRule> rules;

    public VendorRules(List<VendorRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static VendorRules defaults() {
        return new VendorRules(DEFAULT);
    }

    public List<VendorRule> rules() {
        return rules;
    }

    /** Первое сработавшее правило (по порядку правил, не строк) на заголовочных строках. */
    public Optional<String> match(List<String> headerLines) {
        for (VendorRule r : rules) {
            for (String line : headerLines) {
                if (r.matches(line)) {
                    return Optional.of(r.result().apply(line));
                }
            }
        }
        return Optional.empty();
    }

    /** Убирает номер магазина ("#123", "Store 12", "No. 5") и приводит к Title Case. */
    static String cleanHeader(String line) {
        String s = line.strip();
        String prev;
        do {
            prev = s;
            s = STORE_SUFFIX.matcher(s).replaceFirst("");
            s = TRAILING_JUNK.matcher(s).replaceFirst("");
        } while (!s.equals(prev));
        return titleCase(s);
    }

    static String titleCase(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean start = true;
        for (char c : s.toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(start ? Character.toUpperCase(c) : c);
                start = false;
            } else {
                sb.append(c);
                // апостроф внутри слова не начинает новое слово: "Lowe's", не "Lowe'S"
                start = c != '\'';
            }
        }
        return sb.toString();
    }
}
