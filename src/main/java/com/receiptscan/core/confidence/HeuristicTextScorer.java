package com.receiptscan.core.confidence;

import com.receiptscan.core.extract.FieldExtractor;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Баллы по длине текста, найденной сумме, продавцу, наличию даты
 * и количеству разных денежных токенов. Максимум 100 → [0,1].
 */
public final class HeuristicTextScorer implements ConfidenceScorer {
    public static final String NAME = "heuristic-text";

    private static final Pattern DATE_SHAPED = Pattern.compile(
            "\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}|\\d{4}[/-]\\d{1,2}[/-]\\d{1,2}");
    private static final Pattern MONEY = Pattern.compile("\\$?(\\d+\\.\\d{2})(?!\\d)");

    @Override
    public double score(ScoringInput in) {
        return score(in.rawText(), in.totalAmount(), in.vendorName());
    }

    @Override
    public String name() {
        return NAME;
    }

    /** Исторический вызов по тексту. */
    public static double score(String text, BigDecimal totalAmount, String vendorName) {
        String t = text == null ? "" : text;
        int points = 0;
        int len = t.length();
        if (len > 100) points += 30;
        else if (len > 50) points += 20;
        else if (len > 20) points += 10;

        if (totalAmount != null && totalAmount.signum() > 0) points += 25;
        if (vendorName != null && !vendorName.isBlank() && !FieldExtractor.UNKNOWN_VENDOR.equals(vendorName)) {
            points += 20;
        }
        if (DATE_SHAPED.matcher(t).find()) points += 15;
        if (distinctMoneyTokens(t) > 3) points += 10;

        return ConfidenceScorer.clamp01(Math.min(100, points) / 100.0);
    }

    static int distinctMoneyTokens(String text) {
        Set<String> seen = new HashSet<>();
        Matcher m = MONEY.matcher(text);
        while (m.find()) seen.add(m.group(1));
        return seen.size();
    }
}
