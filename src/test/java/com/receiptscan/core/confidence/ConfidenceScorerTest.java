package com.receiptscan.core.confidence;

import com.receiptscan.core.extract.FieldExtractor;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {
    static final String SCENARIO_A =
            "WALGREENS\nAspirin $12.99\nCough Medicine $15.99\nSubtotal: $28.98\nTax: $2.50\nTotal: $31.48\nDate: 03/15/2025";

    @Test
    void heuristic_text_full_receipt_scores_max() {
        double s = HeuristicTextScorer.score(SCENARIO_A, new BigDecimal("31.48"), "Walgreens");
        assertEquals(1.0, s, 1e-9);
    }

    @Test
    void heuristic_text_components() {
        // 25 символов → +10, больше ничего
        assertEquals(0.10, HeuristicTextScorer.score("abcdefghijklmnopqrstuvwxy", BigDecimal.ZERO,
                FieldExtractor.UNKNOWN_VENDOR), 1e-9);
        // + сумма + продавец
        assertEquals(0.55, HeuristicTextScorer.score("abcdefghijklmnopqrstuvwxy", BigDecimal.ONE, "Shop"), 1e-9);
        // дата в тексте
        assertEquals(0.15, HeuristicTextScorer.score("01/02/2024", null, null), 1e-9);
    }

    @Test
    void heuristic_counts_distinct_currency_tokens() {
        assertEquals(3, HeuristicTextScorer.distinctMoneyTokens("1.00 1.00 2.00 $3.00"));
        assertEquals(4, HeuristicTextScorer.distinctMoneyTokens("1.00 2.00 3.00 4.00"));
    }

    @Test
    void heuristic_empty_text_is_zero() {
        assertEquals(0.0, HeuristicTextScorer.score("", BigDecimal.ZERO, FieldExtractor.UNKNOWN_VENDOR), 1e-9);
        assertEquals(0.0, HeuristicTextScorer.score(null, null, null), 1e-9);
    }

    @Test
    void presence_flags_points_and_reliability() {
        assertEquals(1.0, PresenceFlagsScorer.score(true, true, true, true, null), 1e-9);
        assertEquals(0.8, PresenceFlagsScorer.score(true, true, true, true, 0.8), 1e-9);
        assertEquals(0.5, PresenceFlagsScorer.score(true, false, true, false, null), 1e-9);
        assertEquals(0.0, PresenceFlagsScorer.score(false, false, false, false, 0.9), 1e-9);
    }

    @Test
    void presence_flags_clamps_bad_reliability() {
        assertEquals(1.0, PresenceFlagsScorer.score(true, true, true, true, 3.0), 1e-9);
        assertEquals(0.0, PresenceFlagsScorer.score(true, true, true, true, -1.0), 1e-9);
        assertEquals(0.0, PresenceFlagsScorer.score(true, true, true, true, Double.NaN), 1e-9);
    }

    @Test
    void presence_flags_is_monotonic_in_found_fields() {
        for (Double rel : new Double[]{null, 0.3, 1.0}) {
            for (int mask = 0; mask < 16; mask++) {
                double base = flags(mask, rel);
                assertTrue(base >= 0.0 && base <= 1.0);
                for (int bit = 0; bit < 4; bit++) {
                    int more = mask | (1 << bit);
                    assertTrue(flags(more, rel) >= base, "mask " + mask + " -> " + more);
                }
            }
        }
    }

    @Test
    void heuristic_is_monotonic_in_amount_and_vendor() {
        String text = "some receipt text of medium size, no digits";
        double none = HeuristicTextScorer.score(text, BigDecimal.ZERO, FieldExtractor.UNKNOWN_VENDOR);
        double amount = HeuristicTextScorer.score(text, BigDecimal.TEN, FieldExtractor.UNKNOWN_VENDOR);
        double both = HeuristicTextScorer.score(text, BigDecimal.TEN, "Shop");
        assertTrue(none <= amount && amount <= both);
    }

    @Test
    void strategies_share_interface_and_scale() {
        ScoringInput in = new ScoringInput(SCENARIO_A, "Walgreens", new BigDecimal("31.48"), true, true, null);
        assertEquals(1.0, ConfidenceScorer.forName("presence-flags").score(in), 1e-9);
        assertEquals(1.0, ConfidenceScorer.forName(" Heuristic-Text ").score(in), 1e-9);

        ScoringInput empty = new ScoringInput("", null, null, false, false, null);
        assertEquals(0.0, new PresenceFlagsScorer().score(empty), 1e-9);
        assertEquals(0.0, new HeuristicTextScorer().score(empty), 1e-9);
    }

    @Test
    void unknown_strategy_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ConfidenceScorer.forName("ml"));
        assertThrows(IllegalArgumentException.class, () -> ConfidenceScorer.forName(null));
    }

    private static double flags(int mask, Double rel) {
        return PresenceFlagsScorer.score((mask & 1) != 0, (mask & 2) != 0, (mask & 4) != 0, (mask & 8) != 0, rel);
    }
}
