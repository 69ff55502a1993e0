package com.receiptscan.core.confidence;

import java.util.Locale;

/**
 * Оценка доверия к извлечённым данным. Любая реализация возвращает значение в [0,1].
 */
public interface ConfidenceScorer {

    double score(ScoringInput input);

    /** Имя стратегии из конфига: "presence-flags" или "heuristic-text". */
    String name();

    static ConfidenceScorer forName(String name) {
        String n = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (n) {
            case PresenceFlagsScorer.NAME -> new PresenceFlagsScorer();
            case HeuristicTextScorer.NAME -> new HeuristicTextScorer();
            default -> throw new IllegalArgumentException("unknown scoring strategy: " + name);
        };
    }

    static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
