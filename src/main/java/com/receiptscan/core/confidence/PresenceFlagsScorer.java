package com.receiptscan.core.confidence;

/**
 * 25 баллов за каждое найденное поле (продавец, сумма, дата, позиции),
 * опционально × уверенность распознавателя, затем / 100.
 */
public final class PresenceFlagsScorer implements ConfidenceScorer {
    public static final String NAME = "presence-flags";

    @Override
    public double score(ScoringInput in) {
        return score(in.vendorFound(), in.amountFound(), in.dateFound(), in.itemsFound(), in.reliability());
    }

    @Override
    public String name() {
        return NAME;
    }

    /** Исторический вызов по флагам. reliability может быть null. */
    public static double score(boolean hasVendor, boolean hasAmount, boolean hasDate, boolean hasItems,
                               Double reliability) {
        int points = 0;
        if (hasVendor) points += 25;
        if (hasAmount) points += 25;
        if (hasDate) points += 25;
        if (hasItems) points += 25;
        double factor = reliability == null ? 1.0 : ConfidenceScorer.clamp01(reliability);
        return ConfidenceScorer.clamp01(points * factor / 100.0);
    }
}
