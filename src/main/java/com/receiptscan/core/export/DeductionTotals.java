package com.receiptscan.core.export;

import com.receiptscan.core.category.Category;
import com.receiptscan.core.scan.ReceiptRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Суммы и количество чеков по категориям вычетов. */
public final class DeductionTotals {
    private static final Logger log = LoggerFactory.getLogger(DeductionTotals.class);

    public record Bucket(int receipts, BigDecimal total, BigDecimal tax) {
        static final Bucket EMPTY = new Bucket(0, BigDecimal.ZERO.setScale(2), BigDecimal.ZERO.setScale(2));

        Bucket plus(ReceiptRecord r) {
            BigDecimal t = r.totalAmount() == null ? BigDecimal.ZERO : r.totalAmount();
            return new Bucket(receipts + 1, total.add(t), tax.add(r.tax().orElse(BigDecimal.ZERO)));
        }
    }

    private final Map<Category, Bucket> buckets;

    private DeductionTotals(Map<Category, Bucket> buckets) {
        this.buckets = Collections.unmodifiableMap(buckets);
    }

    /** Записи с неизвестной категорией пропускаются с предупреждением. */
    public static DeductionTotals of(List<ReceiptRecord> records) {
        Map<Category, Bucket> m = new EnumMap<>(Category.class);
        for (ReceiptRecord r : records) {
            Optional<Category> c = Category.fromWireName(r.category());
            if (c.isEmpty()) {
                log.warn("skip receipt with unknown category '{}' (vendor={})", r.category(), r.vendorName());
                continue;
            }
            m.merge(c.get(), Bucket.EMPTY.plus(r), (a, b) -> a.plus(r));
        }
        return new DeductionTotals(m);
    }

    public Bucket get(Category c) {
        return buckets.getOrDefault(c, Bucket.EMPTY);
    }

    public Map<Category, Bucket> asMap() {
        return buckets;
    }

    public BigDecimal grandTotal() {
        return buckets.values().stream().map(Bucket::total).reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
    }
}
