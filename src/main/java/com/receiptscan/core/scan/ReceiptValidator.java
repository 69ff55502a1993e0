package com.receiptscan.core.scan;

import com.receiptscan.core.category.Category;

import java.util.ArrayList;
import java.util.List;

/** Проверка записи перед сохранением. Никогда не бросает: проблемы возвращаются списком. */
public final class ReceiptValidator {

    public List<String> validate(ReceiptRecord r) {
        List<String> problems = new ArrayList<>();
        if (r == null) {
            problems.add("Receipt record is missing");
            return problems;
        }
        if (r.vendorName() == null || r.vendorName().isBlank()) {
            problems.add("Vendor name is required");
        }
        if (r.totalAmount() == null || r.totalAmount().signum() <= 0) {
            problems.add("Total amount must be greater than zero");
        }
        if (!Category.isKnown(r.category())) {
            problems.add("Invalid category: " + r.category());
        }
        double c = r.confidenceScore();
        if (Double.isNaN(c) || c < 0.0 || c > 1.0) {
            problems.add("Confidence score must be between 0 and 1");
        }
        return problems;
    }
}
