package com.receiptscan.core.extract;

import com.receiptscan.core.scan.LineItem;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Сырые поля, вытащенные из текста чека.
 * taxAmount и transactionDate могут быть null: «налог не напечатан» ≠ «налог 0.00».
 */
public record ExtractedFields(
        String vendorName,
        BigDecimal totalAmount,
        BigDecimal taxAmount,
        LocalDate transactionDate,
        List<LineItem> items
) {
    public ExtractedFields {
        Objects.requireNonNull(vendorName, "vendorName");
        Objects.requireNonNull(totalAmount, "totalAmount");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public Optional<BigDecimal> tax() {
        return Optional.ofNullable(taxAmount);
    }

    public Optional<LocalDate> date() {
        return Optional.ofNullable(transactionDate);
    }

    public boolean hasVendor() {
        return !FieldExtractor.UNKNOWN_VENDOR.equals(vendorName);
    }

    public boolean hasAmount() {
        return totalAmount.signum() > 0;
    }
}
