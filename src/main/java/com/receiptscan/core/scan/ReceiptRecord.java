package com.receiptscan.core.scan;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Итог одного успешного скана. Неизменяемый; правки после выдачи: забота вызывающего слоя.
 * Поля не проверяются на бизнес-правила здесь: для этого есть {@link ReceiptValidator},
 * который должен видеть и «плохие» записи.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ReceiptRecord(
        @JsonProperty("vendor_name") String vendorName,
        @JsonProperty("total_amount") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalAmount,
        @JsonProperty("tax_amount") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal taxAmount,
        @JsonProperty("transaction_date") @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
        LocalDate transactionDate,
        @JsonProperty("items") List<LineItem> items,
        @JsonProperty("category") String category,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("raw_text") String rawText,
        @JsonProperty("extracted_at") Instant extractedAt
) {
    public ReceiptRecord {
        items = items == null ? List.of() : List.copyOf(items);
        rawText = rawText == null ? "" : rawText;
    }

    public Optional<BigDecimal> tax() {
        return Optional.ofNullable(taxAmount);
    }

    public Optional<LocalDate> date() {
        return Optional.ofNullable(transactionDate);
    }
}
