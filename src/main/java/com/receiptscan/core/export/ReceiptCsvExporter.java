package com.receiptscan.core.export;

import com.receiptscan.core.scan.ReceiptRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/** CSV для выгрузки в таблицы. Все поля в кавычках, кавычки внутри удваиваются. */
public final class ReceiptCsvExporter {

    public static final String HEADER = "Vendor,Total Amount,Tax Amount,Date,Category,Confidence Score,Raw Text";

    public void write(List<ReceiptRecord> records, Writer out) {
        try {
            out.write(HEADER);
            out.write('\n');
            for (ReceiptRecord r : records) {
                out.write(row(r));
                out.write('\n');
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write receipts CSV", e);
        }
    }

    static String row(ReceiptRecord r) {
        // отсутствующий налог выгружается как 0.00
        BigDecimal tax = r.tax().orElse(BigDecimal.ZERO.setScale(2));
        return String.join(",",
                quote(r.vendorName()),
                quote(r.totalAmount() == null ? "" : r.totalAmount().toPlainString()),
                quote(tax.toPlainString()),
                quote(r.date().map(Object::toString).orElse("")),
                quote(r.category()),
                quote(String.format(Locale.ROOT, "%.2f", r.confidenceScore())),
                quote(r.rawText()));
    }

    static String quote(String v) {
        String s = v == null ? "" : v;
        return '"' + s.replace("\"", "\"\"") + '"';
    }
}
