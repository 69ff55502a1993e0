package com.receiptscan.core.export;

import com.receiptscan.core.scan.ReceiptRecord;
import com.receiptscan.core.scan.Receipts;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReceiptCsvExporterTest {

    @Test
    void header_and_rows() {
        StringWriter w = new StringWriter();
        new ReceiptCsvExporter().write(List.of(Receipts.walgreens()), w);
        String[] lines = w.toString().split("\n", -1);
        assertEquals(ReceiptCsvExporter.HEADER, lines[0]);
        assertTrue(lines[1].startsWith("\"Walgreens\",\"31.48\",\"2.50\",\"2025-03-15\",\"medical\",\"0.95\",\"WALGREENS"));
    }

    @Test
    void absent_tax_and_date() {
        String row = ReceiptCsvExporter.row(Receipts.of("Shop", "5.00", null, "miscellaneous", 0.3));
        assertEquals("\"Shop\",\"5.00\",\"0.00\",\"\",\"miscellaneous\",\"0.30\",\"\"", row);
    }

    @Test
    void quotes_are_doubled() {
        ReceiptRecord r = new ReceiptRecord("Bob \"The\" Shop", new BigDecimal("1.00"), null, null, List.of(),
                "miscellaneous", 0.1, "say \"hi\"", Receipts.AT);
        String row = ReceiptCsvExporter.row(r);
        assertTrue(row.startsWith("\"Bob \"\"The\"\" Shop\""));
        assertTrue(row.endsWith("\"say \"\"hi\"\"\""));
    }

    @Test
    void empty_list_writes_only_header() {
        StringWriter w = new StringWriter();
        new ReceiptCsvExporter().write(List.of(), w);
        assertEquals(ReceiptCsvExporter.HEADER + "\n", w.toString());
    }
}
