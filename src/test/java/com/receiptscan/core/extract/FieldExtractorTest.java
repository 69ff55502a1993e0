package com.receiptscan.core.extract;

import com.receiptscan.app.Config;
import com.receiptscan.core.scan.LineItem;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldExtractorTest {
    static final String SCENARIO_A =
            "WALGREENS\nAspirin $12.99\nCough Medicine $15.99\nSubtotal: $28.98\nTax: $2.50\nTotal: $31.48\nDate: 03/15/2025";

    private final FieldExtractor fx = new FieldExtractor();

    @Test
    void pharmacy_receipt_all_fields() {
        ExtractedFields f = fx.extract(SCENARIO_A);
        assertEquals("Walgreens", f.vendorName());
        assertEquals(new BigDecimal("31.48"), f.totalAmount());
        assertEquals(new BigDecimal("2.50"), f.taxAmount());
        assertEquals(LocalDate.of(2025, 3, 15), f.transactionDate());
        assertEquals(List.of(
                new LineItem("Aspirin", new BigDecimal("12.99")),
                new LineItem("Cough Medicine", new BigDecimal("15.99"))), f.items());
    }

    @Test
    void total_takes_last_labeled_occurrence() {
        String text = "STORE\nTOTAL: $10.00\nCOUPON -2.00\nTOTAL: $8.00\n";
        assertEquals(new BigDecimal("8.00"), fx.extractTotal(text));
    }

    @Test
    void subtotal_is_not_a_total() {
        assertEquals(new BigDecimal("30.00"), fx.extractTotal("Subtotal: $28.98\nAMOUNT DUE $30.00"));
    }

    @Test
    void total_falls_back_to_largest_currency_token() {
        String text = "CORNER SHOP\nBread $5.00\nMilk $3.00\nCheese $12.00";
        assertEquals(new BigDecimal("12.00"), fx.extract(text).totalAmount());
    }

    @Test
    void total_defaults_to_zero_without_any_amount() {
        ExtractedFields f = fx.extract("THANK YOU\nCOME AGAIN");
        assertEquals(0, f.totalAmount().compareTo(BigDecimal.ZERO));
        assertEquals(2, f.totalAmount().scale());
        assertFalse(f.hasAmount());
    }

    @Test
    void total_with_thousands_separator() {
        assertEquals(new BigDecimal("1234.56"), fx.extractTotal("GRAND TOTAL $1,234.56"));
    }

    @Test
    void balance_label_used_when_no_total() {
        assertEquals(new BigDecimal("19.95"), fx.extractTotal("Items 2\nBALANCE DUE 19.95"));
    }

    @Test
    void tax_absent_is_not_zero() {
        assertTrue(fx.extractTax("TOTAL 5.00").isEmpty());
        assertEquals(new BigDecimal("0.00"), fx.extractTax("TAX 0.00\nTOTAL 5.00").orElseThrow());
    }

    @Test
    void tax_amount_after_printed_rate() {
        assertEquals(new BigDecimal("0.83"), fx.extractTax("Subtotal 10.00\nTAX 8.25% 0.83\nTOTAL 10.83").orElseThrow());
        assertEquals(new BigDecimal("0.83"), fx.extractTax("Sales Tax (8.25%): $0.83").orElseThrow());
        assertTrue(fx.extractTax("TAX 8.25%\n12.99 Widget").isEmpty());
    }

    @Test
    void tax_rate_percentage_is_ignored() {
        assertEquals(new BigDecimal("0.83"), fx.extractTax("TAX 8.25%\nSALES TAX $0.83").orElseThrow());
    }

    @Test
    void date_formats() {
        assertEquals(LocalDate.of(2024, 12, 25), fx.extractDate("25/12/2024").orElseThrow());
        assertEquals(LocalDate.of(2024, 1, 5), fx.extractDate("Printed 2024-01-05 10:22").orElseThrow());
        assertEquals(LocalDate.of(2023, 7, 4), fx.extractDate("July 4th, 2023").orElseThrow());
        assertEquals(LocalDate.of(2023, 7, 4), fx.extractDate("Jul 4 2023").orElseThrow());
        assertEquals(LocalDate.of(2024, 6, 30), fx.extractDate("06-30-24").orElseThrow());
    }

    @Test
    void ambiguous_numeric_date_reads_month_first() {
        assertEquals(LocalDate.of(2025, 3, 4), fx.extractDate("03/04/2025").orElseThrow());
    }

    @Test
    void dates_outside_window_or_calendar_are_rejected() {
        assertTrue(fx.extractDate("01/02/2019").isEmpty());
        assertTrue(fx.extractDate("02/30/2024").isEmpty());
        assertTrue(fx.extractDate("13/13/2024").isEmpty());
        assertTrue(fx.extractDate("no date here").isEmpty());
        // первый кандидат невалиден, второй подходит
        assertEquals(LocalDate.of(2024, 2, 29), fx.extractDate("REF 45/99/2024 DATE 02/29/2024").orElseThrow());
    }

    @Test
    void year_window_is_configurable() {
        FieldExtractor wide = new FieldExtractor(VendorRules.defaults(), new Config.ExtractConf(2000, 2099, false));
        assertEquals(LocalDate.of(2015, 5, 1), wide.extractDate("05/01/2015").orElseThrow());
    }

    @Test
    void specific_vendor_beats_generic_pattern() {
        assertEquals("CVS", fx.extractVendor("CVS PHARMACY #1234\nItem 1.00"));
        assertEquals("CVS", fx.extractVendor("DOWNTOWN PHARMACY\nat CVS\nItem 1.00"));
        assertEquals("Downtown Pharmacy", fx.extractVendor("DOWNTOWN PHARMACY\nItem 1.00"));
    }

    @Test
    void vendor_header_fallback_strips_store_number() {
        assertEquals("Joe's Diner", fx.extractVendor("JOE'S DINER #42\nBurger 8.99\nTotal 8.99"));
        assertEquals("Corner Market", fx.extractVendor("\n\n  Corner Market Store 12  \nMilk 3.00"));
    }

    @Test
    void vendor_ignores_price_lines_in_header() {
        assertEquals("Joe's Diner", fx.extractVendor("Joe's Diner\nShell eggs $2.99"));
    }

    @Test
    void unknown_vendor_when_no_plausible_header() {
        assertEquals(FieldExtractor.UNKNOWN_VENDOR, fx.extractVendor("$5.00\nTotal $5.00"));
        assertEquals(FieldExtractor.UNKNOWN_VENDOR, fx.extractVendor(""));
        assertEquals(FieldExtractor.UNKNOWN_VENDOR, fx.extractVendor("x".repeat(150)));
    }

    @Test
    void null_text_is_treated_as_empty() {
        ExtractedFields f = fx.extract(null);
        assertEquals(FieldExtractor.UNKNOWN_VENDOR, f.vendorName());
        assertTrue(f.items().isEmpty());
        assertNull(f.taxAmount());
        assertNull(f.transactionDate());
    }

    @Test
    void deduplication_follows_config() {
        String text = "SHOP\nSoda 1.50\nSoda 1.50\nChips 2.00";
        assertEquals(3, fx.extract(text).items().size());
        FieldExtractor dedup = new FieldExtractor(VendorRules.defaults(), new Config.ExtractConf(2020, 2030, true));
        assertEquals(2, dedup.extract(text).items().size());
    }
}
