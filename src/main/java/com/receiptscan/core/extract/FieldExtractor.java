package com.receiptscan.core.extract;

import com.receiptscan.app.Config;
import com.receiptscan.core.scan.LineItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Текст чека → продавец, итог, налог, дата, позиции.
 * Все таблицы шаблонов неизменяемые и строятся один раз, экземпляр можно делить между потоками.
 */
public final class FieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    public static final String UNKNOWN_VENDOR = "Unknown Vendor";
    static final int HEADER_LINES = 5;
    static final int MAX_HEADER_LENGTH = 100;

    private static final String LABEL_TAIL = "\\b[:\\s]*\\$?\\s*(" + Amounts.AMOUNT + ")(?![\\d%])";

    /** Порядок = приоритет. Внутри шаблона берём последнее совпадение. */
    static final List<Pattern> TOTAL_PATTERNS = List.of(
            label("\\bTOTAL"),
            label("\\bAMOUNT\\s+DUE"),
            label("\\bBALANCE(?:\\s+DUE)?"),
            label("\\bGRAND\\s+TOTAL")
    );

    // у налога допускаем 0-2 знака после точки, но не проценты ("TAX 8.25%")
    private static final String TAX_AMOUNT = "((?:\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d{1,2})?)(?![\\d.,]|\\s*%)";
    // ставка перед суммой: "TAX 8.25% 0.83", "TAX (8.25%): 0.83"
    private static final String TAX_RATE = "(?:\\h*\\(?\\h*\\d+(?:\\.\\d+)?\\h*%\\h*\\)?)?";
    static final List<Pattern> TAX_PATTERNS = List.of(
            tax("\\bTAX\\b"),
            tax("\\bSALES\\s+TAX\\b"),
            tax("\\bTAX\\s+AMOUNT\\b")
    );

    static final Pattern DATE_DMY = Pattern.compile("(?<!\\d)(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4}|\\d{2})(?!\\d)");
    static final Pattern DATE_YMD = Pattern.compile("(?<!\\d)(\\d{4})[/-](\\d{1,2})[/-](\\d{1,2})(?!\\d)");
    static final Pattern DATE_TEXT = Pattern.compile(
            "\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4}|\\d{2})(?!\\d)",
            Pattern.CASE_INSENSITIVE);
    private static final List<String> MONTHS =
            List.of("jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    private final VendorRules vendorRules;
    private final Config.ExtractConf cfg;

    public FieldExtractor() {
        this(VendorRules.defaults(), Config.ExtractConf.defaults());
    }

    public FieldExtractor(VendorRules vendorRules, Config.ExtractConf cfg) {
        this.vendorRules = Objects.requireNonNull(vendorRules, "vendorRules");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public ExtractedFields extract(String rawText) {
        String text = rawText == null ? "" : rawText;
        String vendor = extractVendor(text);
        BigDecimal total = extractTotal(text);
        BigDecimal tax = extractTax(text).orElse(null);
        LocalDate date = extractDate(text).orElse(null);
        List<LineItem> items = LineItems.parse(text);
        if (cfg.deduplicateItems()) {
            items = LineItems.deduplicate(items);
        }
        if (log.isDebugEnabled()) {
            log.debug("extract: vendor='{}' total={} tax={} date={} items={}",
                    vendor, total, tax, date, items.size());
        }
        return new ExtractedFields(vendor, total, tax, date, items);
    }

    // ---- vendor ----

    public String extractVendor(String text) {
        List<String> header = headerLines(text);
        // строки с ценой: позиции, а не шапка ("Shell eggs 2.99")
        List<String> candidates = header.stream()
                .filter(l -> !Amounts.CURRENCY_TOKEN.matcher(l).find())
                .toList();
        Optional<String> known = vendorRules.match(candidates);
        if (known.isPresent()) return known.get();
        for (String line : header) {
            if (plausibleHeader(line)) {
                String cleaned = VendorRules.cleanHeader(line);
                if (!cleaned.isBlank()) return cleaned;
            }
        }
        return UNKNOWN_VENDOR;
    }

    static List<String> headerLines(String text) {
        List<String> out = new ArrayList<>(HEADER_LINES);
        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            out.add(line);
            if (out.size() == HEADER_LINES) break;
        }
        return out;
    }

    static boolean plausibleHeader(String line) {
        if (line.length() > MAX_HEADER_LENGTH) return false;
        if (line.startsWith("$") || line.regionMatches(true, 0, "total", 0, 5)) return false;
        if (line.chars().noneMatch(Character::isLetter)) return false;
        // строки с ценой или датой: это уже тело чека
        return !Amounts.CURRENCY_TOKEN.matcher(line).find()
                && !DATE_DMY.matcher(line).find()
                && !DATE_YMD.matcher(line).find();
    }

    // ---- amounts ----

    public BigDecimal extractTotal(String text) {
        for (Pattern p : TOTAL_PATTERNS) {
            String last = lastGroup(p, text);
            if (last != null) return Amounts.toDecimal(last);
        }
        // нет подписанного итога: самое крупное число в тексте
        return Amounts.findAll(text).stream()
                .max(Comparator.naturalOrder())
                .orElseGet(Amounts::zero);
    }

    public Optional<BigDecimal> extractTax(String text) {
        for (Pattern p : TAX_PATTERNS) {
            String last = lastGroup(p, text);
            if (last != null) {
                return Optional.of(new BigDecimal(last.replace(",", "")).setScale(2, RoundingMode.HALF_UP));
            }
        }
        return Optional.empty();
    }

    private static String lastGroup(Pattern p, String text) {
        Matcher m = p.matcher(text);
        String last = null;
        while (m.find()) last = m.group(1);
        return last;
    }

    private static Pattern tax(String head) {
        // сумма налога на той же строке, что и метка
        return Pattern.compile(head + TAX_RATE + "[:\\h]*\\$?\\h*" + TAX_AMOUNT, Pattern.CASE_INSENSITIVE);
    }

    private static Pattern label(String head) {
        return Pattern.compile(head + LABEL_TAIL, Pattern.CASE_INSENSITIVE);
    }

    // ---- date ----

    /**
     * d/m/y → y/m/d → "Month D, YYYY". Для числовых форм месяцем считается
     * первый из двух компонентов, который ≤ 12 (03/04/2025 → 4 марта).
     */
    public Optional<LocalDate> extractDate(String text) {
        Matcher m = DATE_DMY.matcher(text);
        while (m.find()) {
            int a = Integer.parseInt(m.group(1));
            int b = Integer.parseInt(m.group(2));
            int year = year(m.group(3));
            Optional<LocalDate> d = a <= 12 ? valid(year, a, b) : valid(year, b, a);
            if (d.isPresent()) return d;
        }
        m = DATE_YMD.matcher(text);
        while (m.find()) {
            Optional<LocalDate> d = valid(Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
            if (d.isPresent()) return d;
        }
        m = DATE_TEXT.matcher(text);
        while (m.find()) {
            int month = MONTHS.indexOf(m.group(1).toLowerCase(Locale.ROOT)) + 1;
            Optional<LocalDate> d = valid(year(m.group(3)), month, Integer.parseInt(m.group(2)));
            if (d.isPresent()) return d;
        }
        return Optional.empty();
    }

    private static int year(String s) {
        int y = Integer.parseInt(s);
        return s.length() == 2 ? 2000 + y : y;
    }

    private Optional<LocalDate> valid(int year, int month, int day) {
        if (month < 1 || month > 12 || day < 1 || day > 31) return Optional.empty();
        if (year < cfg.minYear() || year > cfg.maxYear()) return Optional.empty();
        // 30 февраля и т.п.
        if (!YearMonth.of(year, month).isValidDay(day)) return Optional.empty();
        return Optional.of(LocalDate.of(year, month, day));
    }
}
