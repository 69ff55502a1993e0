package com.receiptscan.core.extract;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Денежные токены: поиск в тексте, разбор строк вида "$1,234.56", "45.99 USD". */
public final class Amounts {
    private Amounts() {}

    /** Число с ровно двумя знаками после точки, разделители тысяч допустимы. */
    static final String AMOUNT = "(?:\\d{1,3}(?:,\\d{3})+|\\d+)\\.\\d{2}";

    /** Денежный токен в строке; группа 1: само число. Проценты и длинные дроби не берём. */
    static final Pattern CURRENCY_TOKEN =
            Pattern.compile("(?<![\\d.,])\\$?\\s?(" + AMOUNT + ")(?![\\d%])");

    private static final Pattern CLEAN = Pattern.compile("(?i)\\bUS\\b|\\bUSD\\b|[$,\\s]");

    /** Все денежные значения в порядке появления. */
    public static List<BigDecimal> findAll(String text) {
        List<BigDecimal> out = new ArrayList<>();
        if (text == null) return out;
        Matcher m = CURRENCY_TOKEN.matcher(text);
        while (m.find()) {
            out.add(toDecimal(m.group(1)));
        }
        return out;
    }

    /** Разбор пользовательской строки суммы. Нераспознанное → 0.00. */
    public static BigDecimal parseCurrency(String s) {
        if (s == null) return zero();
        String clean = CLEAN.matcher(s.trim()).replaceAll("");
        if (clean.isEmpty()) return zero();
        try {
            return new BigDecimal(clean).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return zero();
        }
    }

    /** "1234.5" → "1,234.50". */
    public static String format(BigDecimal v) {
        if (v == null) return "";
        return String.format(Locale.ROOT, "%,.2f", v);
    }

    static BigDecimal toDecimal(String token) {
        return new BigDecimal(token.replace(",", "")).setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
    }
}
