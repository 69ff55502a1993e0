package com.receiptscan.core.extract;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Правило «шаблон → имя продавца». result получает совпавшую строку заголовка
 * и возвращает нормализованное имя.
 */
public record VendorRule(String name, Pattern pattern, UnaryOperator<String> result) {
    public VendorRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(result, "result");
    }

    /** Правило для сети: имя фиксированное. */
    public static VendorRule chain(String regex, String vendor) {
        return new VendorRule(vendor, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), line -> vendor);
    }

    /** Общее правило ("pharmacy", "gas station"): имя берётся из самой строки. */
    public static VendorRule generic(String name, String regex) {
        return new VendorRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), VendorRules::cleanHeader);
    }

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }
}
