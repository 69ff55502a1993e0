package com.receiptscan.core.extract;

import com.receiptscan.core.scan.LineItem;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Разбор позиций чека построчно. */
public final class LineItems {
    private LineItems() {}

    /** Итоговая метка в начале строки; группа 1: хвост после метки. */
    static final Pattern SUMMARY_LABEL = Pattern.compile(
            "(?i)^(?:(?:grand|sales)\\s+)?(?:sub\\s*-?\\s*total|total|tax|balance|amount\\s+due|change|cash|tender(?:ed)?)\\b(.*)$");

    // что может стоять после метки в итоговой строке: ставка, "DUE", "(3 items)" и т.п.
    private static final Pattern SUMMARY_NOISE = Pattern.compile(
            "(?i)\\d+(?:\\.\\d+)?\\s*%|\\b(?:due|amount|tend(?:ered)?|back|usd|items?|\\d+)\\b");

    private static final Pattern SEPARATORS = Pattern.compile("^[\\s:\\-@*.,=]+|[\\s:\\-@*.,=]+$");

    /**
     * Каждая строка с денежным токеном → позиция; цена: последний токен в строке,
     * описание: остаток строки без токена и разделителей.
     */
    public static List<LineItem> parse(String text) {
        List<LineItem> items = new ArrayList<>();
        if (text == null) return items;
        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || isSummary(line)) continue;

            Matcher m = Amounts.CURRENCY_TOKEN.matcher(line);
            int start = -1, end = -1;
            String token = null;
            while (m.find()) {
                start = m.start();
                end = m.end();
                token = m.group(1);
            }
            if (token == null) continue;

            String rest = line.substring(0, start) + " " + line.substring(end);
            String description = SEPARATORS.matcher(rest.replaceAll("\\s+", " ")).replaceAll("");
            if (description.isEmpty()) continue;
            items.add(new LineItem(description, Amounts.toDecimal(token)));
        }
        return items;
    }

    /**
     * "Total: $31.48", "TAX 8.25% 0.83", "Change Due 1.00" это итоги,
     * а "Oil Change 39.99" и "Tax Guide 19.99" это товары: после метки не должно остаться слов.
     */
    static boolean isSummary(String line) {
        Matcher m = SUMMARY_LABEL.matcher(line);
        if (!m.matches()) return false;
        String tail = Amounts.CURRENCY_TOKEN.matcher(m.group(1)).replaceAll(" ");
        tail = SUMMARY_NOISE.matcher(tail).replaceAll(" ");
        return tail.chars().noneMatch(Character::isLetter);
    }

    /** Убирает точные дубликаты (описание + цена), порядок первых вхождений сохраняется. */
    public static List<LineItem> deduplicate(List<LineItem> items) {
        Set<Key> seen = new LinkedHashSet<>();
        List<LineItem> out = new ArrayList<>(items.size());
        for (LineItem it : items) {
            // 12.9 и 12.90: одна цена
            if (seen.add(new Key(it.description(), it.price().stripTrailingZeros()))) {
                out.add(it);
            }
        }
        return out;
    }

    private record Key(String description, BigDecimal price) {}
}
