package com.receiptscan.core.category;

import java.util.List;
import java.util.Optional;

/**
 * Категория налогового вычета. Порядок объявления = порядок разрешения ничьих.
 * Ключевые слова сравниваются без учёта регистра, целыми словами, допускается множественное число.
 */
public enum Category {
    MEDICAL("medical", List.of(
            "pharmacy", "doctor", "hospital", "clinic", "medical", "dental", "prescription", "rx",
            "walgreens", "cvs", "drugstore", "medicine", "aspirin", "vitamin", "bandage")),
    CHARITABLE("charitable", List.of(
            "donation", "charity", "church", "temple", "mosque", "nonprofit", "contribution")),
    BUSINESS("business", List.of(
            "office", "supplies", "equipment", "software", "computer", "printer", "business")),
    EDUCATION("education", List.of(
            "bookstore", "university", "college", "school", "tuition", "textbook", "education")),
    VEHICLE("vehicle", List.of(
            "gas", "gasoline", "fuel", "auto", "car", "truck", "vehicle", "repair", "oil")),
    HOME_OFFICE("home_office", List.of(
            "home depot", "lowes", "lowe's", "office depot", "staples", "furniture", "desk", "chair")),
    RETIREMENT("retirement", List.of(
            "ira", "401k", "retirement", "pension", "annuity")),
    ENERGY("energy", List.of(
            "electric", "gas bill", "utility", "solar", "energy")),
    STATE_LOCAL("state_local", List.of(
            "property tax", "county", "state", "local", "license")),
    MISCELLANEOUS("miscellaneous", List.of());

    private final String wireName;
    private final List<String> keywords;

    Category(String wireName, List<String> keywords) {
        this.wireName = wireName;
        this.keywords = keywords;
    }

    /** Имя в сериализованной записи: "medical", "home_office", ... */
    public String wireName() {
        return wireName;
    }

    public List<String> keywords() {
        return keywords;
    }

    public static Optional<Category> fromWireName(String name) {
        if (name == null) return Optional.empty();
        for (Category c : values()) {
            if (c.wireName.equals(name)) return Optional.of(c);
        }
        return Optional.empty();
    }

    public static boolean isKnown(String name) {
        return fromWireName(name).isPresent();
    }
}
