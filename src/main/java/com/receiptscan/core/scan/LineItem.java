package com.receiptscan.core.scan;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/** Позиция чека: описание + цена (неотрицательная, 2 знака). */
public record LineItem(
        @JsonProperty("description") String description,
        @JsonProperty("price") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal price
) {
    public LineItem {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(price, "price");
        if (description.isBlank()) {
            throw new IllegalArgumentException("description must not be blank");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price must be >= 0: " + price);
        }
    }
}
