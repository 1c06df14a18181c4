package com.example.sales.model;

import com.example.sales.error.DomainViolationException;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Product line. Declaration order is the encoding order used by the dense engine.
 */
public enum Product {
    LAPTOP("Laptop"),
    PHONE("Phone"),
    TABLET("Tablet"),
    MONITOR("Monitor"),
    KEYBOARD("Keyboard");

    private static final Map<String, Product> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Product::label, Function.identity()));

    private final String label;

    Product(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a product from its label.
     *
     * @throws DomainViolationException if the label is not one of the five products
     */
    public static Product fromLabel(String label) {
        Product product = label == null ? null : BY_LABEL.get(label);
        if (product == null) {
            throw new DomainViolationException("product", label);
        }
        return product;
    }
}
