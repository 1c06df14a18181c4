package com.example.sales.model;

import com.example.sales.error.DomainViolationException;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sales region. Declaration order is the encoding order used by the dense engine.
 */
public enum Region {
    NORTH("North"),
    SOUTH("South"),
    EAST("East"),
    WEST("West");

    private static final Map<String, Region> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Region::label, Function.identity()));

    private final String label;

    Region(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a region from its label.
     *
     * @throws DomainViolationException if the label is not one of the four regions
     */
    public static Region fromLabel(String label) {
        Region region = label == null ? null : BY_LABEL.get(label);
        if (region == null) {
            throw new DomainViolationException("region", label);
        }
        return region;
    }
}
