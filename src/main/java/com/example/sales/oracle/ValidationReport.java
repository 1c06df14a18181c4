package com.example.sales.oracle;

import java.util.List;

/**
 * Outcome of comparing an engine result with an oracle.
 *
 * @param mismatches one human-readable line per field that disagrees; empty when valid
 */
public record ValidationReport(List<String> mismatches) {

    public ValidationReport {
        mismatches = List.copyOf(mismatches);
    }

    public boolean isValid() {
        return mismatches.isEmpty();
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationReport[valid]" : "ValidationReport" + mismatches;
    }
}
