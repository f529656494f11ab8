package com.planmarshall.runner;

import com.planmarshall.core.model.CheckCategory;
import com.planmarshall.core.model.Finding;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * @param findings findings of this run
 * @param checks   pass/fail per check category; categories not present were not run
 */
public record VerificationReport(List<Finding> findings, Map<CheckCategory, Boolean> checks) {

    public VerificationReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
        checks = checks == null || checks.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(checks));
    }

    public static VerificationReport passed() {
        var checks = new EnumMap<CheckCategory, Boolean>(CheckCategory.class);
        for (var category : CheckCategory.values()) {
            checks.put(category, true);
        }
        return new VerificationReport(List.of(), checks);
    }

    public List<CheckCategory> failedCategories() {
        return checks.entrySet().stream()
                .filter(e -> !e.getValue())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
