package com.planmarshall.core.model;

import java.util.Locale;

/**
 * Verification check categories reported by the verification runner.
 */
public enum CheckCategory {
    QUALITY,
    BUILD,
    DOMAIN_TECHNICAL,
    TEST_COVERAGE;

    /** Finding source used by checks of this category, e.g. {@code domain-technical}. */
    public String source() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
