package com.planmarshall.core.triage;

import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.Severity;

import java.util.Comparator;

import static java.util.Comparator.comparing;
import static java.util.Comparator.nullsLast;

/**
 * Processing order of findings: source, severity (most severe first), file path, line, rule, id.
 * Remaining fields break ties between findings that share an id.
 */
public final class FindingOrder {

    private FindingOrder() {}

    public static final Comparator<Finding> TRIAGE_ORDER =
            comparing(Finding::source, nullsLast(Comparator.<String>naturalOrder()))
                    .thenComparing(Finding::severity, Comparator.comparingInt(Severity::rank).reversed())
                    .thenComparing(Finding::file, nullsLast(Comparator.<String>naturalOrder()))
                    .thenComparing(Finding::line, nullsLast(Comparator.<Integer>naturalOrder()))
                    .thenComparing(Finding::rule, nullsLast(Comparator.<String>naturalOrder()))
                    .thenComparing(Finding::id)
                    .thenComparing(Finding::message, nullsLast(Comparator.<String>naturalOrder()))
                    .thenComparing(Finding::module, nullsLast(Comparator.<String>naturalOrder()))
                    .thenComparing(Finding::domain, nullsLast(Comparator.<String>naturalOrder()))
                    .thenComparing(Finding::autoFixable);
}
