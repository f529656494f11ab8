package com.planmarshall.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finalizer used when the host supplies none: writes the summary and suppression notes to the log.
 */
public class LoggingFinalizer implements Finalizer {

    private static final Logger log = LoggerFactory.getLogger(LoggingFinalizer.class);

    @Override
    public void finalizePlan(FinalizationSummary summary) {
        log.info("Plan {} '{}' finalized: {} deliverable(s), {} task(s), {} finding(s), iterations {}",
                summary.planId(), summary.title(), summary.deliverables().size(), summary.tasks().size(),
                summary.findings().size(), summary.iterations());
        for (var note : summary.suppressions()) {
            log.info("Suppression for {} at {}:{} [{}]: {}", note.findingId(), note.file(), note.line(),
                    note.rule(), note.rationale());
        }
    }
}
