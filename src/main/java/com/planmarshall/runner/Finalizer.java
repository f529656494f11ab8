package com.planmarshall.runner;

/**
 * Finalization actions such as committing, opening a pull request or emitting suppression annotations.
 */
public interface Finalizer {

    void finalizePlan(FinalizationSummary summary);
}
