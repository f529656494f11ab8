package com.planmarshall.core.model;

/**
 * A suppressed finding handed to finalization so that a suppression annotation can be emitted.
 */
public record SuppressionNote(String findingId, String file, Integer line, String rule, String rationale) {}
