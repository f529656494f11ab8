package com.planmarshall.extension;

import com.planmarshall.core.model.TriageDecision;

/**
 * Decision of a {@link Triager} for one finding.
 *
 * @param decision  FIX, SUPPRESS or ACCEPT
 * @param rationale why; mandatory for SUPPRESS
 */
public record TriageResult(TriageDecision decision, String rationale) {

    public static TriageResult fix(String rationale) {
        return new TriageResult(TriageDecision.FIX, rationale);
    }

    public static TriageResult suppress(String rationale) {
        return new TriageResult(TriageDecision.SUPPRESS, rationale);
    }

    public static TriageResult accept(String rationale) {
        return new TriageResult(TriageDecision.ACCEPT, rationale);
    }

    public boolean hasRationale() {
        return rationale != null && !rationale.isBlank();
    }
}
