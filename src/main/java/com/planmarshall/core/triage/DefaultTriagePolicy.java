package com.planmarshall.core.triage;

import com.planmarshall.core.config.OrchestratorConfig;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.Severity;
import com.planmarshall.extension.TriageResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Triage applied when a domain has no handler, a handler fails, or a SUPPRESS is rejected:
 * FIX for the configured severities ({@code planmarshall.triage.default-fix-severities},
 * blocker and major unless overridden), ACCEPT for everything else.
 */
@Component
public class DefaultTriagePolicy {

    private final Set<Severity> fixSeverities;

    @Autowired
    public DefaultTriagePolicy(OrchestratorConfig config) {
        this(config.defaultFixSeverities());
    }

    public DefaultTriagePolicy(Set<Severity> fixSeverities) {
        this.fixSeverities = fixSeverities.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(fixSeverities));
    }

    public TriageResult decide(Finding finding) {
        if (fixSeverities.contains(finding.severity())) {
            return TriageResult.fix("default policy: " + finding.severity() + " findings are fixed");
        }
        return TriageResult.accept("default policy: " + finding.severity() + " findings are accepted");
    }

    public Set<Severity> fixSeverities() {
        return fixSeverities;
    }
}
