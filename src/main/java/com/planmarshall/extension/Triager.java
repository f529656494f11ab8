package com.planmarshall.extension;

import com.planmarshall.core.model.Finding;

@FunctionalInterface
public interface Triager extends Extension {

    TriageResult triage(Finding finding);
}
