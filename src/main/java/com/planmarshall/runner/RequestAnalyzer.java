package com.planmarshall.runner;

import com.planmarshall.core.model.ClarityAssessment;
import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.ProjectContext;

/**
 * Judges how well a request is understood during 2-refine.
 */
public interface RequestAnalyzer {

    ClarityAssessment assess(PlanRequest request, ProjectContext context);
}
