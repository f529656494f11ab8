package com.planmarshall.runner;

import com.planmarshall.core.model.ChangeType;
import com.planmarshall.core.model.ClarityAssessment;
import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.ProjectContext;

import java.util.List;

/**
 * Analyzer used when the host supplies none: takes the request at face value, assigns every domain of
 * the project context, and keeps the requester's change type (feature otherwise).
 */
public class ContextRequestAnalyzer implements RequestAnalyzer {

    @Override
    public ClarityAssessment assess(PlanRequest request, ProjectContext context) {
        ChangeType changeType = request.changeType() != null ? request.changeType() : ChangeType.FEATURE;
        return new ClarityAssessment(100, List.of(), context.allDomains(), changeType);
    }
}
