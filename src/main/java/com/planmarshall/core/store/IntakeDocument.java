package com.planmarshall.core.store;

import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.ProjectContext;

/** Content of {@code request.json}. */
public record IntakeDocument(PlanRequest request, ProjectContext context) {}
