package com.planmarshall.extension;

import com.planmarshall.core.model.ChangeType;
import com.planmarshall.core.model.PlanRequest;
import com.planmarshall.core.model.ProjectContext;

import java.util.List;

/**
 * Input to an {@link Outliner}.
 *
 * @param planId         plan being outlined
 * @param domain         domain the outliner is invoked for
 * @param changeType     change type decided during 2-refine
 * @param request        intake request including clarifications
 * @param context        project architecture metadata
 * @param reviewFeedback feedback from rejected outlines, oldest first
 */
public record OutlineRequest(
    String planId,
    String domain,
    ChangeType changeType,
    PlanRequest request,
    ProjectContext context,
    List<String> reviewFeedback
) {

    public OutlineRequest {
        reviewFeedback = reviewFeedback == null ? List.of() : List.copyOf(reviewFeedback);
    }
}
