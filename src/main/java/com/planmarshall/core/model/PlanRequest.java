package com.planmarshall.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.ArrayList;
import java.util.List;

/**
 * The request document a plan is created from.
 *
 * @param title          short title
 * @param description    free-text description of the desired change
 * @param clarifications answers collected during 2-refine, in the order received
 * @param changeType     change type if the requester already knows it; may be {@code null}
 */
public record PlanRequest(
    String title,
    String description,
    List<String> clarifications,
    ChangeType changeType
) {

    @JsonCreator
    public PlanRequest {
        clarifications = clarifications == null ? List.of() : List.copyOf(clarifications);
    }

    public PlanRequest(String title, String description) {
        this(title, description, List.of(), null);
    }

    public PlanRequest withClarification(String answer) {
        var updated = new ArrayList<>(clarifications);
        updated.add(answer);
        return new PlanRequest(title, description, updated, changeType);
    }
}
