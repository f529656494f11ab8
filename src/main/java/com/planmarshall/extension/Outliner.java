package com.planmarshall.extension;

import com.planmarshall.core.model.Deliverable;

import java.util.List;

/**
 * Turns a request into deliverables for one domain.
 * <p>
 * Deliverable numbers and {@code dependsOn} references are local to the returned list; the orchestrator
 * renumbers them into the plan-wide sequence.
 */
@FunctionalInterface
public interface Outliner extends Extension {

    List<Deliverable> outline(OutlineRequest request);
}
