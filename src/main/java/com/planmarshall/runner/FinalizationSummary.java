package com.planmarshall.runner;

import com.planmarshall.core.model.Deliverable;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.IterationCounters;
import com.planmarshall.core.model.SuppressionNote;
import com.planmarshall.core.model.Task;

import java.util.List;

/**
 * Everything 7-finalize hands to the {@link Finalizer}. Suppression notes carry what is needed to
 * emit suppression annotations.
 */
public record FinalizationSummary(
    String planId,
    String title,
    List<String> domains,
    IterationCounters iterations,
    List<Deliverable> deliverables,
    List<Task> tasks,
    List<FindingRecord> findings,
    List<SuppressionNote> suppressions
) {}
