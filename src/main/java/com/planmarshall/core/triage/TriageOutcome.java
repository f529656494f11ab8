package com.planmarshall.core.triage;

import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.Task;
import com.planmarshall.core.model.TriageDecision;

import java.util.List;

/**
 * Output of one triage run.
 *
 * @param records  one record per distinct finding in processing order, then the findings of handler escalations
 * @param fixTasks fix tasks, numbered in first-appearance order of their target
 */
public record TriageOutcome(List<FindingRecord> records, List<Task> fixTasks) {

    public TriageOutcome {
        records = List.copyOf(records);
        fixTasks = List.copyOf(fixTasks);
    }

    public long count(TriageDecision decision) {
        return records.stream().filter(r -> r.decision() == decision).count();
    }
}
