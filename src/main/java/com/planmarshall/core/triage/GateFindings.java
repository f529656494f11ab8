package com.planmarshall.core.triage;

import com.planmarshall.core.error.ValidationException;
import com.planmarshall.core.model.Finding;
import com.planmarshall.core.model.FindingRecord;
import com.planmarshall.core.model.FindingState;
import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.store.PlanSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Findings raised at a phase gate, by a quality gate ({@code qgate}) or by the user reviewing the
 * phase's output ({@code user_review}).
 * <p>
 * Gate findings live in the plan's findings log next to verification findings. They are keyed by
 * phase and finding id: raising a pending finding again is a no-op, raising a resolved one reopens it.
 */
public final class GateFindings {

    private static final Logger log = LoggerFactory.getLogger(GateFindings.class);

    public static final Set<PlanPhase> GATE_PHASES = EnumSet.of(
            PlanPhase.REFINE, PlanPhase.OUTLINE, PlanPhase.PLAN, PlanPhase.EXECUTE, PlanPhase.FINALIZE);

    public enum Status { ADDED, DEDUPLICATED, REOPENED }

    public record Added(PlanSnapshot snapshot, FindingRecord record, Status status) {}

    public record Cleared(PlanSnapshot snapshot, int cleared) {}

    private GateFindings() {
    }

    /**
     * @throws ValidationException if the phase has no gate or the finding does not come from a gate
     */
    public static Added add(PlanSnapshot snapshot, PlanPhase phase, Finding finding, int iteration) {
        requireGatePhase(phase);
        if (finding == null || !FindingRecord.isGateSource(finding.source())) {
            throw new ValidationException("Gate findings need source " + FindingRecord.QGATE_SOURCE + " or "
                    + FindingRecord.USER_REVIEW_SOURCE + ", got " + (finding == null ? null : finding.source()));
        }
        var records = new ArrayList<>(snapshot.findings());
        for (int i = 0; i < records.size(); i++) {
            var existing = records.get(i);
            if (!isGateRecord(existing, phase) || !existing.id().equals(finding.id())) {
                continue;
            }
            if (existing.state() == FindingState.PENDING) {
                log.debug("Gate finding {} in {} is already pending", finding.id(), phase);
                return new Added(snapshot, existing, Status.DEDUPLICATED);
            }
            var reopened = existing.reopen(iteration, "raised again after " + existing.state());
            records.set(i, reopened);
            log.info("Gate finding {} in {} reopened (was {})", finding.id(), phase, existing.state());
            return new Added(snapshot.withFindings(records), reopened, Status.REOPENED);
        }
        var record = FindingRecord.gateFinding(finding, phase, iteration);
        records.add(record);
        log.info("Gate finding {} recorded in {} by {}", finding.id(), phase, finding.source());
        return new Added(snapshot.withFindings(records), record, Status.ADDED);
    }

    /**
     * @throws ValidationException if the resolution is not a gate resolution or no such finding exists
     */
    public static PlanSnapshot resolve(PlanSnapshot snapshot, PlanPhase phase, String findingId,
                                       FindingState resolution, String detail) {
        requireGatePhase(phase);
        requireResolution(resolution);
        var records = new ArrayList<>(snapshot.findings());
        for (int i = 0; i < records.size(); i++) {
            var existing = records.get(i);
            if (isGateRecord(existing, phase) && existing.id().equals(findingId)) {
                records.set(i, existing.withState(resolution, detail));
                log.info("Gate finding {} in {} resolved as {}", findingId, phase, resolution);
                return snapshot.withFindings(records);
            }
        }
        throw new ValidationException("No gate finding " + findingId + " in phase " + phase.tag());
    }

    /** Resolves every pending gate finding of {@code phase}. */
    public static PlanSnapshot resolvePending(PlanSnapshot snapshot, PlanPhase phase, FindingState resolution,
                                              String detail) {
        requireResolution(resolution);
        var records = snapshot.findings().stream()
                .map(r -> isGateRecord(r, phase) && r.state() == FindingState.PENDING ? r.withState(resolution, detail) : r)
                .toList();
        return snapshot.withFindings(records);
    }

    /** Removes all gate findings of {@code phase} from the log. */
    public static Cleared clear(PlanSnapshot snapshot, PlanPhase phase) {
        requireGatePhase(phase);
        var kept = snapshot.findings().stream().filter(r -> !isGateRecord(r, phase)).toList();
        int cleared = snapshot.findings().size() - kept.size();
        log.info("Cleared {} gate finding(s) of {}", cleared, phase);
        return new Cleared(snapshot.withFindings(kept), cleared);
    }

    /**
     * @param state only findings in this state, or all when {@code null}
     */
    public static List<FindingRecord> query(PlanSnapshot snapshot, PlanPhase phase, FindingState state) {
        return snapshot.findings().stream()
                .filter(r -> isGateRecord(r, phase))
                .filter(r -> state == null || r.state() == state)
                .toList();
    }

    private static boolean isGateRecord(FindingRecord record, PlanPhase phase) {
        return record.isGateFinding() && record.phase() == phase;
    }

    private static void requireGatePhase(PlanPhase phase) {
        if (!GATE_PHASES.contains(phase)) {
            throw new ValidationException("Phase " + (phase == null ? null : phase.tag()) + " has no gate");
        }
    }

    private static void requireResolution(FindingState resolution) {
        if (resolution == null || !resolution.isGateResolution()) {
            throw new ValidationException("Not a gate finding resolution: " + resolution);
        }
    }
}
