package com.planmarshall.core.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-plan artifact storage keyed by plan id.
 * <p>
 * {@link #commit} is atomic across artifacts: after a crash a subsequent {@link #load} sees either
 * every artifact of the commit or none of them.
 */
public interface PlanStore {

    boolean exists(String planId);

    /**
     * Loads all artifacts of a plan as of its last completed commit. Never modifies the store.
     *
     * @throws com.planmarshall.core.error.PlanNotFoundException if the plan was never committed
     */
    PlanSnapshot load(String planId);

    Optional<PlanSnapshot> find(String planId);

    void commit(PlanSnapshot snapshot);

    /**
     * Rolls an interrupted commit forward or discards it. Callers hold the plan's writer lock.
     */
    void recover(String planId);

    /** Ids of all stored plans, sorted. */
    List<String> listPlanIds();
}
