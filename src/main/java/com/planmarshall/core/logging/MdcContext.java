package com.planmarshall.core.logging;

import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.Task;
import org.slf4j.MDC;

/**
 * Utility for managing plan-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String PLAN_ID = "planId";
    public static final String PHASE = "phase";
    public static final String TASK_NUMBER = "taskNumber";
    public static final String PROFILE = "profile";

    private MdcContext() {}

    public static void setPlan(String planId) {
        MDC.put(PLAN_ID, planId);
    }

    public static void setPhase(String planId, PlanPhase phase) {
        MDC.put(PLAN_ID, planId);
        MDC.put(PHASE, phase.tag());
    }

    public static void setTask(String planId, Task task) {
        MDC.put(PLAN_ID, planId);
        MDC.put(PHASE, PlanPhase.EXECUTE.tag());
        MDC.put(TASK_NUMBER, String.valueOf(task.number()));
        MDC.put(PROFILE, task.profile());
    }

    public static void clearTask() {
        MDC.remove(TASK_NUMBER);
        MDC.remove(PROFILE);
    }

    public static void clear() {
        MDC.remove(PLAN_ID);
        MDC.remove(PHASE);
        MDC.remove(TASK_NUMBER);
        MDC.remove(PROFILE);
    }
}
