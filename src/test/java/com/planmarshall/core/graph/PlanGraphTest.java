package com.planmarshall.core.graph;

import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.WaitReason;
import com.planmarshall.core.state.PlanGraphState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PlanGraphTest {

    private static PlanGraphState state(PlanPhase phase, WaitReason waitingOn, boolean loopBack) {
        Map<String, Object> data = new HashMap<>(PlanGraphState.initial("add-login", phase));
        data.putAll(PlanGraphState.update(phase, waitingOn, loopBack));
        return new PlanGraphState(data);
    }

    @ParameterizedTest
    @EnumSource(value = PlanPhase.class, names = {"COMPLETE", "FAILED", "CANCELLED"})
    @DisplayName("terminal phases end the run")
    void terminalEnds(PlanPhase phase) {
        assertEquals(END, PlanGraph.route(state(phase, WaitReason.NONE, false)));
    }

    @Test
    @DisplayName("suspended plan ends the run in its phase")
    void suspendedEnds() {
        assertEquals(END, PlanGraph.route(state(PlanPhase.REFINE, WaitReason.CLARIFICATION, false)));
        assertEquals(END, PlanGraph.route(state(PlanPhase.EXECUTE, WaitReason.BLOCKED_TASKS, false)));
    }

    @Test
    @DisplayName("verify loop-back ends the run so the next one re-enters execute")
    void loopBackEnds() {
        assertEquals(END, PlanGraph.route(state(PlanPhase.EXECUTE, WaitReason.NONE, true)));
    }

    @Test
    @DisplayName("a running plan routes to the node of its phase")
    void routesToPhaseNode() {
        assertEquals("3-outline", PlanGraph.route(state(PlanPhase.OUTLINE, WaitReason.NONE, false)));
        assertEquals(PlanPhase.VERIFY.tag(), PlanGraph.route(state(PlanPhase.VERIFY, WaitReason.NONE, false)));
    }
}
