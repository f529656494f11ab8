package com.planmarshall.core.state;

import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.WaitReason;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.Map;

/**
 * Graph state for one segment of a plan run.
 * <p>
 * The durable plan lives in the plan store; the graph only carries what routing needs: which plan,
 * the phase it reached, whether it is suspended and whether the last node looped back.
 */
public class PlanGraphState extends AgentState {

    public static final String PLAN_ID = "planId";
    public static final String PHASE = "phase";
    public static final String WAITING_ON = "waitingOn";
    public static final String LOOP_BACK = "loopBack";

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
        PLAN_ID,    Channels.base(() -> ""),
        PHASE,      Channels.base(() -> PlanPhase.INIT.tag()),
        WAITING_ON, Channels.base(() -> WaitReason.NONE.name()),
        LOOP_BACK,  Channels.base(() -> false)
    );

    public PlanGraphState(Map<String, Object> initData) {
        super(initData);
    }

    public static Map<String, Object> initial(String planId, PlanPhase phase) {
        return Map.of(
                PLAN_ID, planId,
                PHASE, phase.tag(),
                WAITING_ON, WaitReason.NONE.name(),
                LOOP_BACK, false);
    }

    public static Map<String, Object> update(PlanPhase phase, WaitReason waitingOn, boolean loopBack) {
        return Map.of(
                PHASE, phase.tag(),
                WAITING_ON, waitingOn.name(),
                LOOP_BACK, loopBack);
    }

    public String planId() {
        return this.<String>value(PLAN_ID).orElse("");
    }

    public PlanPhase phase() {
        return PlanPhase.fromTag(this.<String>value(PHASE).orElse(PlanPhase.INIT.tag()));
    }

    public WaitReason waitingOn() {
        return WaitReason.valueOf(this.<String>value(WAITING_ON).orElse(WaitReason.NONE.name()));
    }

    public boolean loopBack() {
        return this.<Boolean>value(LOOP_BACK).orElse(false);
    }
}
