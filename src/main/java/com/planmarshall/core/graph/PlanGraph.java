package com.planmarshall.core.graph;

import com.planmarshall.core.model.PlanPhase;
import com.planmarshall.core.model.WaitReason;
import com.planmarshall.core.nodes.ExecuteTasksNode;
import com.planmarshall.core.nodes.FinalizePlanNode;
import com.planmarshall.core.nodes.InitPlanNode;
import com.planmarshall.core.nodes.OutlineSolutionNode;
import com.planmarshall.core.nodes.PhaseNode;
import com.planmarshall.core.nodes.PlanTasksNode;
import com.planmarshall.core.nodes.RefineRequestNode;
import com.planmarshall.core.nodes.VerifyPlanNode;
import com.planmarshall.core.state.PlanGraphState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a plan through its phases.
 * <p>
 * Topology: one node per working phase, every edge conditional on the phase the plan reached.
 * <pre>
 *   START -> [route] -> 1-init -> 2-refine -> 3-outline -> 4-plan -> 5-execute -> 6-verify -> 7-finalize -> END
 *   2-refine, 3-outline, 5-execute -> END  (suspended: clarification, review, blocked tasks)
 *   6-verify -> END                        (loop-back to 5-execute; the next run re-enters at 5-execute)
 *   any node -> END                        (complete, failed or cancelled)
 * </pre>
 * The entry route reads the stored phase, so one invocation runs from wherever the plan stands until
 * it suspends, terminates or loops back.
 */
@Component
public class PlanGraph {

    private static final Logger log = LoggerFactory.getLogger(PlanGraph.class);

    private final CompiledGraph<PlanGraphState> compiledGraph;

    public PlanGraph(InitPlanNode initNode,
                     RefineRequestNode refineNode,
                     OutlineSolutionNode outlineNode,
                     PlanTasksNode planNode,
                     ExecuteTasksNode executeNode,
                     VerifyPlanNode verifyNode,
                     FinalizePlanNode finalizeNode) throws GraphStateException {

        List<PhaseNode> nodes = List.of(initNode, refineNode, outlineNode, planNode, executeNode, verifyNode,
                finalizeNode);

        Map<String, String> routes = new HashMap<>();
        routes.put(END, END);
        var graph = new StateGraph<>(PlanGraphState.SCHEMA, PlanGraphState::new);
        for (var node : nodes) {
            graph.addNode(node.phase().tag(), node_async(node::apply));
            routes.put(node.phase().tag(), node.phase().tag());
        }
        graph.addConditionalEdges(START, edge_async(PlanGraph::route), routes);
        for (var node : nodes) {
            graph.addConditionalEdges(node.phase().tag(), edge_async(PlanGraph::route), routes);
        }

        this.compiledGraph = graph.compile();
        log.info("Plan graph compiled with phases {}", nodes.stream().map(n -> n.phase().tag()).toList());
    }

    /**
     * Next node for the phase the plan reached, or END when the plan suspended, terminated or looped back.
     */
    static String route(PlanGraphState state) {
        PlanPhase phase = state.phase();
        if (phase.isTerminal() || state.waitingOn() != WaitReason.NONE || state.loopBack()) {
            return END;
        }
        return phase.tag();
    }

    public CompiledGraph<PlanGraphState> getCompiledGraph() {
        return compiledGraph;
    }
}
