package com.eainde.research.workflow;

import com.eainde.research.checkpoint.ResearchCheckpointSaver;
import com.eainde.research.edges.DiscoveryRoutingEdge;
import com.eainde.research.edges.FailureRoutingEdge;
import com.eainde.research.execution.StageExecutor;
import com.eainde.research.gate.QualityGate;
import com.eainde.research.nodes.ContextNode;
import com.eainde.research.nodes.DiscoveryNode;
import com.eainde.research.nodes.FanOutJoinNode;
import com.eainde.research.nodes.GateStopNode;
import com.eainde.research.nodes.ResearchInputs;
import com.eainde.research.nodes.ResearchLevelNode;
import com.eainde.research.nodes.SynthesisNode;
import com.eainde.research.nodes.ValidationNode;
import com.eainde.research.stage.StageName;
import com.eainde.research.state.ResearchState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * The research pipeline:
 * <pre>
 * discovery -[continue]-> deep_research -> {level1, level2, level3} -> research_join
 *           -[stop]-----> gate_stop -> END
 * research_join -> level4 -> context -> validation -> synthesis -> persist -> END
 * </pre>
 * Every stage also has a {@code failed} route straight to END. Each node runs
 * behind a {@link GuardedNode} and every step is checkpointed by the
 * {@link ResearchCheckpointSaver}.
 */
@Component
public class ResearchPipelineGraph {

    public static final String DEEP_RESEARCH = "deep_research";
    public static final String RESEARCH_JOIN = "research_join";
    public static final String GATE_STOP = "gate_stop";
    public static final List<StageName> FAN_OUT = List.of(StageName.LEVEL1, StageName.LEVEL2, StageName.LEVEL3);

    private final DiscoveryNode discoveryNode;
    private final ContextNode contextNode;
    private final ValidationNode validationNode;
    private final SynthesisNode synthesisNode;
    private final GateStopNode gateStopNode;
    private final InsightPersister insightPersister;
    private final DiscoveryRoutingEdge discoveryRoutingEdge;
    private final FailureRoutingEdge failureRoutingEdge;
    private final ResearchInputs researchInputs;
    private final StageExecutor stageExecutor;
    private final RunGuards runGuards;

    public ResearchPipelineGraph(DiscoveryNode discoveryNode,
                                 ContextNode contextNode,
                                 ValidationNode validationNode,
                                 SynthesisNode synthesisNode,
                                 GateStopNode gateStopNode,
                                 InsightPersister insightPersister,
                                 DiscoveryRoutingEdge discoveryRoutingEdge,
                                 FailureRoutingEdge failureRoutingEdge,
                                 ResearchInputs researchInputs,
                                 StageExecutor stageExecutor,
                                 RunGuards runGuards) {
        this.discoveryNode = discoveryNode;
        this.contextNode = contextNode;
        this.validationNode = validationNode;
        this.synthesisNode = synthesisNode;
        this.gateStopNode = gateStopNode;
        this.insightPersister = insightPersister;
        this.discoveryRoutingEdge = discoveryRoutingEdge;
        this.failureRoutingEdge = failureRoutingEdge;
        this.researchInputs = researchInputs;
        this.stageExecutor = stageExecutor;
        this.runGuards = runGuards;
    }

    @Bean("researchPipeline")
    public CompiledGraph<ResearchState> build(ResearchCheckpointSaver checkpointSaver) throws GraphStateException {
        return workflow().compile(CompileConfig.builder()
                .checkpointSaver(checkpointSaver)
                .build());
    }

    public StateGraph<ResearchState> workflow() throws GraphStateException {
        requireDisjointWrites(FAN_OUT);

        StateGraph<ResearchState> workflow = new StateGraph<>(ResearchState.SCHEMA, ResearchState::new);

        addGuarded(workflow, StageName.DISCOVERY.key(), discoveryNode);
        addGuarded(workflow, DEEP_RESEARCH, state -> CompletableFuture.completedFuture(Map.of()));
        for (StageName level : FAN_OUT) {
            addGuarded(workflow, level.key(), new ResearchLevelNode(level, stageExecutor, inputsOf(level), true));
        }
        addGuarded(workflow, RESEARCH_JOIN, new FanOutJoinNode(FAN_OUT));
        addGuarded(workflow, StageName.LEVEL4.key(),
                new ResearchLevelNode(StageName.LEVEL4, stageExecutor, researchInputs::level4));
        addGuarded(workflow, StageName.CONTEXT.key(), contextNode);
        addGuarded(workflow, StageName.VALIDATION.key(), validationNode);
        addGuarded(workflow, StageName.SYNTHESIS.key(), synthesisNode);
        addGuarded(workflow, GATE_STOP, gateStopNode);
        addGuarded(workflow, InsightPersister.STEP, insightPersister);

        workflow.addEdge(START, StageName.DISCOVERY.key());
        workflow.addConditionalEdges(
                StageName.DISCOVERY.key(),
                discoveryRoutingEdge,
                Map.of(
                        QualityGate.CONTINUE, DEEP_RESEARCH,
                        QualityGate.STOP, GATE_STOP,
                        FailureRoutingEdge.FAILED, END
                )
        );
        for (StageName level : FAN_OUT) {
            workflow.addEdge(DEEP_RESEARCH, level.key());
            workflow.addEdge(level.key(), RESEARCH_JOIN);
        }
        continueUnlessFailed(workflow, RESEARCH_JOIN, StageName.LEVEL4.key());
        continueUnlessFailed(workflow, StageName.LEVEL4.key(), StageName.CONTEXT.key());
        continueUnlessFailed(workflow, StageName.CONTEXT.key(), StageName.VALIDATION.key());
        continueUnlessFailed(workflow, StageName.VALIDATION.key(), StageName.SYNTHESIS.key());
        continueUnlessFailed(workflow, StageName.SYNTHESIS.key(), InsightPersister.STEP);
        workflow.addEdge(InsightPersister.STEP, END);
        workflow.addEdge(GATE_STOP, END);

        return workflow;
    }

    /**
     * Fan-out members are merged into one state, so no two of them may own
     * the same slot.
     */
    public static void requireDisjointWrites(List<StageName> members) throws GraphStateException {
        Map<String, StageName> owners = new HashMap<>();
        for (StageName member : members) {
            for (String key : member.writes()) {
                StageName owner = owners.putIfAbsent(key, member);
                if (owner != null) {
                    throw new GraphStateException("Fan-out members '%s' and '%s' both write '%s'"
                            .formatted(owner.key(), member.key(), key));
                }
            }
        }
    }

    private Function<ResearchState, Map<String, Object>> inputsOf(StageName level) {
        switch (level) {
            case LEVEL1:
                return researchInputs::level1;
            case LEVEL2:
                return researchInputs::level2;
            case LEVEL3:
                return researchInputs::level3;
            default:
                throw new IllegalArgumentException("Stage " + level.key() + " is not a fan-out level");
        }
    }

    private void addGuarded(StateGraph<ResearchState> workflow, String nodeId,
                            AsyncNodeAction<ResearchState> action) throws GraphStateException {
        workflow.addNode(nodeId, new GuardedNode(nodeId, action, runGuards));
    }

    private void continueUnlessFailed(StateGraph<ResearchState> workflow, String from, String to)
            throws GraphStateException {
        workflow.addConditionalEdges(from, failureRoutingEdge,
                Map.of(FailureRoutingEdge.CONTINUE, to, FailureRoutingEdge.FAILED, END));
    }
}
