package com.eainde.research.controller;

import com.eainde.research.checkpoint.CheckpointEntry;
import com.eainde.research.checkpoint.ResearchCheckpointSaver;
import com.eainde.research.config.ResearchProperties;
import com.eainde.research.exception.EntityNotFoundException;
import com.eainde.research.feedback.FeedbackRequest;
import com.eainde.research.feedback.FeedbackService;
import com.eainde.research.memory.MemoryStore;
import com.eainde.research.model.Feedback;
import com.eainde.research.model.Signal;
import com.eainde.research.scheduler.ResearchScheduler;
import com.eainde.research.state.ResearchState;
import com.eainde.research.workflow.PipelineEngine;
import com.eainde.research.workflow.RunOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ResearchController {

    private final MemoryStore memoryStore;
    private final ResearchCheckpointSaver checkpointSaver;
    private final PipelineEngine engine;
    private final ResearchScheduler scheduler;
    private final FeedbackService feedbackService;
    private final ResearchProperties properties;

    @PostMapping("/signals")
    public ResponseEntity<Map<String, Object>> ingestSignal(@RequestBody SignalRequest request,
                                                            @RequestParam(defaultValue = "true") boolean run) {
        if (request.signalType() == null || request.signalType().isBlank()) {
            throw new IllegalArgumentException("signal_type is required");
        }
        Signal signal = memoryStore.createSignal(
                Signal.pending(request.signalType(), request.subject(), request.payload()));
        boolean dispatched = run && scheduler.dispatch(signal);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("signal_id", signal.id());
        body.put("run_id", PipelineEngine.runIdFor(signal.id()));
        body.put("dispatched", dispatched);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/runs/{runId}")
    public Map<String, Object> getRun(@PathVariable String runId) {
        CheckpointEntry latest = checkpointSaver.latest(runId)
                .orElseThrow(() -> new EntityNotFoundException("Run", runId));
        ResearchState state = new ResearchState(latest.state());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", runId);
        body.put("signal_id", state.getSignalId());
        body.put("sequence", latest.sequence());
        body.put("status", latest.status().name());
        body.put("stage_pointer", latest.stagePointer());
        body.put("next_node", latest.nextNodeId());
        body.put("research_path", state.getResearchPath());
        state.getInsightId().ifPresent(id -> body.put("insight_id", id));
        state.getDouble(ResearchState.QUALITY_SCORE).ifPresent(score -> body.put("quality_score", score));
        state.getFailure().ifPresent(failure -> body.put("failure", failure));
        return body;
    }

    @PostMapping("/runs/{runId}/resume")
    public Map<String, Object> resumeRun(@PathVariable String runId) {
        RunOutcome outcome = engine.resume(runId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", outcome.runId());
        body.put("status", outcome.status().name());
        body.put("research_path", outcome.researchPath());
        if (outcome.insightId() != null) {
            body.put("insight_id", outcome.insightId());
        }
        if (outcome.failure() != null) {
            body.put("failure", outcome.failure().toMap());
        }
        return body;
    }

    @PostMapping("/insights/{id}/feedback")
    public ResponseEntity<Feedback> submitFeedback(@PathVariable long id, @RequestBody FeedbackRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(feedbackService.record(id, request));
    }

    @GetMapping("/insights/digest")
    public List<InsightView> digest() {
        return memoryStore.findDigest(properties.getGate().getPersistenceThreshold()).stream()
                .map(InsightView::of)
                .toList();
    }

    @PostMapping("/insights/{id}/shown")
    public ResponseEntity<Void> markShown(@PathVariable long id) {
        if (!memoryStore.markShown(id)) {
            throw new EntityNotFoundException("Insight", id);
        }
        return ResponseEntity.noContent().build();
    }
}
