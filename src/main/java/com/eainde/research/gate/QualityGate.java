package com.eainde.research.gate;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.model.Insight;
import com.eainde.research.model.InsightFeatures;
import com.eainde.research.state.ResearchState;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The two decisions that bound the cost of a run: whether a discovered signal
 * deserves deep research, and whether a synthesized insight is worth keeping.
 * <p>
 * The persistence model can be swapped while runs are in flight; each
 * decision reads the reference once, so a run never mixes two models within
 * one decision.
 * </p>
 */
@Log4j2
@Component
public class QualityGate {

    public static final String CONTINUE = "continue";
    public static final String STOP = "stop";
    public static final String RECORDED = "recorded";

    private final AtomicReference<RewardModel> model = new AtomicReference<>(new SelfReportedScoreModel());
    private final ResearchProperties properties;

    public QualityGate(ResearchProperties properties) {
        this.properties = properties;
    }

    public String discoveryRoute(ResearchState state) {
        String route = state.isInteresting() ? CONTINUE : STOP;
        log.info("[Gate] discovery route={} runId={}", route, state.getRunId());
        return route;
    }

    public GateDecision evaluatePersistence(InsightFeatures features) {
        RewardModel current = model.get();
        double threshold = properties.getGate().getPersistenceThreshold();
        double score = current.score(features);
        boolean pass = score >= threshold;
        log.info("[Gate] persistence score={} threshold={} pass={} model={}",
                String.format("%.3f", score), threshold, pass, current.name());
        return new GateDecision(pass, score, threshold, current.name());
    }

    /**
     * The decision an already stored insight passed with. Never re-scores, so
     * a model swapped since then cannot undo the write.
     */
    public GateDecision recorded(Insight insight) {
        Object score = insight.metadata() == null ? null : insight.metadata().get(Insight.META_QUALITY_SCORE);
        double recordedScore = score instanceof Number number ? number.doubleValue() : insight.interestingnessScore();
        return new GateDecision(true, recordedScore, properties.getGate().getPersistenceThreshold(), RECORDED);
    }

    public void swapModel(RewardModel next) {
        RewardModel previous = model.getAndSet(next);
        log.info("[Gate] reward model swapped {} -> {}", previous.name(), next.name());
    }

    public RewardModel currentModel() {
        return model.get();
    }
}
