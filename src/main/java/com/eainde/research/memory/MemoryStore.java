package com.eainde.research.memory;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.model.Company;
import com.eainde.research.model.Feedback;
import com.eainde.research.model.Insight;
import com.eainde.research.model.ResearchPattern;
import com.eainde.research.model.RewardTrainingSample;
import com.eainde.research.model.Signal;
import com.eainde.research.model.SimilarityMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Single entry point to durable memory: episodic (signals, insights),
 * feedback, research patterns, semantic company facts and reward samples.
 * <p>
 * Every write is atomic per entity and visible to the next read. Write
 * failures surface as {@link com.eainde.research.exception.PersistenceException}.
 * </p>
 */
@Service
@RequiredArgsConstructor
public class MemoryStore {

    private final SignalRepository signals;
    private final InsightRepository insights;
    private final FeedbackRepository feedback;
    private final ResearchPatternRepository patterns;
    private final CompanyRepository companies;
    private final RewardSampleRepository rewardSamples;
    private final ResearchProperties properties;

    // ---- signals

    public Signal createSignal(Signal signal) {
        return signals.insert(signal);
    }

    public Optional<Signal> findSignal(long id) {
        return signals.findById(id);
    }

    public List<Signal> findUnprocessedSignals(int limit) {
        return signals.findUnprocessed(limit);
    }

    public void markProcessed(long signalId, Long insightId) {
        signals.markProcessed(signalId, insightId);
    }

    // ---- insights

    public Insight insertInsight(Insight insight) {
        if (insight.embedding() != null) {
            SimilaritySearch.checkDimension(insight.embedding(), properties.getEmbedding().getDimension());
        }
        return insights.insert(insight);
    }

    public Optional<Insight> findInsight(long id) {
        return insights.findById(id);
    }

    public Optional<Insight> findInsightBySignalId(long signalId) {
        return insights.findBySignalId(signalId);
    }

    public List<Insight> findInsightsBySubject(String subject, int limit) {
        return insights.findBySubject(subject, limit);
    }

    public List<Insight> findDigest(double minScore) {
        return insights.findUndisplayed(minScore);
    }

    public List<Insight> findHighRatedInsights(String signalType, double minRating, int limit) {
        return insights.findHighRated(signalType, minRating, limit);
    }

    public boolean markShown(long insightId) {
        return insights.markShown(insightId);
    }

    public List<SimilarityMatch<Insight>> findSimilarInsights(float[] query, int k, double minSimilarity) {
        SimilaritySearch.checkDimension(query, properties.getEmbedding().getDimension());
        return SimilaritySearch.topK(insights.findAllWithEmbedding(), Insight::embedding, query, k, minSimilarity);
    }

    // ---- feedback

    public Feedback insertFeedback(Feedback entry) {
        return feedback.insert(entry);
    }

    public List<Feedback> findFeedback(long insightId) {
        return feedback.findByInsightId(insightId);
    }

    // ---- research patterns

    public Optional<ResearchPattern> findPattern(String name) {
        return patterns.findByName(name);
    }

    public ResearchPattern savePattern(ResearchPattern pattern) {
        if (pattern.embedding() != null) {
            SimilaritySearch.checkDimension(pattern.embedding(), properties.getEmbedding().getDimension());
        }
        return patterns.save(pattern);
    }

    public List<SimilarityMatch<ResearchPattern>> findSimilarPatterns(float[] query, int k, double minSimilarity) {
        SimilaritySearch.checkDimension(query, properties.getEmbedding().getDimension());
        return SimilaritySearch.topK(patterns.findAll(), ResearchPattern::embedding, query, k, minSimilarity);
    }

    // ---- companies

    public Optional<Company> findCompany(String symbol) {
        return companies.findBySymbol(symbol);
    }

    public void saveCompany(Company company) {
        if (company.embedding() != null) {
            SimilaritySearch.checkDimension(company.embedding(), properties.getEmbedding().getDimension());
        }
        companies.save(company);
    }

    public List<SimilarityMatch<Company>> findSimilarCompanies(float[] query, int k, double minSimilarity) {
        SimilaritySearch.checkDimension(query, properties.getEmbedding().getDimension());
        return SimilaritySearch.topK(companies.findAllWithEmbedding(), Company::embedding, query, k, minSimilarity);
    }

    // ---- reward samples

    public void insertRewardSample(RewardTrainingSample sample) {
        rewardSamples.insert(sample);
    }

    public List<RewardTrainingSample> findUnusedRewardSamples() {
        return rewardSamples.findUnused();
    }

    public List<RewardTrainingSample> findAllRewardSamples() {
        return rewardSamples.findAll();
    }

    public void markRewardSamplesUsed(Collection<Long> ids) {
        rewardSamples.markUsed(ids);
    }
}
