package com.eainde.research.gate;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.memory.MemoryStore;
import com.eainde.research.model.RewardTrainingSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Periodically refits the reward model once enough new ratings have arrived.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class RetrainingJob {

    private final MemoryStore memoryStore;
    private final LogisticRewardTrainer trainer;
    private final QualityGate qualityGate;
    private final ResearchProperties properties;

    @Scheduled(cron = "${research.gate.retrain-cron:0 0 2 * * *}")
    public void scheduledRetrain() {
        retrain();
    }

    /**
     * @return true when a new model was installed
     */
    public boolean retrain() {
        List<RewardTrainingSample> unused = memoryStore.findUnusedRewardSamples();
        int minSamples = properties.getGate().getMinTrainingSamples();
        if (unused.size() < minSamples) {
            log.info("[Reward] {} new samples, waiting for {}", unused.size(), minSamples);
            return false;
        }

        Optional<LogisticRewardModel> trained = trainer.train(memoryStore.findAllRewardSamples());
        if (trained.isEmpty()) {
            return false;
        }
        qualityGate.swapModel(trained.get());
        memoryStore.markRewardSamplesUsed(unused.stream().map(RewardTrainingSample::id).toList());
        return true;
    }
}
