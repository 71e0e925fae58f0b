package com.eainde.research.gate;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.model.InsightFeatures;
import com.eainde.research.model.RewardTrainingSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Fits a {@link LogisticRewardModel} with batch gradient descent and L2
 * regularisation. Label is {@code rating >= 4}.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class LogisticRewardTrainer {

    private final ResearchProperties properties;

    /**
     * @return empty when there are too few samples or only one class is present
     */
    public Optional<LogisticRewardModel> train(List<RewardTrainingSample> samples) {
        ResearchProperties.Gate gate = properties.getGate();
        if (samples.size() < gate.getMinTrainingSamples()) {
            log.info("[Reward] {} samples, need {} to train", samples.size(), gate.getMinTrainingSamples());
            return Optional.empty();
        }

        int n = samples.size();
        int d = InsightFeatures.SIZE;
        double[][] x = new double[n][];
        double[] y = new double[n];
        int positives = 0;
        for (int i = 0; i < n; i++) {
            RewardTrainingSample sample = samples.get(i);
            x[i] = sample.features().toArray();
            y[i] = sample.humanRating() >= 4 ? 1.0 : 0.0;
            positives += (int) y[i];
        }
        if (positives == 0 || positives == n) {
            log.warn("[Reward] all {} samples share one label, keeping current model", n);
            return Optional.empty();
        }

        double[] means = new double[d];
        double[] scales = new double[d];
        for (int j = 0; j < d; j++) {
            double sum = 0;
            for (double[] row : x) {
                sum += row[j];
            }
            means[j] = sum / n;
            double var = 0;
            for (double[] row : x) {
                var += (row[j] - means[j]) * (row[j] - means[j]);
            }
            double std = Math.sqrt(var / n);
            scales[j] = std < 1e-9 ? 1.0 : std;
        }

        double[] w = new double[d];
        double b = 0;
        double lr = gate.getLearningRate();
        double l2 = gate.getL2();
        for (int epoch = 0; epoch < gate.getEpochs(); epoch++) {
            double[] gradW = new double[d];
            double gradB = 0;
            for (int i = 0; i < n; i++) {
                double z = b;
                for (int j = 0; j < d; j++) {
                    z += w[j] * ((x[i][j] - means[j]) / scales[j]);
                }
                double err = 1.0 / (1.0 + Math.exp(-z)) - y[i];
                for (int j = 0; j < d; j++) {
                    gradW[j] += err * ((x[i][j] - means[j]) / scales[j]);
                }
                gradB += err;
            }
            for (int j = 0; j < d; j++) {
                w[j] -= lr * (gradW[j] / n + l2 * w[j]);
            }
            b -= lr * gradB / n;
        }

        log.info("[Reward] trained on {} samples ({} positive)", n, positives);
        return Optional.of(new LogisticRewardModel(w, b, means, scales, n));
    }
}
