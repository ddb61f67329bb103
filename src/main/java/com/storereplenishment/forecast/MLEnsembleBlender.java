package com.storereplenishment.forecast;

import com.storereplenishment.client.ModelServingClient;
import com.storereplenishment.domain.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Mixes the external model's estimate into the rule-based forecast once an item has
 * enough history. Any problem with the model leaves the rule-based forecast as is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MLEnsembleBlender {

    private final ModelServingClient modelServingClient;
    private final FeatureVectorBuilder featureVectorBuilder;

    /** Asks the model service for its expected input size once per run. */
    public ModelStatus checkModel(RunContext context) {
        if (!context.blend().modelEnabled()) {
            return ModelStatus.unavailable("model disabled");
        }
        try {
            ModelServingClient.ModelInfo info = modelServingClient.modelInfo()
                .block(modelServingClient.timeout());
            if (info == null) {
                return ModelStatus.unavailable("empty model info");
            }
            if (info.featureCount() != featureVectorBuilder.featureCount()) {
                log.warn("Model feature mismatch, rule-only run | expected={} | built={} | version={}",
                         info.featureCount(), featureVectorBuilder.featureCount(), info.modelVersion());
                return ModelStatus.unavailable("feature mismatch: model expects " + info.featureCount()
                    + ", built " + featureVectorBuilder.featureCount());
            }
            return new ModelStatus(true, info.featureCount(), info.modelVersion(), null);
        } catch (RuntimeException ex) {
            log.warn("Model service check failed, rule-only run | runId={} | error={}",
                     context.runId(), ex.getMessage());
            return ModelStatus.unavailable("model check failed: " + ex.getMessage());
        }
    }

    public BlendResult blend(double ruleForecast, FeatureVectorBuilder.FeatureInput input,
                             ModelStatus status, RunContext context) {
        RunContext.BlendSettings settings = context.blend();
        int historyDays = input.features().historyDays();

        if (historyDays < settings.minSamples()) {
            return BlendResult.ruleOnly(ruleForecast, "history " + historyDays + " < " + settings.minSamples());
        }
        if (!status.available()) {
            return BlendResult.ruleOnly(ruleForecast, status.reason());
        }

        double[] vector = featureVectorBuilder.build(input);
        if (vector.length != status.featureCount()) {
            log.warn("Feature count mismatch | item={} | model={} | built={}",
                     input.itemId(), status.featureCount(), vector.length);
            return BlendResult.ruleOnly(ruleForecast, "feature mismatch");
        }

        Double modelForecast = predict(input.itemId(), vector, context);
        if (modelForecast == null) {
            return BlendResult.ruleOnly(ruleForecast, "model call failed");
        }
        if (modelForecast < 0 || modelForecast.isNaN()) {
            log.warn("Model returned invalid demand | item={} | demand={}", input.itemId(), modelForecast);
            return BlendResult.ruleOnly(ruleForecast, "invalid model output");
        }

        double weight = historyDays >= settings.fullWeightDays()
            ? settings.fullModelWeight()
            : settings.partialModelWeight();
        double blended = (1 - weight) * ruleForecast + weight * modelForecast;
        log.debug("Blended forecast | item={} | rule={} | model={} | weight={} | result={}",
                  input.itemId(), ruleForecast, modelForecast, weight, blended);
        return new BlendResult(blended, ruleForecast, modelForecast, weight, null);
    }

    private Double predict(String itemId, double[] vector, RunContext context) {
        try {
            ModelServingClient.ModelPrediction prediction = modelServingClient
                .predict(itemId, vector, context.runId().toString())
                .block(modelServingClient.timeout());
            return prediction != null ? prediction.demand() : null;
        } catch (RuntimeException ex) {
            log.warn("Model prediction failed, using rule forecast | item={} | error={}", itemId, ex.getMessage());
            return null;
        }
    }
}
