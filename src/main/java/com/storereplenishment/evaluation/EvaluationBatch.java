package com.storereplenishment.evaluation;

import com.storereplenishment.domain.Decision;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record EvaluationBatch(List<EvaluationResult> results, double highPopularity, double lowPopularity) {

    public Optional<EvaluationResult> forItem(String itemId) {
        return results.stream().filter(r -> r.itemId().equals(itemId)).findFirst();
    }

    public Map<Decision, Long> countsByDecision() {
        Map<Decision, Long> counts = new EnumMap<>(Decision.class);
        for (EvaluationResult r : results) {
            counts.merge(r.decision(), 1L, Long::sum);
        }
        return counts;
    }
}
