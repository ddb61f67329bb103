package com.storereplenishment.evaluation;

import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.OutcomeClass;

/** After-the-fact verdict on one decision given what actually sold. */
public final class OutcomeJudge {

    private OutcomeJudge() {
    }

    public static OutcomeClass judge(Decision decision, int actualSold, boolean wasStockout) {
        if (decision == Decision.FORCE_ORDER) {
            return actualSold > 0 ? OutcomeClass.CORRECT : OutcomeClass.OVER_ORDER;
        }
        if (decision == Decision.URGENT_ORDER) {
            return (wasStockout || actualSold > 0) ? OutcomeClass.CORRECT : OutcomeClass.OVER_ORDER;
        }
        if (decision == Decision.NORMAL_ORDER) {
            if (actualSold > 0) {
                return OutcomeClass.CORRECT;
            }
            return wasStockout ? OutcomeClass.UNDER_ORDER : OutcomeClass.OVER_ORDER;
        }
        if (decision == Decision.PASS) {
            return wasStockout ? OutcomeClass.UNDER_ORDER : OutcomeClass.CORRECT;
        }
        return wasStockout ? OutcomeClass.MISS : OutcomeClass.CORRECT;
    }
}
