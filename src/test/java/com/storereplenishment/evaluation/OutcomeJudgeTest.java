package com.storereplenishment.evaluation;

import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.OutcomeClass;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutcomeJudgeTest {

    @Test
    void judge_orderDecisions() {
        assertThat(OutcomeJudge.judge(Decision.FORCE_ORDER, 2, false)).isEqualTo(OutcomeClass.CORRECT);
        assertThat(OutcomeJudge.judge(Decision.FORCE_ORDER, 0, false)).isEqualTo(OutcomeClass.OVER_ORDER);
        assertThat(OutcomeJudge.judge(Decision.URGENT_ORDER, 0, true)).isEqualTo(OutcomeClass.CORRECT);
        assertThat(OutcomeJudge.judge(Decision.URGENT_ORDER, 0, false)).isEqualTo(OutcomeClass.OVER_ORDER);
        assertThat(OutcomeJudge.judge(Decision.NORMAL_ORDER, 1, true)).isEqualTo(OutcomeClass.CORRECT);
        assertThat(OutcomeJudge.judge(Decision.NORMAL_ORDER, 0, true)).isEqualTo(OutcomeClass.UNDER_ORDER);
        assertThat(OutcomeJudge.judge(Decision.NORMAL_ORDER, 0, false)).isEqualTo(OutcomeClass.OVER_ORDER);
    }

    @Test
    void judge_suppressedDecisions() {
        assertThat(OutcomeJudge.judge(Decision.PASS, 3, false)).isEqualTo(OutcomeClass.CORRECT);
        assertThat(OutcomeJudge.judge(Decision.PASS, 3, true)).isEqualTo(OutcomeClass.UNDER_ORDER);
        assertThat(OutcomeJudge.judge(Decision.SKIP, 0, false)).isEqualTo(OutcomeClass.CORRECT);
        assertThat(OutcomeJudge.judge(Decision.SKIP, 0, true)).isEqualTo(OutcomeClass.MISS);
    }
}
