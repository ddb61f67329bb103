package com.storereplenishment.forecast;

import com.storereplenishment.domain.ShelfLifeGroup;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SafetyStockCalculatorTest {

    private final SafetyStockCalculator calculator = new SafetyStockCalculator();

    @Test
    void calculate_shortLifeFastMoverWithLowVolatility() {
        SafetyStock safety = calculator.calculate(SafetyPolicy.shelfLife(0.0, 10.0), 5, 10.0, 0.251, 1.0);

        assertThat(safety.shelfLifeGroup()).isEqualTo(ShelfLifeGroup.SHORT);
        assertThat(safety.baseDays()).isEqualTo(0.7);
        assertThat(safety.turnoverMultiplier()).isEqualTo(1.5);
        assertThat(safety.volatilityMultiplier()).isEqualTo(1.0);
        assertThat(safety.units()).isCloseTo(10.5, within(1e-9));
    }

    @Test
    void calculate_appliesDisuseDiscountOnlyForPerishablePolicy() {
        SafetyStock perishable = calculator.calculate(SafetyPolicy.perishable(0.0, 10.0), 2, 10.0, 0.1, 0.8);
        SafetyStock plain = calculator.calculate(SafetyPolicy.shelfLife(0.0, 10.0), 2, 10.0, 0.1, 0.8);

        assertThat(perishable.units()).isCloseTo(0.5 * 1.5 * 0.8 * 10.0, within(1e-9));
        assertThat(plain.disuseCoefficient()).isEqualTo(1.0);
        assertThat(plain.units()).isCloseTo(7.5, within(1e-9));
    }

    @Test
    void calculate_fixedPolicyIgnoresShelfLife() {
        SafetyStock safety = calculator.calculate(SafetyPolicy.fixed(2.0), 365, 4.0, 1.2, 1.0);

        assertThat(safety.days()).isEqualTo(2.0);
        assertThat(safety.units()).isEqualTo(8.0);
    }

    @Test
    void calculate_perishableFixedPolicyIsDiscountedByDisuse() {
        SafetyStock safety = calculator.calculate(SafetyPolicy.perishableFixed(0.5), 5, 4.0, 0.2, 0.6);

        assertThat(safety.days()).isCloseTo(0.3, within(1e-9));
        assertThat(safety.units()).isCloseTo(1.2, within(1e-9));
        assertThat(safety.disuseCoefficient()).isEqualTo(0.6);
    }

    @Test
    void calculate_clampsDaysToPolicyBounds() {
        SafetyStock safety = calculator.calculate(SafetyPolicy.shelfLife(1.0, 2.5), 200, 1.0, 0.9, 1.0);

        assertThat(safety.days()).isEqualTo(2.5);
    }

    @Test
    void multipliers_followTurnoverAndVolatilityBands() {
        assertThat(calculator.turnoverMultiplier(0.5)).isEqualTo(0.8);
        assertThat(calculator.turnoverMultiplier(2.0)).isEqualTo(1.2);
        assertThat(calculator.volatilityMultiplier(0.3)).isEqualTo(1.2);
        assertThat(calculator.volatilityMultiplier(0.6)).isEqualTo(1.5);
        assertThat(calculator.volatilityMultiplier(0.8)).isEqualTo(2.0);
    }
}
