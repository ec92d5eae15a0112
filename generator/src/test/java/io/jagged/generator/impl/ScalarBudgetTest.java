package io.jagged.generator.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jagged.generator.tape.ChoiceSequenceTape;
import io.jagged.generator.tape.RandomTape;
import org.junit.jupiter.api.Test;

class ScalarBudgetTest {

  @Test
  void allocationsNeverExceedTheRemainder() {
    ScalarBudget budget = new ScalarBudget(10);
    RandomTape tape = new RandomTape(1L);
    int granted = 0;
    for (int i = 0; i < 100; i++) {
      int before = budget.remaining();
      int allotted = budget.allocate(tape, 0, 4);
      assertThat(allotted).isBetween(0, Math.min(4, before));
      granted += allotted;
    }
    assertThat(granted).isEqualTo(budget.used()).isLessThanOrEqualTo(10);
  }

  @Test
  void deductsWhatItGrants() {
    ScalarBudget budget = new ScalarBudget(10);
    // 6 mod 11 == 6
    assertThat(budget.allocate(new ChoiceSequenceTape(6), 0, 10)).isEqualTo(6);
    assertThat(budget.remaining()).isEqualTo(4);
    assertThat(budget.ceiling(100)).isEqualTo(4);
  }

  @Test
  void exhaustedBudgetGrantsZero() {
    ScalarBudget budget = new ScalarBudget(2);
    budget.allocate(new ChoiceSequenceTape(2), 2, 2);
    assertThat(budget.isExhausted()).isTrue();
    assertThat(budget.allocate(new RandomTape(3L), 0, 5)).isZero();
    assertThat(budget.allocate(new RandomTape(3L), 1, 5)).isZero();
  }

  @Test
  void minimumIsHonouredWhileAffordable() {
    ScalarBudget budget = new ScalarBudget(5);
    assertThat(budget.allocate(new ChoiceSequenceTape(), 3, 5)).isEqualTo(3);
    // only 2 left, clamped rather than failing
    assertThat(budget.allocate(new ChoiceSequenceTape(), 3, 5)).isEqualTo(2);
  }

  @Test
  void zeroBudgetIsExhaustedFromTheStart() {
    assertThat(new ScalarBudget(0).isExhausted()).isTrue();
    assertThatThrownBy(() -> new ScalarBudget(-1)).isInstanceOf(IllegalArgumentException.class);
  }
}
