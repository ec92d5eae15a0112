package io.jagged.generator.tape;

import static org.assertj.core.api.Assertions.assertThat;

import io.jagged.generator.api.ContentGenerator;
import io.jagged.layout.JaggedArray;
import org.junit.jupiter.api.Test;

class RandomTapeTest {

  @Test
  void staysWithinBounds() {
    RandomTape tape = new RandomTape(7L);
    for (int i = 0; i < 10_000; i++) {
      assertThat(tape.drawInt(-3, 3)).isBetween(-3, 3);
    }
  }

  @Test
  void sameSeedReplaysTheSameTree() {
    ContentGenerator generator = ContentGenerator.create();
    for (long seed = 0; seed < 50; seed++) {
      JaggedArray first = generator.generateArray(new RandomTape(seed));
      JaggedArray second = generator.generateArray(new RandomTape(seed));
      assertThat(first.layout().toString()).isEqualTo(second.layout().toString());
      assertThat(first.length()).isEqualTo(second.length());
    }
  }
}
