package opulse;

import java.util.List;
import java.util.Map;
import java.util.Random;

import com.google.common.base.Preconditions;

final class Sampling {
  private Sampling() {}

  // Draws a key with probability proportional to its weight. Iteration order breaks ties.
  static <T> T weighted(Random random, Map<T, Double> weights) {
    double total = 0;
    for (double w : weights.values()) {
      Preconditions.checkArgument(w >= 0, "negative weight in %s", weights);
      total += w;
    }
    Preconditions.checkArgument(total > 0, "no positive weight in %s", weights);
    double target = random.nextDouble() * total;
    T last = null;
    for (Map.Entry<T, Double> entry : weights.entrySet()) {
      if (entry.getValue() <= 0) {
        continue;
      }
      last = entry.getKey();
      target -= entry.getValue();
      if (target < 0) {
        return last;
      }
    }
    return last;
  }

  static <T> T uniform(Random random, List<T> items) {
    Preconditions.checkArgument(!items.isEmpty(), "nothing to choose from");
    return items.get(random.nextInt(items.size()));
  }

  // Inclusive on both ends.
  static int between(Random random, int min, int max) {
    Preconditions.checkArgument(min <= max, "empty range [%s, %s]", min, max);
    return (int) (min + (long) (random.nextDouble() * ((long) max - min + 1)));
  }
}
