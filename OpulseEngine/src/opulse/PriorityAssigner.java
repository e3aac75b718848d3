package opulse;

import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives every non-base operator that lacks one a precedence level and associativity. Binary
 * operators land on an existing level or one above the highest; unary operators bind tightest.
 */
public final class PriorityAssigner {
  private static final Logger logger = LoggerFactory.getLogger(PriorityAssigner.class);

  private final Random random;

  public PriorityAssigner(Random random) {
    this.random = random;
  }

  /** Returns the number of operators that were assigned. */
  public int assignPriorities(OperatorRegistry registry) {
    int assigned = 0;
    for (OperatorRecord record : registry.operators()) {
      if (record.isBase() || record.precedence().isPresent() || record.fixity().isUnary()) {
        continue;
      }
      int level = Sampling.between(random, 1, maxBinaryLevel(registry) + 1);
      Associativity associativity =
          random.nextBoolean() ? Associativity.LEFT : Associativity.RIGHT;
      registry.assignPrecedence(record.id(), level, associativity);
      logger.debug("Assigned {} precedence {} {}", record, level, associativity);
      assigned++;
    }

    // Unary levels depend on the final binary levels.
    int unaryLevel = maxBinaryLevel(registry) + 1;
    for (OperatorRecord record : registry.operators()) {
      if (record.isBase() || record.precedence().isPresent() || !record.fixity().isUnary()) {
        continue;
      }
      registry.assignPrecedence(record.id(), unaryLevel, Associativity.RIGHT);
      logger.debug("Assigned {} precedence {}", record, unaryLevel);
      assigned++;
    }
    logger.info("Assigned precedence to {} operators", assigned);
    return assigned;
  }

  private static int maxBinaryLevel(OperatorRegistry registry) {
    return registry.operators().stream()
        .filter(r -> !r.isBase() && !r.fixity().isUnary())
        .map(OperatorRecord::precedence)
        .filter(p -> p.isPresent())
        .mapToInt(p -> p.get())
        .max()
        .orElse(0);
  }
}
