package opulse;

import java.util.List;
import java.util.Random;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// Random branch conditions: comparisons over the operands joined by logical connectors.
public final class ConditionGenerator {
  private final GeneratorConfig config;
  private final Random random;
  private ImmutableList<String> variables;

  public ConditionGenerator(GeneratorConfig config, Random random) {
    this.config = config;
    this.random = random;
    this.variables = config.operands(2);
  }

  public void setVariables(List<String> variables) {
    Preconditions.checkArgument(!variables.isEmpty(), "no variables");
    this.variables = ImmutableList.copyOf(variables);
  }

  public String generateCondition() {
    int comparisons = Sampling.weighted(random, config.conditionProbabilities());
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < comparisons; i++) {
      if (i > 0) {
        sb.append(' ').append(Sampling.uniform(random, config.logicalConnectors())).append(' ');
      }
      sb.append(comparison());
    }
    return sb.toString();
  }

  private String comparison() {
    String left = Sampling.uniform(random, variables);
    String op = Sampling.uniform(random, config.comparisonOps());
    String right;
    if (variables.size() > 1 && random.nextBoolean()) {
      right = Sampling.uniform(random, variables);
    } else {
      int number = Sampling.between(random, config.conditionMin(), config.conditionMax());
      right = Integer.toString(number);
    }
    return left + " " + op + " " + right;
  }
}
