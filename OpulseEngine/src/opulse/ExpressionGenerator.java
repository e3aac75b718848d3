package opulse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** Random expression trees over the registry's current operators. */
public final class ExpressionGenerator {

  public enum AtomPolicy {
    VARIABLE,
    NUMBER,
    VARIABLE_AND_NUMBER;
  }

  enum Category {
    BINARY("binary"),
    UNARY_PREFIX("unary_prefix"),
    UNARY_POSTFIX("unary_postfix"),
    ATOM("atoms");

    private final String configKey;

    Category(String configKey) {
      this.configKey = configKey;
    }
  }

  private final GeneratorConfig config;
  private final OperatorRegistry registry;
  private final ExpressionEvaluator evaluator;
  private final Random random;
  private final ImmutableMap<Category, Double> categoryWeights;
  private final ImmutableMap<AtomPolicy, Double> atomWeights;
  private final OperatorUsageIndex usage = new OperatorUsageIndex();

  private ImmutableList<String> variables;
  private int maxDepth;
  private OperatorPartitions pools;
  private int nextExpressionId = 0;

  public ExpressionGenerator(
      GeneratorConfig config,
      OperatorRegistry registry,
      ExpressionEvaluator evaluator,
      Random random) {
    this.config = config;
    this.registry = registry;
    this.evaluator = evaluator;
    this.random = random;
    this.variables = config.operands(2);
    this.maxDepth = config.exprMaxDepth();

    ImmutableMap.Builder<Category, Double> weights = ImmutableMap.builder();
    for (Category category : Category.values()) {
      weights.put(category, config.exprTypeWeight(category.configKey));
    }
    this.categoryWeights = weights.build();
    this.atomWeights =
        ImmutableMap.of(
            AtomPolicy.VARIABLE, config.atomTypeWeight("variable"),
            AtomPolicy.NUMBER, config.atomTypeWeight("number"));
    refreshOperators();
  }

  public void setVariables(List<String> variables) {
    Preconditions.checkArgument(!variables.isEmpty(), "no variables");
    this.variables = ImmutableList.copyOf(variables);
  }

  public ImmutableList<String> variables() {
    return variables;
  }

  public void setMaxDepth(int maxDepth) {
    Preconditions.checkArgument(maxDepth >= 0);
    this.maxDepth = maxDepth;
  }

  public void refreshOperators() {
    pools = registry.operatorsByFixedness();
  }

  public OperatorUsageIndex usage() {
    return usage;
  }

  public ExpressionNode generate(int currentDepth, int maxDepth, AtomPolicy policy) {
    if (currentDepth >= maxDepth || !anyOperatorDrawable()) {
      return atom(policy);
    }
    while (true) {
      switch (Sampling.weighted(random, categoryWeights)) {
        case BINARY:
          if (pools.binary().isEmpty()) {
            continue;
          }
          {
            OperatorRecord op = Sampling.uniform(random, pools.binary());
            ExpressionNode left = generate(currentDepth + 1, maxDepth, policy);
            ExpressionNode right = generate(currentDepth + 1, maxDepth, policy);
            return ExpressionNode.binary(op, left, right);
          }
        case UNARY_PREFIX:
          if (pools.prefix().isEmpty()) {
            continue;
          }
          return ExpressionNode.unary(
              Sampling.uniform(random, pools.prefix()),
              generate(currentDepth + 1, maxDepth, policy));
        case UNARY_POSTFIX:
          if (pools.postfix().isEmpty()) {
            continue;
          }
          return ExpressionNode.unary(
              Sampling.uniform(random, pools.postfix()),
              generate(currentDepth + 1, maxDepth, policy));
        case ATOM:
          return atom(policy);
      }
    }
  }

  // False when every category with positive weight is an empty operator pool and atoms have no
  // weight, which would make the draw loop forever.
  private boolean anyOperatorDrawable() {
    Map<Category, Boolean> available = new LinkedHashMap<>();
    available.put(Category.BINARY, !pools.binary().isEmpty());
    available.put(Category.UNARY_PREFIX, !pools.prefix().isEmpty());
    available.put(Category.UNARY_POSTFIX, !pools.postfix().isEmpty());
    available.put(Category.ATOM, true);
    return available.entrySet().stream()
        .anyMatch(e -> e.getValue() && categoryWeights.get(e.getKey()) > 0);
  }

  private ExpressionNode atom(AtomPolicy policy) {
    AtomPolicy kind = policy;
    if (policy == AtomPolicy.VARIABLE_AND_NUMBER) {
      kind = Sampling.weighted(random, atomWeights);
    }
    if (kind == AtomPolicy.VARIABLE) {
      return ExpressionNode.variable(Sampling.uniform(random, variables));
    }
    return ExpressionNode.number(
        Sampling.between(random, config.exprMin(), config.exprMax()),
        Sampling.between(random, 2, config.maxBase()));
  }

  /** Generates, evaluates and indexes one dataset sample. */
  public EvaluatedExpression createExpression(AtomPolicy policy) {
    refreshOperators();
    ExpressionNode tree = generate(0, maxDepth, policy);
    EvaluatedExpression evaluated = evaluator.evaluate(nextExpressionId++, tree);
    usage.record(evaluated);
    return evaluated;
  }

  // A tree for use inside an operator definition.
  public ExpressionNode createDefinitionTree(AtomPolicy policy) {
    refreshOperators();
    return generate(0, maxDepth, policy);
  }

  public String renderDefinition(ExpressionNode tree) {
    return evaluator.render(tree, NumberStyle.PLAIN, true);
  }

  public String createDefinitionExpression(AtomPolicy policy) {
    return renderDefinition(createDefinitionTree(policy));
  }
}
