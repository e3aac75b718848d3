package opulse;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSortedSet;

/** An expression tree with its renderings and metrics. The fold runs at most once. */
public final class EvaluatedExpression {
  private final ExpressionEvaluator evaluator;
  private final int id;
  private final ExpressionNode tree;
  private final String expression;
  private final String expressionNoBaseSymbol;
  private final ImmutableSortedSet<Integer> precedenceLevels;
  private final ImmutableMultiset<Integer> operatorUsage;
  private final int applicationCount;
  private final int highestOrder;

  private FoldResult fold;

  EvaluatedExpression(
      ExpressionEvaluator evaluator,
      int id,
      ExpressionNode tree,
      String expression,
      String expressionNoBaseSymbol,
      ExpressionEvaluator.Metrics metrics) {
    this.evaluator = evaluator;
    this.id = id;
    this.tree = tree;
    this.expression = expression;
    this.expressionNoBaseSymbol = expressionNoBaseSymbol;
    this.precedenceLevels = metrics.levels();
    this.operatorUsage = metrics.usage();
    this.applicationCount = metrics.applicationCount;
    this.highestOrder = metrics.highestOrder;
  }

  public int id() {
    return id;
  }

  public ExpressionNode tree() {
    return tree;
  }

  public String expression() {
    return expression;
  }

  public String expressionNoBaseSymbol() {
    return expressionNoBaseSymbol;
  }

  public int highestOrder() {
    return highestOrder;
  }

  public int priorityHierarchicalComplexity() {
    return precedenceLevels.size();
  }

  public int applicationCount() {
    return applicationCount;
  }

  public ImmutableMultiset<Integer> operatorUsage() {
    return operatorUsage;
  }

  public FoldResult fold() {
    if (fold == null) {
      fold = evaluator.fold(tree);
    }
    return fold;
  }

  // The accumulated cost of the fold.
  public Value normalizedExpansionDegree() {
    return fold().cost();
  }

  public Value result() {
    return fold().value();
  }

  public double complexityRatio() {
    Value cost = normalizedExpansionDegree();
    if (applicationCount == 0 || cost.isNan()) {
      return 0;
    }
    return (double) cost.longValue() / applicationCount;
  }

  public int maxDigitCount() {
    return evaluator.converter().longestNumeral(expression);
  }

  public ObjectNode toJson() {
    JsonNodeFactory factory = JsonNodeFactory.instance;
    ObjectNode node = factory.objectNode();
    String nan = evaluator.nanSymbol();
    node.put("id", id);
    node.put("expression_no_base_symbol", expressionNoBaseSymbol);
    node.put("expression", expression);
    node.put("highest_n_order", highestOrder);
    node.put("priority_hierarchical_complexity", priorityHierarchicalComplexity());
    putValue(node, "normalized_expansion_degree", normalizedExpansionDegree(), nan);
    node.put("operation_count", applicationCount);
    node.put("complexity_ratio", complexityRatio());
    node.put("max_digit_count", maxDigitCount());
    node.set("tree", tree.toJson(factory));
    ArrayNode used = node.putArray("used_operators");
    operatorUsage.elementSet().stream().sorted().forEach(used::add);
    putValue(node, "result", result(), nan);
    return node;
  }

  private static void putValue(ObjectNode node, String field, Value value, String nan) {
    if (value.isNan()) {
      node.put(field, nan);
    } else {
      node.put(field, value.longValue());
    }
  }
}
