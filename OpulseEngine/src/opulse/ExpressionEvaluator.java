package opulse;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Multiset;

import opulse.ExpressionNode.BinaryApplication;
import opulse.ExpressionNode.NumberLiteral;
import opulse.ExpressionNode.UnaryApplication;
import opulse.ExpressionNode.Variable;

/** Renders expression trees and folds them to (cost, value) with the operators' procedures. */
public final class ExpressionEvaluator {
  private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

  private final OperatorRegistry registry;
  private final BaseConverter converter;
  private final String nanSymbol;

  public ExpressionEvaluator(OperatorRegistry registry, BaseConverter converter, String nanSymbol) {
    this.registry = registry;
    this.converter = converter;
    this.nanSymbol = nanSymbol;
  }

  public OperatorRegistry registry() {
    return registry;
  }

  public BaseConverter converter() {
    return converter;
  }

  public String nanSymbol() {
    return nanSymbol;
  }

  // Structural metrics collected while rendering.
  static final class Metrics {
    final Set<Integer> precedenceLevels = new TreeSet<>();
    final Multiset<Integer> operatorUsage = HashMultiset.create();
    int applicationCount = 0;
    int highestOrder = 0;

    void record(OperatorRecord operator) {
      operator.precedence().ifPresent(precedenceLevels::add);
      operatorUsage.add(operator.id());
      applicationCount++;
      highestOrder = Math.max(highestOrder, operator.order().orElse(0));
    }

    ImmutableSortedSet<Integer> levels() {
      return ImmutableSortedSet.copyOf(precedenceLevels);
    }

    ImmutableMultiset<Integer> usage() {
      return ImmutableMultiset.copyOf(operatorUsage);
    }
  }

  public String render(ExpressionNode node, NumberStyle style, boolean allBrackets) {
    return render(node, Optional.empty(), style, allBrackets, new Metrics());
  }

  String render(
      ExpressionNode node,
      Optional<OperatorRecord> parent,
      NumberStyle style,
      boolean allBrackets,
      Metrics metrics) {
    switch (node.type()) {
      case NUMBER:
        return renderNumber((NumberLiteral) node, style);
      case VARIABLE:
        return ((Variable) node).name();
      case UNARY:
        {
          UnaryApplication unary = (UnaryApplication) node;
          OperatorRecord op = unary.operator();
          metrics.record(op);
          String operand = render(unary.operand(), Optional.of(op), style, allBrackets, metrics);
          if (op.fixity() == Fixity.POSTFIX) {
            return "(" + operand + op.symbol() + ")";
          }
          return "(" + op.symbol() + operand + ")";
        }
      case BINARY:
        {
          BinaryApplication binary = (BinaryApplication) node;
          OperatorRecord op = binary.operator();
          metrics.record(op);
          String left = render(binary.left(), Optional.of(op), style, allBrackets, metrics);
          String right = render(binary.right(), Optional.of(op), style, allBrackets, metrics);
          String text = left + op.symbol() + right;
          if (allBrackets || (parent.isPresent() && needsBrackets(binary, parent.get()))) {
            return "(" + text + ")";
          }
          return text;
        }
    }
    throw new AssertionError(node.type());
  }

  private String renderNumber(NumberLiteral number, NumberStyle style) {
    switch (style) {
      case PLAIN:
        // Read back as prefix negation.
        return number.value() < 0 ? "(" + number.value() + ")" : Long.toString(number.value());
      case TAGGED:
        return "$" + number.value() + "$";
      case BASE_SYMBOL:
        return registry.baseOperator(number.base()).symbol()
            + converter.convert(number.value(), number.base());
    }
    throw new AssertionError(style);
  }

  // Operators without a precedence are always bracketed.
  private static boolean needsBrackets(BinaryApplication node, OperatorRecord parent) {
    Optional<Integer> mine = node.operator().precedence();
    Optional<Integer> theirs = parent.precedence();
    if (!mine.isPresent() || !theirs.isPresent()) {
      return true;
    }
    if (mine.get() < theirs.get()) {
      return true;
    } else if (mine.get() > theirs.get()) {
      return false;
    }
    ChildPosition position = node.position().orElse(ChildPosition.LEFT);
    Associativity associativity = parent.associativity().orElse(Associativity.LEFT);
    return (associativity == Associativity.LEFT && position == ChildPosition.RIGHT)
        || (associativity == Associativity.RIGHT && position == ChildPosition.LEFT);
  }

  public FoldResult fold(ExpressionNode node) {
    switch (node.type()) {
      case NUMBER:
        return FoldResult.create(Value.of(0), Value.of(((NumberLiteral) node).value()));
      case VARIABLE:
        return FoldResult.nan();
      case UNARY:
        {
          UnaryApplication unary = (UnaryApplication) node;
          FoldResult operand = fold(unary.operand());
          if (operand.isNan()) {
            return operand;
          }
          return apply(unary.operator(), operand.cost(), operand.value());
        }
      case BINARY:
        {
          BinaryApplication binary = (BinaryApplication) node;
          FoldResult left = fold(binary.left());
          if (left.isNan()) {
            return left;
          }
          FoldResult right = fold(binary.right());
          if (right.isNan()) {
            return right;
          }
          return apply(
              binary.operator(), left.cost().add(right.cost()), left.value(), right.value());
        }
    }
    throw new AssertionError(node.type());
  }

  private FoldResult apply(OperatorRecord operator, Value childCost, Value... args) {
    Optional<CompiledProcedure> compute = registry.compile(operator.id(), Slot.COMPUTE);
    Optional<CompiledProcedure> cost = registry.compile(operator.id(), Slot.COST);
    if (!compute.isPresent() || !cost.isPresent()) {
      logger.warn("{} has no usable procedures; folding to NaN", operator);
      return FoldResult.nan();
    }
    Value opCost = cost.get().invoke(args);
    Value value = compute.get().invoke(args);
    return FoldResult.create(opCost.add(childCost), value);
  }

  public EvaluatedExpression evaluate(int id, ExpressionNode root) {
    Metrics metrics = new Metrics();
    String expression = render(root, Optional.empty(), NumberStyle.BASE_SYMBOL, false, metrics);
    String noBaseSymbol = render(root, NumberStyle.TAGGED, false);
    return new EvaluatedExpression(this, id, root, expression, noBaseSymbol, metrics);
  }
}
