package opulse;

import java.util.Optional;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;

/** A generated expression tree. Immutable apart from the position tag set on attachment. */
public abstract class ExpressionNode {

  public enum Type {
    NUMBER,
    VARIABLE,
    UNARY,
    BINARY;
  }

  private Optional<ChildPosition> position = Optional.empty();

  public abstract Type type();

  public Optional<ChildPosition> position() {
    return position;
  }

  void attachAs(ChildPosition position) {
    Verify.verify(!this.position.isPresent(), "node attached twice");
    this.position = Optional.of(position);
  }

  // Visits this node and every descendant, parents first.
  public abstract void forEach(Consumer<ExpressionNode> visitor);

  public abstract ObjectNode toJson(JsonNodeFactory factory);

  public static NumberLiteral number(long value, int base) {
    return new NumberLiteral(value, base);
  }

  public static Variable variable(String name) {
    return new Variable(name);
  }

  public static UnaryApplication unary(OperatorRecord operator, ExpressionNode operand) {
    return new UnaryApplication(operator, operand);
  }

  public static BinaryApplication binary(
      OperatorRecord operator, ExpressionNode left, ExpressionNode right) {
    return new BinaryApplication(operator, left, right);
  }

  public static final class NumberLiteral extends ExpressionNode {
    private final long value;
    private final int base;

    private NumberLiteral(long value, int base) {
      Preconditions.checkArgument(base >= 2, "base %s < 2", base);
      this.value = value;
      this.base = base;
    }

    public long value() {
      return value;
    }

    public int base() {
      return base;
    }

    @Override
    public Type type() {
      return Type.NUMBER;
    }

    @Override
    public void forEach(Consumer<ExpressionNode> visitor) {
      visitor.accept(this);
    }

    @Override
    public ObjectNode toJson(JsonNodeFactory factory) {
      ObjectNode node = factory.objectNode();
      node.put("type", "numeric_atoms");
      node.put("value", value);
      node.put("base", base);
      return node;
    }
  }

  public static final class Variable extends ExpressionNode {
    private final String name;

    private Variable(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    public String name() {
      return name;
    }

    @Override
    public Type type() {
      return Type.VARIABLE;
    }

    @Override
    public void forEach(Consumer<ExpressionNode> visitor) {
      visitor.accept(this);
    }

    @Override
    public ObjectNode toJson(JsonNodeFactory factory) {
      ObjectNode node = factory.objectNode();
      node.put("type", "variable");
      node.put("variable", name);
      return node;
    }
  }

  public static final class UnaryApplication extends ExpressionNode {
    private final OperatorRecord operator;
    private final ExpressionNode operand;

    private UnaryApplication(OperatorRecord operator, ExpressionNode operand) {
      Preconditions.checkArgument(operator.fixity().isUnary(), "%s is not unary", operator);
      this.operator = operator;
      this.operand = operand;
      operand.attachAs(ChildPosition.UNARY);
    }

    public OperatorRecord operator() {
      return operator;
    }

    public ExpressionNode operand() {
      return operand;
    }

    @Override
    public Type type() {
      return Type.UNARY;
    }

    @Override
    public void forEach(Consumer<ExpressionNode> visitor) {
      visitor.accept(this);
      operand.forEach(visitor);
    }

    @Override
    public ObjectNode toJson(JsonNodeFactory factory) {
      ObjectNode node = factory.objectNode();
      node.put("type", "unary");
      node.put("operator", operator.symbol());
      node.set("unary_expr", operand.toJson(factory));
      return node;
    }
  }

  public static final class BinaryApplication extends ExpressionNode {
    private final OperatorRecord operator;
    private final ExpressionNode left;
    private final ExpressionNode right;

    private BinaryApplication(OperatorRecord operator, ExpressionNode left, ExpressionNode right) {
      Preconditions.checkArgument(operator.fixity() == Fixity.INFIX, "%s is not binary", operator);
      this.operator = operator;
      this.left = left;
      this.right = right;
      left.attachAs(ChildPosition.LEFT);
      right.attachAs(ChildPosition.RIGHT);
    }

    public OperatorRecord operator() {
      return operator;
    }

    public ExpressionNode left() {
      return left;
    }

    public ExpressionNode right() {
      return right;
    }

    @Override
    public Type type() {
      return Type.BINARY;
    }

    @Override
    public void forEach(Consumer<ExpressionNode> visitor) {
      visitor.accept(this);
      left.forEach(visitor);
      right.forEach(visitor);
    }

    @Override
    public ObjectNode toJson(JsonNodeFactory factory) {
      ObjectNode node = factory.objectNode();
      node.put("type", "binary");
      node.put("operator", operator.symbol());
      node.set("left_expr", left.toJson(factory));
      node.set("right_expr", right.toJson(factory));
      return node;
    }
  }
}
