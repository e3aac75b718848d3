package opulse;

import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Parsed operator definition: {@code lhs = { e1, if c1 ; ... ; e_n, else }}. */
public final class Definition {
  private final String symbol;
  private final Fixity fixity;
  private final ImmutableList<String> operands;
  private final ImmutableList<Branch> branches;

  Definition(
      String symbol,
      Fixity fixity,
      ImmutableList<String> operands,
      ImmutableList<Branch> branches) {
    Preconditions.checkArgument(operands.size() == fixity.arity());
    Preconditions.checkArgument(!branches.isEmpty());
    Preconditions.checkArgument(
        !branches.get(branches.size() - 1).condition().isPresent(), "last branch is conditional");
    this.symbol = symbol;
    this.fixity = fixity;
    this.operands = operands;
    this.branches = branches;
  }

  public String symbol() {
    return symbol;
  }

  public Fixity fixity() {
    return fixity;
  }

  public ImmutableList<String> operands() {
    return operands;
  }

  // Every branch but the last carries a condition.
  public ImmutableList<Branch> branches() {
    return branches;
  }

  public boolean isBranching() {
    return branches.size() > 1;
  }

  public static final class Branch {
    private final Term expression;
    private final Optional<Condition> condition;

    Branch(Term expression, Optional<Condition> condition) {
      this.expression = expression;
      this.condition = condition;
    }

    public Term expression() {
      return expression;
    }

    public Optional<Condition> condition() {
      return condition;
    }
  }

  public abstract static class Term {
    public enum Type {
      NUMBER,
      NAME,
      UNARY,
      BINARY;
    }

    public abstract Type type();
  }

  public static final class Literal extends Term {
    private final long value;

    Literal(long value) {
      this.value = value;
    }

    public long value() {
      return value;
    }

    @Override
    public Type type() {
      return Type.NUMBER;
    }
  }

  public static final class Name extends Term {
    private final String name;

    Name(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Type type() {
      return Type.NAME;
    }
  }

  public static final class Unary extends Term {
    private final String symbol;
    private final Fixity fixity;
    private final Term operand;

    Unary(String symbol, Fixity fixity, Term operand) {
      Preconditions.checkArgument(fixity.isUnary());
      this.symbol = symbol;
      this.fixity = fixity;
      this.operand = operand;
    }

    public String symbol() {
      return symbol;
    }

    public Fixity fixity() {
      return fixity;
    }

    public Term operand() {
      return operand;
    }

    @Override
    public Type type() {
      return Type.UNARY;
    }
  }

  public static final class Binary extends Term {
    private final String symbol;
    private final Term left;
    private final Term right;

    Binary(String symbol, Term left, Term right) {
      this.symbol = symbol;
      this.left = left;
      this.right = right;
    }

    public String symbol() {
      return symbol;
    }

    public Term left() {
      return left;
    }

    public Term right() {
      return right;
    }

    @Override
    public Type type() {
      return Type.BINARY;
    }
  }

  public abstract static class Condition {}

  public static final class Comparison extends Condition {
    private final Value.Comparison comparison;
    private final Term left;
    private final Term right;

    Comparison(Value.Comparison comparison, Term left, Term right) {
      this.comparison = comparison;
      this.left = left;
      this.right = right;
    }

    public Value.Comparison comparison() {
      return comparison;
    }

    public Term left() {
      return left;
    }

    public Term right() {
      return right;
    }
  }

  public static final class Connective extends Condition {
    private final boolean conjunction;
    private final Condition left;
    private final Condition right;

    Connective(boolean conjunction, Condition left, Condition right) {
      this.conjunction = conjunction;
      this.left = left;
      this.right = right;
    }

    public boolean isConjunction() {
      return conjunction;
    }

    public Condition left() {
      return left;
    }

    public Condition right() {
      return right;
    }
  }
}
