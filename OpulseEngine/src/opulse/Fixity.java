package opulse;

import java.util.Optional;

public enum Fixity {
  PREFIX(1, "prefix"),
  POSTFIX(1, "postfix"),
  INFIX(2, null);

  private final int arity;
  private final String unaryPosition;

  Fixity(int arity, String unaryPosition) {
    this.arity = arity;
    this.unaryPosition = unaryPosition;
  }

  public int arity() {
    return arity;
  }

  public boolean isUnary() {
    return arity == 1;
  }

  public Optional<String> unaryPosition() {
    return Optional.ofNullable(unaryPosition);
  }

  public static Fixity of(int arity, Optional<String> unaryPosition) {
    if (arity == 2) {
      return INFIX;
    } else if (arity != 1) {
      throw new IllegalArgumentException("Unsupported arity: " + arity);
    }
    String position = unaryPosition.orElse("prefix");
    if (position.equals("prefix")) {
      return PREFIX;
    } else if (position.equals("postfix")) {
      return POSTFIX;
    }
    throw new IllegalArgumentException("Unknown unary position: " + position);
  }
}
