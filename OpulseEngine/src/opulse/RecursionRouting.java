package opulse;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * How a loop-defined operator feeds its accumulator and operands into its callee. Each
 * (caller arity, routing) pair owns one bit of the callee's recursion-usage mask.
 */
public enum RecursionRouting {
  // Binary callee.
  RESULT_RESULT,
  RESULT_LEFT,
  RESULT_RIGHT,
  LEFT_RESULT,
  RIGHT_RESULT,
  // Unary callee.
  RESULT;

  public static final int UNARY_SATURATED = 0b11;
  public static final int BINARY_SATURATED = 0xFF;

  public static ImmutableList<RecursionRouting> choices(Fixity caller, Fixity callee) {
    if (callee.isUnary()) {
      return ImmutableList.of(RESULT);
    } else if (caller.isUnary()) {
      return ImmutableList.of(RESULT_RESULT, RESULT_LEFT, LEFT_RESULT);
    }
    return ImmutableList.of(RESULT_RESULT, RESULT_LEFT, RESULT_RIGHT, LEFT_RESULT, RIGHT_RESULT);
  }

  public int bit(Fixity caller, Fixity callee) {
    if (!choices(caller, callee).contains(this)) {
      throw new IllegalArgumentException(
          String.format("%s is not a valid routing from %s into %s", this, caller, callee));
    }
    if (callee.isUnary()) {
      return caller.isUnary() ? 1 : 0;
    } else if (caller.isUnary()) {
      switch (this) {
        case RESULT_RESULT:
          return 5;
        case RESULT_LEFT:
          return 6;
        default:
          return 7;
      }
    }
    return ordinal();
  }

  public static int saturationMask(Fixity callee) {
    return callee.isUnary() ? UNARY_SATURATED : BINARY_SATURATED;
  }

  // Callee arguments for one loop step. `operands` are the caller's parameters.
  public ImmutableList<Instruction> arguments(List<Instruction> operands) {
    Instruction result = Instruction.accumulator();
    switch (this) {
      case RESULT:
        return ImmutableList.of(result);
      case RESULT_RESULT:
        return ImmutableList.of(result, result);
      case RESULT_LEFT:
        return ImmutableList.of(result, operands.get(0));
      case RESULT_RIGHT:
        return ImmutableList.of(result, operands.get(1));
      case LEFT_RESULT:
        return ImmutableList.of(operands.get(0), result);
      case RIGHT_RESULT:
        return ImmutableList.of(operands.get(1), result);
    }
    throw new AssertionError(this);
  }
}
