package opulse;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongBinaryOperator;

/** An integer result, or the NaN sentinel. Arithmetic never throws: undefined results are NaN. */
public final class Value {
  private static final Value NAN = new Value(0, true);
  private static final Value ZERO = new Value(0, false);
  private static final Value ONE = new Value(1, false);

  private final long value;
  private final boolean nan;

  private Value(long value, boolean nan) {
    this.value = value;
    this.nan = nan;
  }

  public static Value of(long value) {
    if (value == 0) {
      return ZERO;
    } else if (value == 1) {
      return ONE;
    }
    return new Value(value, false);
  }

  public static Value nan() {
    return NAN;
  }

  public static Value of(boolean truth) {
    return truth ? ONE : ZERO;
  }

  public boolean isNan() {
    return nan;
  }

  public long longValue() {
    if (nan) {
      throw new IllegalStateException("NaN has no integer value");
    }
    return value;
  }

  public boolean isTrue() {
    return !nan && value != 0;
  }

  public Value add(Value other) {
    return exact(other, Math::addExact);
  }

  public Value subtract(Value other) {
    return exact(other, Math::subtractExact);
  }

  public Value multiply(Value other) {
    return exact(other, Math::multiplyExact);
  }

  public Value floorDiv(Value other) {
    if (!other.nan && other.value == 0) {
      return NAN;
    }
    // Long.MIN_VALUE // -1 overflows.
    if (!nan && !other.nan && value == Long.MIN_VALUE && other.value == -1) {
      return NAN;
    }
    return exact(other, Math::floorDiv);
  }

  public Value floorMod(Value other) {
    if (!other.nan && other.value == 0) {
      return NAN;
    }
    return exact(other, Math::floorMod);
  }

  public Value min(Value other) {
    return exact(other, Math::min);
  }

  public Value max(Value other) {
    return exact(other, Math::max);
  }

  public Value negate() {
    if (nan || value == Long.MIN_VALUE) {
      return NAN;
    }
    return of(-value);
  }

  public Value abs() {
    if (nan || value == Long.MIN_VALUE) {
      return NAN;
    }
    return of(Math.abs(value));
  }

  public Value compare(Value other, Comparison comparison) {
    if (nan || other.nan) {
      return NAN;
    }
    return of(comparison.test(Long.compare(value, other.value)));
  }

  private Value exact(Value other, LongBinaryOperator op) {
    if (nan || other.nan) {
      return NAN;
    }
    try {
      return of(op.applyAsLong(value, other.value));
    } catch (ArithmeticException e) {
      return NAN;
    }
  }

  public enum Comparison {
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    Comparison(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    boolean test(int cmp) {
      switch (this) {
        case EQ:
          return cmp == 0;
        case NE:
          return cmp != 0;
        case LT:
          return cmp < 0;
        case LE:
          return cmp <= 0;
        case GT:
          return cmp > 0;
        case GE:
          return cmp >= 0;
      }
      throw new AssertionError(this);
    }

    public static Optional<Comparison> forSymbol(String symbol) {
      for (Comparison c : values()) {
        if (c.symbol.equals(symbol)) {
          return Optional.of(c);
        }
      }
      return Optional.empty();
    }
  }

  public String render(String nanSymbol) {
    return nan ? nanSymbol : Long.toString(value);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Value)) {
      return false;
    }
    Value that = (Value) o;
    return nan == that.nan && value == that.value;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, nan);
  }

  @Override
  public String toString() {
    return render("NaN");
  }
}
