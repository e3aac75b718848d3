package opulse;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class FoldResult {
  public abstract Value cost();

  public abstract Value value();

  public static FoldResult create(Value cost, Value value) {
    if (cost.isNan() || value.isNan()) {
      return nan();
    }
    return new AutoValue_FoldResult(cost, value);
  }

  public static FoldResult nan() {
    return new AutoValue_FoldResult(Value.nan(), Value.nan());
  }

  public boolean isNan() {
    return value().isNan();
  }
}
