package opulse;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

// Per-invocation bounds on procedure execution. Exceeding either yields NaN.
@AutoValue
public abstract class ExecutionLimits {
  public abstract long stepLimit();

  public abstract int callDepthLimit();

  public static ExecutionLimits create(long stepLimit, int callDepthLimit) {
    Preconditions.checkArgument(stepLimit > 0, "stepLimit must be positive");
    Preconditions.checkArgument(callDepthLimit > 0, "callDepthLimit must be positive");
    return new AutoValue_ExecutionLimits(stepLimit, callDepthLimit);
  }

  public static ExecutionLimits defaults() {
    return create(1_000_000, 256);
  }
}
