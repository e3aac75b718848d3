package opulse;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

// Non-base operators split by fixity, as consumed by expression generation.
@AutoValue
public abstract class OperatorPartitions {
  public abstract ImmutableList<OperatorRecord> prefix();

  public abstract ImmutableList<OperatorRecord> postfix();

  public abstract ImmutableList<OperatorRecord> binary();

  static OperatorPartitions create(
      ImmutableList<OperatorRecord> prefix,
      ImmutableList<OperatorRecord> postfix,
      ImmutableList<OperatorRecord> binary) {
    return new AutoValue_OperatorPartitions(prefix, postfix, binary);
  }

  public ImmutableList<OperatorRecord> forFixity(Fixity fixity) {
    switch (fixity) {
      case PREFIX:
        return prefix();
      case POSTFIX:
        return postfix();
      case INFIX:
        return binary();
    }
    throw new AssertionError(fixity);
  }
}
