package opulse;

import com.google.auto.value.AutoValue;

// Stable arena token for an operator. Survives id renumbering.
@AutoValue
public abstract class OperatorHandle {
  public abstract long key();

  static OperatorHandle create(long key) {
    return new AutoValue_OperatorHandle(key);
  }
}
