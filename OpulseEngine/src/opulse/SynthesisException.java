package opulse;

// Expected, recoverable failure of a single synthesis candidate.
public class SynthesisException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Reason {
    COMPILE_FAILURE,
    EXECUTION_FAILURE,
    SYNTAX_ERROR,
    RECURSION_SATURATED,
    RETRY_EXHAUSTED;
  }

  private final Reason reason;

  public SynthesisException(Reason reason, String errorMsg) {
    super(errorMsg);
    this.reason = reason;
  }

  public SynthesisException(Reason reason, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public String describe() {
    return String.format("%s: %s", reason, getMessage());
  }
}
