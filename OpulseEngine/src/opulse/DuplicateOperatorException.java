package opulse;

public class DuplicateOperatorException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public DuplicateOperatorException(int id) {
    super("Operator id " + id + " already exists");
  }
}
