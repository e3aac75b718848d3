package opulse;

public class OperatorNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public OperatorNotFoundException(String errorMsg) {
    super(errorMsg);
  }

  public static OperatorNotFoundException forId(int id) {
    return new OperatorNotFoundException("No operator with id " + id);
  }
}
