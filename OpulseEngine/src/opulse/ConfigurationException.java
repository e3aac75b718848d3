package opulse;

public class ConfigurationException extends Exception {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String errorMsg) {
    super(errorMsg);
  }

  public ConfigurationException(String errorMsg, Throwable cause) {
    super(errorMsg, cause);
  }
}
