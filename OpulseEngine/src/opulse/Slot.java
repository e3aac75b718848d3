package opulse;

public enum Slot {
  COMPUTE("op"),
  COST("cost");

  private final String keyword;

  Slot(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }
}
