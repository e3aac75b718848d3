package opulse;

public enum Associativity {
  LEFT("left"),
  RIGHT("right");

  private final String tag;

  Associativity(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  public static Associativity forTag(String tag) {
    for (Associativity a : values()) {
      if (a.tag.equals(tag)) {
        return a;
      }
    }
    throw new IllegalArgumentException("Unknown associativity: " + tag);
  }
}
