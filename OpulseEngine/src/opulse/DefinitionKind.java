package opulse;

import java.util.Optional;

public enum DefinitionKind {
  // Hand-written seed operators with no definition text.
  PRIMITIVE(null),
  // Reserved numeral-base tagging operators.
  BASE(null),
  SIMPLE("simple_definition"),
  BRANCH("branch_definition"),
  RECURSIVE("recursive_definition");

  private final String tag;

  DefinitionKind(String tag) {
    this.tag = tag;
  }

  public Optional<String> tag() {
    return Optional.ofNullable(tag);
  }

  public static DefinitionKind forTag(String tag) {
    for (DefinitionKind kind : values()) {
      if (tag.equals(kind.tag)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown definition type: " + tag);
  }
}
