package opulse;

// How number literals are rendered.
public enum NumberStyle {
  // Decimal digits, as used inside operator definitions.
  PLAIN,
  // Decimal digits wrapped in '$'.
  TAGGED,
  // The base operator's symbol followed by the digits in that base.
  BASE_SYMBOL;
}
