package opulse;

public enum ChildPosition {
  LEFT,
  RIGHT,
  UNARY;
}
