package opulse;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

// Renders integers in bases 2..digits.length() using a custom digit alphabet.
public final class BaseConverter {
  private final String digits;
  private final CharMatcher digitMatcher;

  public BaseConverter(String digits) {
    Preconditions.checkArgument(digits.length() >= 2, "need at least two digits");
    Preconditions.checkArgument(
        digits.chars().distinct().count() == digits.length(), "duplicate digits in %s", digits);
    this.digits = digits;
    this.digitMatcher = CharMatcher.anyOf(digits);
  }

  public int maxBase() {
    return digits.length();
  }

  public String convert(long value, int base) {
    Preconditions.checkArgument(
        base >= 2 && base <= digits.length(), "base %s out of range 2..%s", base, digits.length());
    if (value == 0) {
      return digits.substring(0, 1);
    }
    StringBuilder sb = new StringBuilder();
    long remaining = value;
    while (remaining != 0) {
      int digit = (int) Math.abs(remaining % base);
      sb.append(digits.charAt(digit));
      remaining /= base;
    }
    if (value < 0) {
      sb.append('-');
    }
    return sb.reverse().toString();
  }

  // Length of the longest run of digit characters in `text`.
  public int longestNumeral(String text) {
    int best = 0;
    int run = 0;
    for (int i = 0; i < text.length(); i++) {
      if (digitMatcher.matches(text.charAt(i))) {
        run++;
        best = Math.max(best, run);
      } else {
        run = 0;
      }
    }
    return best;
  }
}
