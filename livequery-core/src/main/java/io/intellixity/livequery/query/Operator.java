package io.intellixity.livequery.query;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Comparison operators supported by a {@link Condition}.
 * <p>
 * {@link #evaluate(Object, Object)} takes the entity's field value on the left and the condition value
 * on the right. Two numbers are equal when their values are, so {@code 30}, {@code 30L} and {@code 30.0}
 * compare equal however the store or the JSON layer boxed them; anything else compares by string form.
 */
public enum Operator {
  EQUAL("=") {
    @Override
    public boolean evaluate(Object left, Object right) {
      return sameValue(left, right);
    }
  },

  NOT_EQUAL("<>") {
    @Override
    public boolean evaluate(Object left, Object right) {
      return !sameValue(left, right);
    }
  },

  /** Glob match: {@code *} stands for any run of characters, the pattern is anchored at both ends. */
  MATCHES("matches") {
    @Override
    public boolean evaluate(Object left, Object right) {
      String value = requireText(left, "value");
      String pattern = requireText(right, "pattern");
      return globToRegex(pattern).matcher(value).matches();
    }
  };

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() { return symbol; }

  /**
   * @param left  the entity field value (for {@link #MATCHES}: the text to test)
   * @param right the condition value (for {@link #MATCHES}: the glob pattern)
   * @throws IllegalArgumentException for {@link #MATCHES} when an operand is null, empty or not a string
   */
  public abstract boolean evaluate(Object left, Object right);

  /** Renders {@code field <symbol> value}; {@code renderedValue} is already quoted as needed. */
  public String render(String field, String renderedValue) {
    return field + " " + symbol + " " + renderedValue;
  }

  /** Parses a wire symbol ({@code =}, {@code <>}, {@code matches}) or an enum name. */
  public static Operator parse(String raw) {
    if (raw == null) throw new QueryValidationException("Operator is required");
    String s = raw.trim();
    for (Operator op : values()) {
      if (op.symbol.equalsIgnoreCase(s)) return op;
    }
    try {
      return Operator.valueOf(s.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unknown operator: '" + raw + "'", e);
    }
  }

  /** Anchored pattern for a glob; {@code *} becomes {@code .*}, everything else is literal. */
  public static Pattern globToRegex(String glob) {
    StringBuilder re = new StringBuilder("^");
    int start = 0;
    for (int i = 0; i < glob.length(); i++) {
      if (glob.charAt(i) != '*') continue;
      if (i > start) re.append(Pattern.quote(glob.substring(start, i)));
      re.append(".*");
      start = i + 1;
    }
    if (start < glob.length()) re.append(Pattern.quote(glob.substring(start)));
    re.append("$");
    return Pattern.compile(re.toString(), Pattern.DOTALL);
  }

  static boolean sameValue(Object left, Object right) {
    if (left == right) return true;
    if (left == null || right == null) return false;
    if (left instanceof Number a && right instanceof Number b) {
      BigDecimal x = decimal(a);
      BigDecimal y = decimal(b);
      if (x == null || y == null) return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
      return x.compareTo(y) == 0;
    }
    return left.toString().equals(right.toString());
  }

  // null for NaN and infinities
  private static BigDecimal decimal(Number n) {
    if (n instanceof BigDecimal bd) return bd;
    if (n instanceof Double || n instanceof Float) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? new BigDecimal(Double.toString(d)) : null;
    }
    try {
      return new BigDecimal(n.toString());
    } catch (NumberFormatException e) {
      return BigDecimal.valueOf(n.doubleValue());
    }
  }

  private static String requireText(Object v, String label) {
    if (v == null) throw new IllegalArgumentException(label + " must not be null");
    if (!(v instanceof CharSequence cs)) {
      throw new IllegalArgumentException(label + " must be a string, got " + v.getClass().getSimpleName());
    }
    if (cs.length() == 0) throw new IllegalArgumentException(label + " must not be empty");
    return cs.toString();
  }
}
