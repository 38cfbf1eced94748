package io.intellixity.livequery.query;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Normalizes condition values to comparison-friendly types: integral numbers to Long, the rest to Double. */
public final class ConditionValues {
  private ConditionValues() {}

  public static Object normalize(Object v) {
    if (v == null) return null;
    if (v instanceof Long || v instanceof Double || v instanceof String || v instanceof Boolean) return v;
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
    if (v instanceof Float f) return f.doubleValue();
    if (v instanceof BigInteger bi) return bi.bitLength() < 64 ? (Object) bi.longValue() : bi;
    if (v instanceof BigDecimal bd) {
      try {
        return bd.longValueExact();
      } catch (ArithmeticException e) {
        return bd.doubleValue();
      }
    }
    if (v instanceof CharSequence cs) return cs.toString();
    return v;
  }

  /** Renders a value for the query text: strings single-quoted, null as {@code null}, the rest verbatim. */
  static String render(Object v) {
    if (v == null) return "null";
    if (v instanceof CharSequence cs) return "'" + cs.toString().replace("'", "\\'") + "'";
    return v.toString();
  }
}
