package com.gentoro.analytics.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Coercion of raw cell values to numbers.
 *
 * <p>Accepted: finite {@link Number} instances and strings in plain decimal, integer, signed or
 * exponent notation ({@code 42}, {@code -3.5}, {@code .5}, {@code 1e-3}). Rejected: {@code NaN},
 * infinities, hexadecimal, type suffixes ({@code 1d}), booleans and blank strings.
 */
public final class NumericCoercion {
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private NumericCoercion() {}

  /** Returns the numeric value, or {@code null} when the value is missing or not numeric. */
  public static Double toDouble(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? d : null;
    }
    if (value instanceof CharSequence cs) {
      String s = cs.toString().trim();
      if (!DECIMAL.matcher(s).matches()) {
        return null;
      }
      double d = Double.parseDouble(s);
      return Double.isFinite(d) ? d : null;
    }
    return null;
  }

  public static boolean isNumeric(Object value) {
    return toDouble(value) != null;
  }

  /**
   * Exact decimal value of a numeric cell, or {@code null} when {@link #toDouble} rejects it.
   * Integral and decimal types keep every digit; {@code 9007199254740993L} does not collapse onto
   * its {@code double} neighbour.
   */
  public static BigDecimal toBigDecimal(Object value) {
    if (toDouble(value) == null) {
      return null;
    }
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof Number n) {
      // Double.toString / Float.toString give the shortest text that round-trips
      try {
        return new BigDecimal(n.toString());
      } catch (NumberFormatException e) {
        return BigDecimal.valueOf(n.doubleValue());
      }
    }
    return new BigDecimal(value.toString().trim());
  }

  /**
   * Canonical text for a number: no trailing zeros and no exponent ({@code 10.0 -> "10"}, {@code
   * 1.50 -> "1.5"}).
   */
  public static String canonical(double value) {
    return canonical(BigDecimal.valueOf(value));
  }

  public static String canonical(BigDecimal value) {
    return value.stripTrailingZeros().toPlainString();
  }
}
