package edu.stanford.nlp.lpmln.translate;

import java.util.regex.Pattern;

/**
 * The weight formulas of the supported weight annotations, and the numeric literal
 * grammar their arguments are written in.
 */
public class Weights {

  private Weights() {} // static methods

  /** Integers, decimals and scientific notation; nothing else is evaluated. */
  private static final Pattern NUMERIC_LITERAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  /** The default {@link WeightScaler}. */
  public static final WeightScaler POWER_OF_TEN = Weights::calculate;

  /**
   * Parse a numeric literal, such as "0.75" or "-1e-3".
   * @throws NumberFormatException if the text is anything but a numeric literal.
   */
  public static double parseNumericLiteral(String text) {
    String trimmed = text.trim();
    if (!NUMERIC_LITERAL.matcher(trimmed).matches()) {
      throw new NumberFormatException("Not a numeric literal: '" + text + "'");
    }
    return Double.parseDouble(trimmed);
  }

  /** The weight of {@code &log(p)}: ln(p). */
  public static double log(double p) {
    if (p <= 0.0) { throw new ArithmeticException("log of non-positive value " + p); }
    return Math.log(p);
  }

  /** The weight of {@code &problog(p)}: the log-odds ln(p / (1 - p)). */
  public static double problog(double p) {
    if (p == 1.0) { throw new ArithmeticException("division by zero: problog(" + p + ")"); }
    double odds = p / (1.0 - p);
    if (odds <= 0.0) { throw new ArithmeticException("log of non-positive odds " + odds + " for problog(" + p + ")"); }
    return Math.log(odds);
  }

  /** Scale a raw weight by 10^powerOfTen. */
  public static Weight calculate(double raw, int powerOfTen) {
    return Weight.of(raw * Math.pow(10.0, powerOfTen));
  }
}
