package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.AST;
import edu.stanford.nlp.lpmln.ast.Location;
import edu.stanford.nlp.lpmln.ast.Symbol;

import java.math.BigDecimal;

/**
 * The weight of a rule: either a (scaled) number, or the symbolic weight alpha of a hard rule.
 */
public class Weight {
  /** The weight of a rule with no weight annotation. */
  public static final Weight ALPHA = new Weight(Double.NaN, true);

  public final double value;
  private final boolean alpha;

  private Weight(double value, boolean alpha) {
    this.value = value;
    this.alpha = alpha;
  }

  public static Weight of(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new ArithmeticException("Weight is not a finite number: " + value);
    }
    return new Weight(value, false);
  }

  public boolean isAlpha() { return alpha; }

  /** True if the weight is a whole number, and so renders as an integer symbol. */
  public boolean isIntegral() {
    return !alpha && value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE;
  }

  /**
   * The weight as a term: the string "alpha" for hard rules, an integer for integral weights,
   * and otherwise a string holding the decimal value.
   */
  public AST toTerm(Location location) {
    if (alpha) {
      return new AST.SymbolicTerm(location, Symbol.string("alpha"));
    } else if (isIntegral()) {
      return new AST.SymbolicTerm(location, Symbol.number((long) value));
    } else {
      return new AST.SymbolicTerm(location, Symbol.string(BigDecimal.valueOf(value).stripTrailingZeros().toPlainString()));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Weight)) return false;
    Weight other = (Weight) o;
    return alpha == other.alpha && (alpha || Double.compare(value, other.value) == 0);
  }

  @Override
  public int hashCode() {
    return alpha ? 0 : Double.hashCode(value);
  }

  @Override
  public String toString() {
    return alpha ? "alpha" : Double.toString(value);
  }
}
