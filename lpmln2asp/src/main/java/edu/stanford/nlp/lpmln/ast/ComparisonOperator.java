package edu.stanford.nlp.lpmln.ast;

import java.util.Optional;

/**
 * Relational operators, as used in comparisons and aggregate guards.
 */
public enum ComparisonOperator {
  EQUAL("="),
  NOT_EQUAL("!="),
  LESS("<"),
  LESS_EQUAL("<="),
  GREATER(">"),
  GREATER_EQUAL(">=");

  public final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public static Optional<ComparisonOperator> fromSymbol(String symbol) {
    for (ComparisonOperator op : values()) {
      if (op.symbol.equals(symbol)) { return Optional.of(op); }
    }
    // gringo accepts '==' as a synonym for '='
    if ("==".equals(symbol)) { return Optional.of(EQUAL); }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return symbol;
  }
}
