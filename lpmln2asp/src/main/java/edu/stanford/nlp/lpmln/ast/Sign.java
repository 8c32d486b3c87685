package edu.stanford.nlp.lpmln.ast;

/**
 * The default-negation prefix of a literal.
 */
public enum Sign {
  NO_SIGN(""),
  NEGATION("not "),
  DOUBLE_NEGATION("not not ");

  public final String prefix;

  Sign(String prefix) {
    this.prefix = prefix;
  }
}
