package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.Location;

/**
 * A fatal error while reading or translating an LP^MLN program.
 * Translation stops at the first such error, since a program with a rule
 * silently dropped has different models.
 */
public class TranslationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    SYNTAX_ERROR("syntax error"),
    INVALID_WEIGHT_EXPRESSION("invalid weight expression"),
    UNSUPPORTED_THEORY_ANNOTATION("unsupported theory annotation"),
    WEIGHT_COMPUTATION("weight computation error"),
    AMBIGUOUS_WEIGHT("ambiguous weight");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }

  public final Kind kind;
  public final Location location;

  public TranslationException(Kind kind, Location location, String message) {
    super(location + ": " + kind.description + ": " + message);
    this.kind = kind;
    this.location = location;
  }

  public TranslationException(Kind kind, Location location, String message, Throwable cause) {
    super(location + ": " + kind.description + ": " + message, cause);
    this.kind = kind;
    this.location = location;
  }
}
