package edu.stanford.nlp.lpmln.translate;

import java.util.Optional;

/**
 * The theory annotations which classify a whole rule, as opposed to merely weighting it.
 */
public enum TheoryKind {
  NONE(""),
  QUERY("query"),
  EVIDENCE("evidence"),
  RANDOM("random"),
  PR("pr"),
  OBS("obs"),
  DO("do");

  /** The annotation name, as written after the '&amp;' */
  public final String annotation;

  TheoryKind(String annotation) {
    this.annotation = annotation;
  }

  /** The kind named by a theory atom, if any. Names are case sensitive. */
  public static Optional<TheoryKind> fromAnnotation(String name) {
    for (TheoryKind kind : values()) {
      if (kind != NONE && kind.annotation.equals(name)) { return Optional.of(kind); }
    }
    return Optional.empty();
  }
}
