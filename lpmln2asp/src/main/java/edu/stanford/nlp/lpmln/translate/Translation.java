package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.AST;

import java.util.*;

/**
 * The result of translating one statement: the statement that takes its place in the program,
 * and any statements to insert right before it.
 */
public class Translation {

  /** What became of the statement; used for statistics only. */
  public enum Outcome {
    /** Returned as it was: facts, queries, directives, untranslated hard rules. */
    UNCHANGED,
    /** An evidence annotation compiled to an integrity constraint. */
    EVIDENCE,
    /** Delegated to the P-log converter. */
    PLOG,
    /** A weighted (or translated hard) rule, encoded with a weak constraint. */
    ENCODED
  }

  public final List<AST> prefix;
  public final AST statement;
  public final Outcome outcome;

  private Translation(List<AST> prefix, AST statement, Outcome outcome) {
    this.prefix = Collections.unmodifiableList(new ArrayList<>(prefix));
    this.statement = statement;
    this.outcome = outcome;
  }

  public static Translation of(AST statement, Outcome outcome) {
    return new Translation(Collections.emptyList(), statement, outcome);
  }

  /**
   * Split a non-empty list of statements: all but the last are the prefix.
   * @throws IllegalStateException if there are no statements.
   */
  public static Translation of(List<AST> statements, Outcome outcome) {
    if (statements.isEmpty()) { throw new IllegalStateException("A statement must translate to at least one statement"); }
    return new Translation(statements.subList(0, statements.size() - 1), statements.get(statements.size() - 1), outcome);
  }

  /** Every statement of this translation, in program order. */
  public List<AST> statements() {
    List<AST> all = new ArrayList<>(prefix);
    all.add(statement);
    return all;
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    for (AST s : statements()) {
      b.append(s).append("\n");
    }
    return b.toString();
  }
}
