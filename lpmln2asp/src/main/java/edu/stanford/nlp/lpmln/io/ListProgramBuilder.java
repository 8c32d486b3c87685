package edu.stanford.nlp.lpmln.io;

import edu.stanford.nlp.lpmln.ast.AST;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects a program in memory.
 */
public class ListProgramBuilder implements ProgramBuilder {
  private final List<AST> statements = new ArrayList<>();

  @Override
  public void add(AST statement) {
    statements.add(statement);
  }

  public List<AST> statements() {
    return Collections.unmodifiableList(statements);
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    for (AST statement : statements) {
      b.append(statement).append("\n");
    }
    return b.toString();
  }
}
