package edu.stanford.nlp.lpmln.io;

import edu.stanford.nlp.lpmln.ast.AST;

/**
 * The sink for a translated program. Statements arrive one at a time, in program order,
 * and must be kept in that order.
 */
public interface ProgramBuilder {

  void add(AST statement);
}
