package edu.stanford.nlp.lpmln.ast;

/**
 * The closed set of node kinds in a logic program. Dispatch over a tree switches on this tag.
 */
public enum ASTType {
  VARIABLE,
  SYMBOLIC_TERM,
  FUNCTION,
  UNARY_OPERATION,
  BINARY_OPERATION,
  COMPARISON,
  SYMBOLIC_ATOM,
  BOOLEAN_CONSTANT,
  LITERAL,
  CONDITIONAL_LITERAL,
  GUARD,
  AGGREGATE,
  THEORY_ATOM,
  RULE,
  MINIMIZE,
  EXTERNAL,
  SHOW_SIGNATURE
}
