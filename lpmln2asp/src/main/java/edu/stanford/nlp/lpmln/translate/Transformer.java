package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.AST;

import java.util.ArrayList;
import java.util.List;

/**
 * A rewriting visitor over a program tree. Subclasses override {@link Transformer#visit(AST, Object)},
 * switch on the node's type for the kinds they handle, and fall through to this default for the rest,
 * which visits every child and rebuilds the node around the results.
 *
 * @param <C> The context threaded through a visit.
 */
public abstract class Transformer<C> {

  public AST visit(AST node, C context) {
    return visitChildren(node, context);
  }

  protected AST visitChildren(AST node, C context) {
    return node.mapChildren(child -> visit(child, context));
  }

  /** Visit a sequence of nodes in order. */
  public List<AST> visitSequence(List<? extends AST> nodes, C context) {
    List<AST> visited = new ArrayList<>(nodes.size());
    for (AST node : nodes) {
      visited.add(visit(node, context));
    }
    return visited;
  }
}
