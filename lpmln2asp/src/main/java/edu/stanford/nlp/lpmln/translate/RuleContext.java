package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.AST;

import java.util.*;

/**
 * The scratch state of translating a single rule, threaded through the visit of its head and body.
 * A fresh context is created for every top-level statement.
 */
public class RuleContext {
  /** The index of this rule in the session; embedded in its weak constraint keys. */
  public final int ruleIndex;

  private Weight weight = Weight.ALPHA;
  private AST.TheoryAtom weightAnnotation = null;
  private TheoryKind theoryKind = TheoryKind.NONE;
  private final Set<AST.Variable> globalVariables = new LinkedHashSet<>();
  private int localScopeDepth = 0;

  public RuleContext(int ruleIndex) {
    this.ruleIndex = ruleIndex;
  }

  public Weight weight() { return weight; }

  public TheoryKind theoryKind() { return theoryKind; }

  /** The distinct variables of the rule, in order of first occurrence. */
  public List<AST.Variable> globalVariables() {
    return Collections.unmodifiableList(new ArrayList<>(globalVariables));
  }

  void setTheoryKind(TheoryKind kind) {
    this.theoryKind = kind;
  }

  /**
   * Record the weight carried by a weight annotation.
   * @throws TranslationException if the rule already has a weight annotation.
   */
  void recordWeight(Weight weight, AST.TheoryAtom annotation) {
    if (weightAnnotation != null) {
      throw new TranslationException(TranslationException.Kind.AMBIGUOUS_WEIGHT, annotation.location,
          "rule is weighted by both " + weightAnnotation + " and " + annotation);
    }
    this.weight = weight;
    this.weightAnnotation = annotation;
  }

  /** Collect a variable, unless it is anonymous or local to an aggregate element. */
  void addVariable(AST.Variable variable) {
    if (localScopeDepth == 0 && !variable.isAnonymous()) {
      globalVariables.add(variable);
    }
  }

  void enterLocalScope() { localScopeDepth += 1; }

  void exitLocalScope() { localScopeDepth -= 1; }
}
