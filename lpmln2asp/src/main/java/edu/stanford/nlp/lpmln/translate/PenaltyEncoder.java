package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Encodes a weighted rule {@code w : H :- B} as plain rules plus a weak constraint, such that
 * every model in which the rule is violated pays its weight.
 *
 * <p>
 *   The compact encoding turns the head into a choice and penalizes its absence:
 *   <pre>
 *     {H} :- B.
 *     :~ not H, B. [w@0, idx, (X1,...,Xn)]
 *   </pre>
 *   The unsat encoding marks violations with an explicit atom:
 *   <pre>
 *     unsat(idx,w,(X1,...,Xn)) :- not H, B.
 *     H :- not unsat(idx,w,(X1,...,Xn)), B.
 *     :~ unsat(idx,w,(X1,...,Xn)). [w@0, idx, (X1,...,Xn)]
 *   </pre>
 *   Hard rules, which have no numeric weight, are penalized by 1 at priority 1, above every soft rule.
 * </p>
 */
public class PenaltyEncoder {
  public static final String UNSAT = "unsat";
  public static final String EXT_HELPER = "ext_helper";

  private static final int SOFT_PRIORITY = 0;
  private static final int HARD_PRIORITY = 1;

  private final TranslationMode mode;

  public PenaltyEncoder(TranslationMode mode) {
    this.mode = mode;
  }

  /**
   * Encode a rule.
   *
   * @param head The head of the rule, with its annotations already visited: a literal or an aggregate.
   * @param body The visited body of the rule.
   * @param context The context the head and body were visited in.
   * @return One to three statements, the last of which is usually a weak constraint.
   */
  public List<AST> encode(AST head, List<AST> body, RuleContext context) {
    Location loc = head.location;
    AST idx = number(loc, context.ruleIndex);
    AST globals = new AST.Function(loc, "", context.globalVariables());
    AST weight = context.weight().toTerm(loc);
    AST constraintWeight;
    int priority;
    if (context.weight().isAlpha()) {
      constraintWeight = number(loc, 1);
      priority = HARD_PRIORITY;
    } else {
      constraintWeight = weight;
      priority = SOFT_PRIORITY;
    }

    // The negation of the head; an unguarded choice can never be violated
    AST notHead;
    if (head instanceof AST.Aggregate) {
      if (!((AST.Aggregate) head).isGuarded()) {
        return Collections.singletonList(new AST.Rule(loc, head, body));
      }
      notHead = new AST.Literal(loc, Sign.NEGATION, head);
    } else {
      notHead = new AST.Literal(loc, Sign.NEGATION, ((AST.Literal) head).atom);
    }

    List<AST> key = new ArrayList<>();
    key.add(idx);
    key.add(globals);
    AST priorityTerm = number(loc, priority);

    if (mode.useUnsatEncoding) {
      AST unsatAtom = new AST.SymbolicAtom(loc, new AST.Function(loc, UNSAT, asList(idx, weight, globals)));
      AST unsat = new AST.Literal(loc, Sign.NO_SIGN, unsatAtom);
      AST notUnsat = new AST.Literal(loc, Sign.NEGATION, unsatAtom);
      List<AST> rules = new ArrayList<>(3);
      rules.add(new AST.Rule(loc, unsat, prepend(notHead, body)));
      rules.add(new AST.Rule(loc, head, prepend(notUnsat, body)));
      rules.add(new AST.Minimize(loc, constraintWeight, priorityTerm, key, Collections.singletonList(unsat)));
      return rules;
    }

    List<AST> rules = new ArrayList<>(2);
    List<AST> constraintBody = new ArrayList<>(body);
    if (head instanceof AST.Aggregate) {
      // w : l { e1; ...; en } u :- B.  -->  { e1; ...; en } :- B.  and  :~ not l { ... } u, B.
      AST.Aggregate aggregate = (AST.Aggregate) head;
      rules.add(new AST.Rule(loc, new AST.Aggregate(loc, null, aggregate.elements, null), body));
      constraintBody.add(0, notHead);
    } else if (((AST.Literal) head).isFalse()) {
      // w : #false :- B.  -->  :~ B.
    } else {
      // w : H :- B.  -->  {H} :- B.  and  :~ not H, B.
      AST choice = new AST.Aggregate(loc, null,
          Collections.singletonList(new AST.ConditionalLiteral(loc, head, Collections.<AST>emptyList())), null);
      rules.add(new AST.Rule(loc, choice, body));
      constraintBody.add(0, notHead);
    }
    if (mode.twoSolveCalls && priority == SOFT_PRIORITY) {
      constraintBody.add(0, extHelper(loc));
    }
    rules.add(new AST.Minimize(loc, constraintWeight, priorityTerm, key, constraintBody));
    return rules;
  }

  /** The literal {@code ext_helper}, which switches soft weak constraints on in a second solving pass. */
  public static AST extHelper(Location loc) {
    return new AST.Literal(loc, Sign.NO_SIGN, extHelperAtom(loc));
  }

  public static AST extHelperAtom(Location loc) {
    return new AST.SymbolicAtom(loc, new AST.Function(loc, EXT_HELPER, Collections.<AST>emptyList()));
  }

  private static AST number(Location loc, long value) {
    return new AST.SymbolicTerm(loc, Symbol.number(value));
  }

  private static List<AST> prepend(AST first, List<AST> rest) {
    List<AST> list = new ArrayList<>(rest.size() + 1);
    list.add(first);
    list.addAll(rest);
    return list;
  }

  private static List<AST> asList(AST... nodes) {
    List<AST> list = new ArrayList<>(nodes.length);
    Collections.addAll(list, nodes);
    return list;
  }
}
