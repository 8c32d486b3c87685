package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.*;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Transforms LP^MLN rules into answer set programs with weak constraints, in the penalty way:
 * every violated soft rule adds its weight to the cost of a model.
 *
 * <p>
 *   Weights and the other annotations of a rule are theory atoms in its head or body, such as
 *   {@code a :- b, &weight(2).}, {@code &evidence(p).} or {@code q :- r, &log("0.5").}.
 *   Visiting the head and body of a rule records its annotations and variables in a {@link RuleContext};
 *   the rule is then rewritten according to what was found.
 * </p>
 *
 * <p>
 *   One instance translates one program: rules must be given in program order, since each rule that
 *   reaches the encoder takes the next rule index.
 * </p>
 */
public class LPMLNTransformer extends Transformer<RuleContext> {
  public final TranslationMode mode;
  private final PlogConverter plog;
  private final WeightScaler scaler;
  private final PenaltyEncoder encoder;
  private int ruleIndex = 0;

  public LPMLNTransformer(TranslationMode mode, PlogConverter plog, WeightScaler scaler) {
    this.mode = mode;
    this.plog = plog;
    this.scaler = scaler;
    this.encoder = new PenaltyEncoder(mode);
  }

  public LPMLNTransformer(TranslationMode mode) {
    this(mode, PlogConverter.UNSUPPORTED, Weights.POWER_OF_TEN);
  }

  /** The index the next encoded rule will take. */
  public int ruleIndex() {
    return ruleIndex;
  }

  /**
   * Translate a top-level statement of the program.
   * Rules are rewritten; every other statement is visited in a throwaway context.
   */
  public Translation translate(AST statement) {
    if (statement.type() == ASTType.RULE) {
      return visitRule((AST.Rule) statement);
    }
    return Translation.of(visit(statement, new RuleContext(ruleIndex)), Translation.Outcome.UNCHANGED);
  }

  @Override
  public AST visit(AST node, RuleContext context) {
    switch (node.type()) {
      case VARIABLE:
        return visitVariable((AST.Variable) node, context);
      case THEORY_ATOM:
        return visitTheoryAtom((AST.TheoryAtom) node, context);
      case LITERAL:
        return visitLiteral((AST.Literal) node, context);
      case AGGREGATE:
        return visitAggregate((AST.Aggregate) node, context);
      case MINIMIZE:
        // already a translated statement
        return node;
      default:
        return super.visit(node, context);
    }
  }

  /**
   * Visit an LP^MLN rule and convert it to one to three ASP statements.
   */
  protected Translation visitRule(AST.Rule rule) {
    RuleContext context = new RuleContext(ruleIndex);
    // Facts are never weighted
    if (rule.head.type() != ASTType.THEORY_ATOM && rule.body.isEmpty()) {
      return Translation.of(rule, Translation.Outcome.UNCHANGED);
    }

    // Traverse head and body to look for weights and variables
    AST head = asHead(visit(rule.head, context));
    List<AST> body = visitSequence(rule.body, context);

    switch (context.theoryKind()) {
      case QUERY:
        return Translation.of(rule, Translation.Outcome.UNCHANGED);
      case EVIDENCE:
        AST integrityHead = new AST.Literal(head.location, Sign.NO_SIGN, new AST.BooleanConstant(head.location, false));
        return Translation.of(new AST.Rule(rule.location, integrityHead, Collections.singletonList(head)), Translation.Outcome.EVIDENCE);
      case RANDOM:
        return Translation.of(plog.convertRandom(head, body), Translation.Outcome.PLOG);
      case PR:
        return Translation.of(plog.convertPr(head, body), Translation.Outcome.PLOG);
      case OBS:
      case DO:
        return Translation.of(plog.convertObsDo(head), Translation.Outcome.PLOG);
      case NONE:
        break;
      default:
        throw new IllegalStateException("Unknown theory kind: " + context.theoryKind());
    }

    // Hard rules are translated only if requested
    if (context.weight().isAlpha() && !mode.translateHardRules) {
      ruleIndex += 1;
      return Translation.of(rule, Translation.Outcome.UNCHANGED);
    }
    List<AST> encoded = encoder.encode(head, body, context);
    ruleIndex += 1;
    return Translation.of(encoded, Translation.Outcome.ENCODED);
  }

  /** A head annotation visits to a bare atom; heads are literals or aggregates. */
  private static AST asHead(AST visited) {
    if (visited instanceof AST.Literal || visited instanceof AST.Aggregate) {
      return visited;
    }
    return new AST.Literal(visited.location, Sign.NO_SIGN, visited);
  }

  /**
   * Collects the global variables encountered in a rule.
   */
  protected AST visitVariable(AST.Variable variable, RuleContext context) {
    context.addVariable(variable);
    return variable;
  }

  protected AST visitLiteral(AST.Literal literal, RuleContext context) {
    if (literal.atom instanceof AST.TheoryAtom
        && TheoryKind.EVIDENCE.annotation.equals(((AST.TheoryAtom) literal.atom).name())) {
      throw new TranslationException(TranslationException.Kind.UNSUPPORTED_THEORY_ANNOTATION, literal.location,
          "evidence must be the head of a statement: " + literal);
    }
    return visitChildren(literal, context);
  }

  /**
   * Variables in the elements of an aggregate are local to it; only its guards
   * contribute global variables.
   */
  protected AST visitAggregate(AST.Aggregate aggregate, RuleContext context) {
    AST.Guard left = aggregate.leftGuard == null ? null : (AST.Guard) visit(aggregate.leftGuard, context);
    AST.Guard right = aggregate.rightGuard == null ? null : (AST.Guard) visit(aggregate.rightGuard, context);
    context.enterLocalScope();
    try {
      return new AST.Aggregate(aggregate.location, left, visitSequence(aggregate.elements, context), right);
    } finally {
      context.exitLocalScope();
    }
  }

  /**
   * Classifies the rule by its annotation, or extracts the weight of the rule and
   * removes the annotation.
   */
  protected AST visitTheoryAtom(AST.TheoryAtom atom, RuleContext context) {
    List<AST> args = atom.arguments();
    Optional<TheoryKind> kind = TheoryKind.fromAnnotation(atom.name());
    if (kind.isPresent()) {
      context.setTheoryKind(kind.get());
      if (kind.get() != TheoryKind.EVIDENCE) {
        return atom;
      }
      // Evidence is converted to an integrity constraint forbidding its negation
      if (args.isEmpty() || args.size() > 2) {
        throw unsupported(atom, "expected &evidence(atom) or &evidence(atom, false)");
      }
      Sign sign = Sign.NEGATION;
      if (args.size() > 1 && "false".equals(args.get(1).toString())) {
        sign = Sign.NO_SIGN;
      }
      return new AST.Literal(atom.location, sign, new AST.SymbolicAtom(args.get(0).location, args.get(0)));
    }

    if (args.size() != 1) {
      throw unsupported(atom, "expected a single argument");
    }
    double raw;
    try {
      switch (atom.name()) {
        case "weight":
          raw = numericArgument(atom, args.get(0));
          break;
        case "log":
          raw = Weights.log(numericArgument(atom, args.get(0)));
          break;
        case "problog":
          raw = Weights.problog(numericArgument(atom, args.get(0)));
          break;
        default:
          throw unsupported(atom, "unknown annotation '" + atom.name() + "'");
      }
      context.recordWeight(scaler.scale(raw, mode.weightScale), atom);
    } catch (ArithmeticException e) {
      throw new TranslationException(TranslationException.Kind.WEIGHT_COMPUTATION, atom.location, atom + ": " + e.getMessage(), e);
    }
    return new AST.BooleanConstant(atom.location, true);
  }

  /**
   * The value of a weight argument: an integer, or a string holding a numeric literal.
   */
  private static double numericArgument(AST.TheoryAtom atom, AST arg) {
    if (arg instanceof AST.SymbolicTerm) {
      Symbol symbol = ((AST.SymbolicTerm) arg).symbol;
      if (symbol.isNumber()) {
        return symbol.getNumber();
      }
      try {
        return Weights.parseNumericLiteral(symbol.getString());
      } catch (NumberFormatException e) {
        throw new TranslationException(TranslationException.Kind.INVALID_WEIGHT_EXPRESSION, atom.location, atom + ": " + e.getMessage(), e);
      }
    }
    if (arg instanceof AST.UnaryOperation && ((AST.UnaryOperation) arg).argument instanceof AST.SymbolicTerm) {
      return -numericArgument(atom, ((AST.UnaryOperation) arg).argument);
    }
    throw new TranslationException(TranslationException.Kind.INVALID_WEIGHT_EXPRESSION, atom.location,
        atom + ": '" + arg + "' is neither a number nor a numeric string");
  }

  private static TranslationException unsupported(AST.TheoryAtom atom, String why) {
    return new TranslationException(TranslationException.Kind.UNSUPPORTED_THEORY_ANNOTATION, atom.location, atom + ": " + why);
  }
}
