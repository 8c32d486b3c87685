package edu.stanford.nlp.lpmln.ast;

import edu.stanford.nlp.util.StringUtils;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * A node in the abstract syntax tree of a logic program.
 *
 * <p>
 *   Nodes are immutable; a transformation rebuilds the nodes it changes through
 *   {@link AST#mapChildren(UnaryOperator)}, which returns a node of the same kind and location
 *   with every child replaced by the result of the given function.
 *   Equality is structural and ignores locations.
 *   The {@link Object#toString()} of a node is its gringo input syntax.
 * </p>
 */
public abstract class AST {
  public final Location location;

  protected AST(Location location) {
    if (location == null) { throw new IllegalArgumentException("Node without a location"); }
    this.location = location;
  }

  /** The tag of this node, for dispatching over node kinds. */
  public abstract ASTType type();

  /**
   * Rebuild this node with every child transformed by the given function.
   * Nodes without children return themselves.
   */
  public abstract AST mapChildren(UnaryOperator<AST> fn);

  protected static List<AST> mapAll(List<AST> nodes, UnaryOperator<AST> fn) {
    List<AST> mapped = new ArrayList<>(nodes.size());
    for (AST node : nodes) {
      mapped.add(fn.apply(node));
    }
    return mapped;
  }

  protected static List<AST> freeze(List<? extends AST> nodes) {
    return Collections.unmodifiableList(new ArrayList<AST>(nodes));
  }

  //
  //  --------------------
  //  Terms
  //  --------------------
  //

  public static class Variable extends AST {
    public final String name;

    public Variable(Location location, String name) {
      super(location);
      this.name = name;
    }

    /** True for the anonymous variable '_'. */
    public boolean isAnonymous() { return "_".equals(name); }

    @Override public ASTType type() { return ASTType.VARIABLE; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return this; }
    @Override public boolean equals(Object o) { return o instanceof Variable && ((Variable) o).name.equals(name); }
    @Override public int hashCode() { return name.hashCode(); }
    @Override public String toString() { return name; }
  }

  public static class SymbolicTerm extends AST {
    public final Symbol symbol;

    public SymbolicTerm(Location location, Symbol symbol) {
      super(location);
      this.symbol = symbol;
    }

    @Override public ASTType type() { return ASTType.SYMBOLIC_TERM; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return this; }
    @Override public boolean equals(Object o) { return o instanceof SymbolicTerm && ((SymbolicTerm) o).symbol.equals(symbol); }
    @Override public int hashCode() { return symbol.hashCode(); }
    @Override public String toString() { return symbol.toString(); }
  }

  /**
   * A function term {@code f(t1,...,tn)}. A constant is a function without arguments,
   * and a function with the empty name is a tuple.
   */
  public static class Function extends AST {
    public final String name;
    public final List<AST> arguments;

    public Function(Location location, String name, List<? extends AST> arguments) {
      super(location);
      this.name = name;
      this.arguments = freeze(arguments);
    }

    public boolean isTuple() { return name.isEmpty(); }

    @Override public ASTType type() { return ASTType.FUNCTION; }

    @Override
    public AST mapChildren(UnaryOperator<AST> fn) {
      if (arguments.isEmpty()) { return this; }
      return new Function(location, name, mapAll(arguments, fn));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Function)) return false;
      Function other = (Function) o;
      return name.equals(other.name) && arguments.equals(other.arguments);
    }

    @Override public int hashCode() { return 31 * name.hashCode() + arguments.hashCode(); }

    @Override
    public String toString() {
      if (isTuple()) {
        // a unary tuple needs its trailing comma to not read as parentheses
        return "(" + StringUtils.join(arguments, ",") + (arguments.size() == 1 ? ",)" : ")");
      }
      if (arguments.isEmpty()) { return name; }
      return name + "(" + StringUtils.join(arguments, ",") + ")";
    }
  }

  /** Arithmetic negation {@code -t}. */
  public static class UnaryOperation extends AST {
    public final AST argument;

    public UnaryOperation(Location location, AST argument) {
      super(location);
      this.argument = argument;
    }

    @Override public ASTType type() { return ASTType.UNARY_OPERATION; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return new UnaryOperation(location, fn.apply(argument)); }
    @Override public boolean equals(Object o) { return o instanceof UnaryOperation && ((UnaryOperation) o).argument.equals(argument); }
    @Override public int hashCode() { return 17 + argument.hashCode(); }
    @Override public String toString() { return "-" + argument; }
  }

  public static class BinaryOperation extends AST {
    public enum Operator {
      PLUS("+"), MINUS("-"), TIMES("*"), DIVISION("/"), MODULO("\\");

      public final String symbol;
      Operator(String symbol) { this.symbol = symbol; }
    }

    public final Operator operator;
    public final AST left;
    public final AST right;

    public BinaryOperation(Location location, Operator operator, AST left, AST right) {
      super(location);
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    @Override public ASTType type() { return ASTType.BINARY_OPERATION; }

    @Override
    public AST mapChildren(UnaryOperator<AST> fn) {
      return new BinaryOperation(location, operator, fn.apply(left), fn.apply(right));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof BinaryOperation)) return false;
      BinaryOperation other = (BinaryOperation) o;
      return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override public int hashCode() { return Objects.hash(operator, left, right); }
    @Override public String toString() { return "(" + left + operator.symbol + right + ")"; }
  }

  //
  //  --------------------
  //  Atoms and Literals
  //  --------------------
  //

  public static class Comparison extends AST {
    public final ComparisonOperator operator;
    public final AST left;
    public final AST right;

    public Comparison(Location location, ComparisonOperator operator, AST left, AST right) {
      super(location);
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    @Override public ASTType type() { return ASTType.COMPARISON; }

    @Override
    public AST mapChildren(UnaryOperator<AST> fn) {
      return new Comparison(location, operator, fn.apply(left), fn.apply(right));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Comparison)) return false;
      Comparison other = (Comparison) o;
      return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override public int hashCode() { return Objects.hash(operator, left, right); }
    @Override public String toString() { return left + operator.symbol + right; }
  }

  /** An atom given by a term, e.g. {@code p(X,1)}. */
  public static class SymbolicAtom extends AST {
    public final AST symbol;

    public SymbolicAtom(Location location, AST symbol) {
      super(location);
      this.symbol = symbol;
    }

    @Override public ASTType type() { return ASTType.SYMBOLIC_ATOM; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return new SymbolicAtom(location, fn.apply(symbol)); }
    @Override public boolean equals(Object o) { return o instanceof SymbolicAtom && ((SymbolicAtom) o).symbol.equals(symbol); }
    @Override public int hashCode() { return 37 + symbol.hashCode(); }
    @Override public String toString() { return symbol.toString(); }
  }

  public static class BooleanConstant extends AST {
    public final boolean value;

    public BooleanConstant(Location location, boolean value) {
      super(location);
      this.value = value;
    }

    @Override public ASTType type() { return ASTType.BOOLEAN_CONSTANT; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return this; }
    @Override public boolean equals(Object o) { return o instanceof BooleanConstant && ((BooleanConstant) o).value == value; }
    @Override public int hashCode() { return value ? 1231 : 1237; }
    @Override public String toString() { return value ? "#true" : "#false"; }
  }

  public static class Literal extends AST {
    public final Sign sign;
    public final AST atom;

    public Literal(Location location, Sign sign, AST atom) {
      super(location);
      this.sign = sign;
      this.atom = atom;
    }

    /** True if this is the literal {@code #false}, the head of an integrity constraint. */
    public boolean isFalse() {
      return sign == Sign.NO_SIGN && atom instanceof BooleanConstant && !((BooleanConstant) atom).value;
    }

    @Override public ASTType type() { return ASTType.LITERAL; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return new Literal(location, sign, fn.apply(atom)); }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Literal)) return false;
      Literal other = (Literal) o;
      return sign == other.sign && atom.equals(other.atom);
    }

    @Override public int hashCode() { return 31 * sign.hashCode() + atom.hashCode(); }
    @Override public String toString() { return sign.prefix + atom; }
  }

  /** A literal qualified by a condition, e.g. the element {@code a(X) : b(X)} of an aggregate. */
  public static class ConditionalLiteral extends AST {
    public final AST literal;
    public final List<AST> condition;

    public ConditionalLiteral(Location location, AST literal, List<? extends AST> condition) {
      super(location);
      this.literal = literal;
      this.condition = freeze(condition);
    }

    @Override public ASTType type() { return ASTType.CONDITIONAL_LITERAL; }

    @Override
    public AST mapChildren(UnaryOperator<AST> fn) {
      return new ConditionalLiteral(location, fn.apply(literal), mapAll(condition, fn));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof ConditionalLiteral)) return false;
      ConditionalLiteral other = (ConditionalLiteral) o;
      return literal.equals(other.literal) && condition.equals(other.condition);
    }

    @Override public int hashCode() { return 31 * literal.hashCode() + condition.hashCode(); }

    @Override
    public String toString() {
      if (condition.isEmpty()) { return literal.toString(); }
      return literal + ": " + StringUtils.join(condition, ", ");
    }
  }

  /**
   * A bound on an aggregate. As a left guard it reads {@code term op { ... }};
   * as a right guard, {@code { ... } op term}.
   */
  public static class Guard extends AST {
    public final ComparisonOperator operator;
    public final AST term;

    public Guard(Location location, ComparisonOperator operator, AST term) {
      super(location);
      this.operator = operator;
      this.term = term;
    }

    @Override public ASTType type() { return ASTType.GUARD; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return new Guard(location, operator, fn.apply(term)); }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Guard)) return false;
      Guard other = (Guard) o;
      return operator == other.operator && term.equals(other.term);
    }

    @Override public int hashCode() { return 31 * operator.hashCode() + term.hashCode(); }
    @Override public String toString() { return operator.symbol + term; }
  }

  /** A set aggregate {@code l op { e1; ...; en } op u}, either guard optional. */
  public static class Aggregate extends AST {
    public final Guard leftGuard;
    public final List<AST> elements;
    public final Guard rightGuard;

    public Aggregate(Location location, Guard leftGuard, List<? extends AST> elements, Guard rightGuard) {
      super(location);
      this.leftGuard = leftGuard;
      this.elements = freeze(elements);
      this.rightGuard = rightGuard;
    }

    /** An aggregate without guards is an unconstrained choice. */
    public boolean isGuarded() {
      return leftGuard != null || rightGuard != null;
    }

    @Override public ASTType type() { return ASTType.AGGREGATE; }

    @Override
    public AST mapChildren(UnaryOperator<AST> fn) {
      return new Aggregate(location,
          leftGuard == null ? null : (Guard) fn.apply(leftGuard),
          mapAll(elements, fn),
          rightGuard == null ? null : (Guard) fn.apply(rightGuard));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Aggregate)) return false;
      Aggregate other = (Aggregate) o;
      return Objects.equals(leftGuard, other.leftGuard) && elements.equals(other.elements)
          && Objects.equals(rightGuard, other.rightGuard);
    }

    @Override public int hashCode() { return Objects.hash(leftGuard, elements, rightGuard); }

    @Override
    public String toString() {
      StringBuilder b = new StringBuilder();
      if (leftGuard != null) {
        b.append(leftGuard.term).append(' ').append(leftGuard.operator.symbol).append(' ');
      }
      b.append(elements.isEmpty() ? "{ }" : "{ " + StringUtils.join(elements, "; ") + " }");
      if (rightGuard != null) {
        b.append(' ').append(rightGuard.operator.symbol).append(' ').append(rightGuard.term);
      }
      return b.toString();
    }
  }

  /**
   * A theory atom {@code &name(args)}, carrying an annotation such as a weight or
   * an evidence declaration.
   */
  public static class TheoryAtom extends AST {
    public final Function term;

    public TheoryAtom(Location location, Function term) {
      super(location);
      this.term = term;
    }

    public String name() { return term.name; }

    public List<AST> arguments() { return term.arguments; }

    @Override public ASTType type() { return ASTType.THEORY_ATOM; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return new TheoryAtom(location, (Function) fn.apply(term)); }
    @Override public boolean equals(Object o) { return o instanceof TheoryAtom && ((TheoryAtom) o).term.equals(term); }
    @Override public int hashCode() { return 41 + term.hashCode(); }
    @Override public String toString() { return "&" + term; }
  }

  //
  //  --------------------
  //  Statements
  //  --------------------
  //

  public static class Rule extends AST {
    public final AST head;
    public final List<AST> body;

    public Rule(Location location, AST head, List<? extends AST> body) {
      super(location);
      this.head = head;
      this.body = freeze(body);
    }

    @Override public ASTType type() { return ASTType.RULE; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return new Rule(location, fn.apply(head), mapAll(body, fn)); }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Rule)) return false;
      Rule other = (Rule) o;
      return head.equals(other.head) && body.equals(other.body);
    }

    @Override public int hashCode() { return 31 * head.hashCode() + body.hashCode(); }

    @Override
    public String toString() {
      if (body.isEmpty()) { return head + "."; }
      String prefix = head instanceof Literal && ((Literal) head).isFalse() ? ":- " : head + " :- ";
      return prefix + StringUtils.join(body, "; ") + ".";
    }
  }

  /** A weak constraint {@code :~ body. [weight@priority, t1, ..., tn]}. */
  public static class Minimize extends AST {
    public final AST weight;
    public final AST priority;
    public final List<AST> terms;
    public final List<AST> body;

    public Minimize(Location location, AST weight, AST priority, List<? extends AST> terms, List<? extends AST> body) {
      super(location);
      this.weight = weight;
      this.priority = priority;
      this.terms = freeze(terms);
      this.body = freeze(body);
    }

    @Override public ASTType type() { return ASTType.MINIMIZE; }

    @Override
    public AST mapChildren(UnaryOperator<AST> fn) {
      return new Minimize(location, fn.apply(weight), fn.apply(priority), mapAll(terms, fn), mapAll(body, fn));
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Minimize)) return false;
      Minimize other = (Minimize) o;
      return weight.equals(other.weight) && priority.equals(other.priority)
          && terms.equals(other.terms) && body.equals(other.body);
    }

    @Override public int hashCode() { return Objects.hash(weight, priority, terms, body); }

    @Override
    public String toString() {
      StringBuilder b = new StringBuilder(":~ ");
      b.append(StringUtils.join(body, "; ")).append(". [").append(weight).append('@').append(priority);
      for (AST term : terms) {
        b.append(", ").append(term);
      }
      return b.append(']').toString();
    }
  }

  /** An external declaration {@code #external atom : body.} */
  public static class External extends AST {
    public final AST atom;
    public final List<AST> body;

    public External(Location location, AST atom, List<? extends AST> body) {
      super(location);
      this.atom = atom;
      this.body = freeze(body);
    }

    @Override public ASTType type() { return ASTType.EXTERNAL; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return new External(location, fn.apply(atom), mapAll(body, fn)); }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof External)) return false;
      External other = (External) o;
      return atom.equals(other.atom) && body.equals(other.body);
    }

    @Override public int hashCode() { return 31 * atom.hashCode() + body.hashCode(); }

    @Override
    public String toString() {
      if (body.isEmpty()) { return "#external " + atom + "."; }
      return "#external " + atom + " : " + StringUtils.join(body, "; ") + ".";
    }
  }

  /** A {@code #show name/arity.} directive. */
  public static class ShowSignature extends AST {
    public final String name;
    public final int arity;
    public final boolean positive;

    public ShowSignature(Location location, String name, int arity, boolean positive) {
      super(location);
      this.name = name;
      this.arity = arity;
      this.positive = positive;
    }

    @Override public ASTType type() { return ASTType.SHOW_SIGNATURE; }
    @Override public AST mapChildren(UnaryOperator<AST> fn) { return this; }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof ShowSignature)) return false;
      ShowSignature other = (ShowSignature) o;
      return name.equals(other.name) && arity == other.arity && positive == other.positive;
    }

    @Override public int hashCode() { return Objects.hash(name, arity, positive); }
    @Override public String toString() { return "#show " + (positive ? "" : "-") + name + "/" + arity + "."; }
  }
}
