package edu.stanford.nlp.lpmln.ast;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Test that nodes print as gringo input, and compare structurally.
 */
public class ASTTest {
  private static final Location loc = Location.UNKNOWN;

  private static AST.Variable var(String name) { return new AST.Variable(loc, name); }

  private static AST.Function fn(String name, AST... args) { return new AST.Function(loc, name, Arrays.asList(args)); }

  private static AST.Literal lit(Sign sign, String name, AST... args) {
    return new AST.Literal(loc, sign, new AST.SymbolicAtom(loc, fn(name, args)));
  }

  private static AST num(long n) { return new AST.SymbolicTerm(loc, Symbol.number(n)); }

  @Test
  public void testTuples() {
    assertEquals("()", fn("").toString());
    assertEquals("(X,)", fn("", var("X")).toString());
    assertEquals("(X,Y)", fn("", var("X"), var("Y")).toString());
    assertTrue(fn("").isTuple());
    assertFalse(fn("a").isTuple());
  }

  @Test
  public void testTerms() {
    assertEquals("p", fn("p").toString());
    assertEquals("p(X,1,\"s\")", fn("p", var("X"), num(1), new AST.SymbolicTerm(loc, Symbol.string("s"))).toString());
    assertEquals("-X", new AST.UnaryOperation(loc, var("X")).toString());
    assertEquals("(X+(2*Y))", new AST.BinaryOperation(loc, AST.BinaryOperation.Operator.PLUS, var("X"),
        new AST.BinaryOperation(loc, AST.BinaryOperation.Operator.TIMES, num(2), var("Y"))).toString());
  }

  @Test
  public void testStringEscapes() {
    assertEquals("\"a\\\"b\\\\c\\n\"", Symbol.string("a\"b\\c\n").toString());
    assertEquals("-4", Symbol.number(-4).toString());
  }

  @Test(expected = IllegalStateException.class)
  public void testSymbolKind() {
    Symbol.string("1").getNumber();
  }

  @Test
  public void testLiterals() {
    assertEquals("a(X)", lit(Sign.NO_SIGN, "a", var("X")).toString());
    assertEquals("not a", lit(Sign.NEGATION, "a").toString());
    assertEquals("not not a", lit(Sign.DOUBLE_NEGATION, "a").toString());
    assertEquals("X!=1", new AST.Comparison(loc, ComparisonOperator.NOT_EQUAL, var("X"), num(1)).toString());
    assertTrue(new AST.Literal(loc, Sign.NO_SIGN, new AST.BooleanConstant(loc, false)).isFalse());
    assertFalse(new AST.Literal(loc, Sign.NEGATION, new AST.BooleanConstant(loc, false)).isFalse());
    assertEquals("&weight(2)", new AST.TheoryAtom(loc, fn("weight", num(2))).toString());
  }

  @Test
  public void testAggregates() {
    AST a = new AST.ConditionalLiteral(loc, lit(Sign.NO_SIGN, "a", var("X")), Collections.singletonList(lit(Sign.NO_SIGN, "d", var("X"))));
    AST b = new AST.ConditionalLiteral(loc, lit(Sign.NO_SIGN, "b"), Collections.<AST>emptyList());
    AST.Aggregate unguarded = new AST.Aggregate(loc, null, Arrays.asList(a, b), null);
    assertEquals("{ a(X): d(X); b }", unguarded.toString());
    assertFalse(unguarded.isGuarded());
    AST.Aggregate guarded = new AST.Aggregate(loc,
        new AST.Guard(loc, ComparisonOperator.LESS_EQUAL, num(1)), Arrays.asList(a, b),
        new AST.Guard(loc, ComparisonOperator.LESS_EQUAL, num(2)));
    assertEquals("1 <= { a(X): d(X); b } <= 2", guarded.toString());
    assertTrue(guarded.isGuarded());
    assertEquals("{ }", new AST.Aggregate(loc, null, Collections.<AST>emptyList(), null).toString());
  }

  @Test
  public void testStatements() {
    assertEquals("a.", new AST.Rule(loc, lit(Sign.NO_SIGN, "a"), Collections.<AST>emptyList()).toString());
    assertEquals("a :- b; not c.", new AST.Rule(loc, lit(Sign.NO_SIGN, "a"),
        Arrays.asList(lit(Sign.NO_SIGN, "b"), lit(Sign.NEGATION, "c"))).toString());
    assertEquals(":- b.", new AST.Rule(loc, new AST.Literal(loc, Sign.NO_SIGN, new AST.BooleanConstant(loc, false)),
        Collections.singletonList(lit(Sign.NO_SIGN, "b"))).toString());
    assertEquals(":~ b. [2@0, 1, (X,)]", new AST.Minimize(loc, num(2), num(0), Arrays.asList(num(1), fn("", var("X"))),
        Collections.singletonList(lit(Sign.NO_SIGN, "b"))).toString());
    assertEquals("#external e : b.", new AST.External(loc, new AST.SymbolicAtom(loc, fn("e")),
        Collections.singletonList(lit(Sign.NO_SIGN, "b"))).toString());
    assertEquals("#show -p/2.", new AST.ShowSignature(loc, "p", 2, false).toString());
  }

  @Test
  public void testEqualityIgnoresLocation() {
    Location elsewhere = new Location("prog.lp", 3, 7);
    AST here = lit(Sign.NO_SIGN, "a", var("X"));
    AST there = new AST.Literal(elsewhere, Sign.NO_SIGN, new AST.SymbolicAtom(elsewhere,
        new AST.Function(elsewhere, "a", Collections.singletonList(new AST.Variable(elsewhere, "X")))));
    assertEquals(here, there);
    assertEquals(here.hashCode(), there.hashCode());
    assertNotEquals(here, lit(Sign.NEGATION, "a", var("X")));
    assertEquals("prog.lp:3:7", elsewhere.toString());
  }

  @Test
  public void testMapChildren() {
    AST rule = new AST.Rule(loc, lit(Sign.NO_SIGN, "a"), Collections.singletonList(lit(Sign.NO_SIGN, "b")));
    AST mapped = rule.mapChildren(child -> child instanceof AST.Literal
        ? new AST.Literal(child.location, Sign.NEGATION, ((AST.Literal) child).atom) : child);
    assertEquals("not a :- not b.", mapped.toString());
    assertEquals(ASTType.RULE, mapped.type());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLocationRequired() {
    new AST.Variable(null, "X");
  }

  @Test
  public void testComparisonOperators() {
    assertEquals(ComparisonOperator.EQUAL, ComparisonOperator.fromSymbol("==").get());
    assertEquals(ComparisonOperator.GREATER_EQUAL, ComparisonOperator.fromSymbol(">=").get());
    assertFalse(ComparisonOperator.fromSymbol("=>").isPresent());
  }
}
