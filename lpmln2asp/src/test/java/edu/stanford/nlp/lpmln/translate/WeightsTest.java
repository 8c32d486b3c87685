package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.AST;
import edu.stanford.nlp.lpmln.ast.Location;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Test the weight formulas, scaling, and the numeric literal grammar.
 */
public class WeightsTest {

  @Test
  public void testNumericLiterals() {
    assertEquals(0.5, Weights.parseNumericLiteral("0.5"), 1e-10);
    assertEquals(-2.0, Weights.parseNumericLiteral("-2"), 1e-10);
    assertEquals(0.25, Weights.parseNumericLiteral(".25"), 1e-10);
    assertEquals(3.0, Weights.parseNumericLiteral("+3."), 1e-10);
    assertEquals(1e-3, Weights.parseNumericLiteral("1e-3"), 1e-15);
    assertEquals(1.5e2, Weights.parseNumericLiteral(" 1.5E+2 "), 1e-10);
  }

  @Test
  public void testNotNumericLiterals() {
    for (String text : new String[]{ "", "abc", "1/2", "0x10", "NaN", "Infinity", "1e", "--1", "1.2.3", "2*3" }) {
      try {
        Weights.parseNumericLiteral(text);
        fail("Parsed '" + text + "'");
      } catch (NumberFormatException e) {
        assertTrue(e.getMessage().contains("Not a numeric literal"));
      }
    }
  }

  @Test
  public void testLog() {
    assertEquals(-0.6931, Weights.log(0.5), 1e-4);
    assertEquals(0.0, Weights.log(1.0), 1e-10);
  }

  @Test(expected = ArithmeticException.class)
  public void testLogOfZero() {
    Weights.log(0.0);
  }

  @Test(expected = ArithmeticException.class)
  public void testLogOfNegative() {
    Weights.log(-1.0);
  }

  @Test
  public void testProblog() {
    assertEquals(1.0986, Weights.problog(0.75), 1e-4);
    assertEquals(0.0, Weights.problog(0.5), 1e-10);
    assertEquals(-1.0986, Weights.problog(0.25), 1e-4);
  }

  @Test(expected = ArithmeticException.class)
  public void testProblogOfOne() {
    Weights.problog(1.0);
  }

  @Test(expected = ArithmeticException.class)
  public void testProblogOfZero() {
    Weights.problog(0.0);
  }

  @Test
  public void testScaling() {
    assertEquals(Weight.of(200000), Weights.calculate(2, 5));
    assertEquals(Weight.of(2), Weights.calculate(2, 0));
    assertEquals(0.02, Weights.calculate(2, -2).value, 1e-12);
    assertEquals(Weight.of(5), Weights.POWER_OF_TEN.scale(0.5, 1));
  }

  @Test(expected = ArithmeticException.class)
  public void testScalingOverflow() {
    Weights.calculate(Double.MAX_VALUE, 9);
  }

  @Test
  public void testWeightTerms() {
    Location loc = Location.UNKNOWN;
    assertEquals("\"alpha\"", Weight.ALPHA.toTerm(loc).toString());
    assertTrue(Weight.ALPHA.isAlpha());
    assertFalse(Weight.ALPHA.isIntegral());
    assertEquals("3", Weight.of(3.0).toTerm(loc).toString());
    assertEquals("-7", Weight.of(-7.0).toTerm(loc).toString());
    AST fractional = Weight.of(0.5).toTerm(loc);
    assertTrue(((AST.SymbolicTerm) fractional).symbol.isString());
    assertEquals("\"0.5\"", fractional.toString());
    assertFalse(Weight.of(0.5).isIntegral());
  }
}
