package edu.stanford.nlp.lpmln.common;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.Arrays;
import java.util.Map;

import static org.junit.Assert.*;

public class PropsTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @After
  public void resetProps() {
    Props.reset();
  }

  @Test
  public void testDefaultOptions() {
    assertEquals("5", Props.defaultOptions.get("power_of_ten"));
    assertEquals("false", Props.defaultOptions.get("hr"));
    assertEquals("false", Props.defaultOptions.get("unsat"));
    assertEquals("false", Props.defaultOptions.get("two_solve_calls"));
    assertNull(Props.defaultOptions.get("input"));
    assertTrue(Props.defaultOptions.containsKey("output"));
  }

  @Test
  public void testAsMapFollowsFields() {
    Props.USE_UNSAT_ENCODING = true;
    Map<String, String> options = Props.asMap();
    assertEquals("true", options.get("unsat"));
    assertEquals("false", Props.defaultOptions.get("unsat"));
  }

  @Test
  public void testInputFiles() throws Exception {
    File a = folder.newFile("a.lp");
    File b = folder.newFile("b.lp");
    Props.INPUT = a.getPath() + ", " + b.getPath();
    Props.initializeAndValidate();
    assertEquals(Arrays.asList(a, b), Props.INPUT_FILES);
  }

  @Test
  public void testNoInputFiles() {
    Props.initializeAndValidate();
    assertTrue(Props.INPUT_FILES.isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingInputFile() {
    Props.INPUT = new File(folder.getRoot(), "missing.lp").getPath();
    Props.initializeAndValidate();
  }

  @Test
  public void testPowerOfTenRange() {
    Props.POWER_OF_TEN = -9;
    Props.initializeAndValidate();
    Props.POWER_OF_TEN = 9;
    Props.initializeAndValidate();
    for (int outOfRange : new int[]{ -10, 10, 308 }) {
      Props.POWER_OF_TEN = outOfRange;
      try {
        Props.initializeAndValidate();
        fail("Accepted power_of_ten " + outOfRange);
      } catch (IllegalArgumentException e) {
        assertTrue(e.getMessage().contains("power_of_ten"));
      }
    }
  }

  @Test
  public void testReset() {
    Props.TRANSLATE_HARD_RULES = true;
    Props.POWER_OF_TEN = 0;
    Props.OUTPUT = "out.lp";
    Props.reset();
    assertEquals(Props.defaultOptions, Props.asMap());
  }
}
