package edu.stanford.nlp.lpmln;

import edu.stanford.nlp.io.IOUtils;
import edu.stanford.nlp.lpmln.common.Props;
import edu.stanford.nlp.lpmln.translate.LPMLNTranslator;
import edu.stanford.nlp.lpmln.translate.Translation;
import edu.stanford.nlp.lpmln.translate.TranslationException;
import edu.stanford.nlp.util.StringUtils;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Run the translator end to end, from arguments to printed program.
 */
public class LPMLN2ASPTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @After
  public void resetProps() {
    Props.reset();
  }

  private static String resource(String name) throws Exception {
    return new File(LPMLN2ASPTest.class.getResource("/edu/stanford/nlp/lpmln/" + name).toURI()).getPath();
  }

  private static InputStream stdin(String program) {
    return new ByteArrayInputStream(program.getBytes(StandardCharsets.UTF_8));
  }

  private static List<String> run(InputStream stdin, String... args) {
    ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    LPMLN2ASP.exec(args, stdin, stdout);
    return Arrays.asList(new String(stdout.toByteArray(), StandardCharsets.UTF_8).split("\\R"));
  }

  @Test
  public void testInputFile() throws Exception {
    assertEquals(Arrays.asList(
        "bird(X) :- penguin(X).",
        "bird(tweety).",
        "penguin(jo).",
        "{ fly(X) } :- bird(X); #true.",
        ":~ not fly(X); bird(X); #true. [2@0, 1, (X,)]",
        ":- fly(X); penguin(X).",
        "&query(fly(X)) :- bird(X)."),
        run(stdin(""), "-input", resource("birds.lp"), "-power_of_ten", "0"));
  }

  @Test
  public void testMultipleInputFiles() throws Exception {
    List<String> output = run(stdin(""), "-input", resource("evidence.lp") + "," + resource("birds.lp"), "-hr");
    assertEquals(":- not fly(tweety).", output.get(0));
    assertEquals(":- fly(jo).", output.get(1));
    assertTrue(output.contains(":~ not bird(X); penguin(X). [1@1, 0, (X,)]"));
    assertTrue(output.contains(":~ not fly(X); bird(X); #true. [200000@0, 1, (X,)]"));
  }

  @Test
  public void testStandardInput() {
    assertEquals(Arrays.asList(
        "unsat(0,2,()) :- not a; b; #true.",
        "a :- not unsat(0,2,()); b; #true.",
        ":~ unsat(0,2,()). [2@0, 0, ()]"),
        run(stdin("2 : a :- b."), "-power_of_ten", "0", "-unsat"));
  }

  @Test
  public void testTwoSolveCalls() {
    assertEquals(Arrays.asList(
        "#external ext_helper.",
        "{ a } :- b; #true.",
        ":~ ext_helper; not a; b; #true. [2@0, 0, ()]"),
        run(stdin("2 : a :- b."), "-power_of_ten", "0", "-two_solve_calls"));
  }

  @Test
  public void testConfigFile() throws Exception {
    assertEquals(Arrays.asList(
        "unsat(0,2,()) :- not a; b; #true.",
        "a :- not unsat(0,2,()); b; #true.",
        ":~ unsat(0,2,()). [2@0, 0, ()]"),
        run(stdin("2 : a :- b."), resource("unsat.conf")));
    assertTrue(Props.USE_UNSAT_ENCODING);
    assertEquals(0, Props.POWER_OF_TEN);
  }

  @Test
  public void testDefaultConfigOnClasspath() {
    assertEquals(Arrays.asList(
        "{ a } :- b; #true.",
        ":~ not a; b; #true. [200000@0, 0, ()]"),
        run(stdin("2 : a :- b."), "edu/stanford/nlp/lpmln/lpmln2asp.conf"));
  }

  @Test
  public void testOutputFile() throws Exception {
    File out = new File(folder.getRoot(), "out.lp");
    ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    LPMLNTranslator translator = LPMLN2ASP.exec(
        new String[]{ "-input", resource("evidence.lp"), "-output", out.getPath() }, stdin(""), stdout);
    assertEquals(0, stdout.size());
    assertEquals(2, translator.count(Translation.Outcome.EVIDENCE));
    assertEquals(Arrays.asList(":- not fly(tweety).", ":- fly(jo)."), IOUtils.linesFromFile(out.getPath()));
  }

  @Test
  public void testParseArgs() {
    assertEquals("true", LPMLN2ASP.parseArgs(new String[]{ "-hr" }).getProperty("hr"));
    assertEquals("3", LPMLN2ASP.parseArgs(new String[]{ "-power_of_ten", "3", "-unsat" }).getProperty("power_of_ten"));
    LPMLN2ASP.initialize(StringUtils.argsToProperties(new String[]{ "-unsat", "-power_of_ten", "2" }));
    assertTrue(Props.USE_UNSAT_ENCODING);
    assertFalse(Props.TRANSLATE_HARD_RULES);
    assertEquals(2, Props.POWER_OF_TEN);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidPowerOfTen() {
    run(stdin("a."), "-power_of_ten", "12");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingInput() {
    run(stdin(""), "-input", new File(folder.getRoot(), "missing.lp").getPath());
  }

  @Test
  public void testSyntaxErrorOnStandardInput() {
    try {
      run(stdin("a :- b.\nc :- ."), "-power_of_ten", "0");
      fail("Expected a syntax error");
    } catch (TranslationException e) {
      assertEquals(TranslationException.Kind.SYNTAX_ERROR, e.kind);
      assertEquals("<stdin>", e.location.filename);
      assertEquals(2, e.location.line);
    }
  }
}
