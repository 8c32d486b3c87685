package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.io.LPMLNReader;
import edu.stanford.nlp.lpmln.io.ListProgramBuilder;
import edu.stanford.nlp.lpmln.io.PrintingProgramBuilder;
import org.junit.Test;

import java.io.StringWriter;

import static org.junit.Assert.*;

/**
 * Test translating whole programs.
 */
public class LPMLNTranslatorTest {

  private static String translate(TranslationMode mode, String program) {
    ListProgramBuilder builder = new ListProgramBuilder();
    new LPMLNTranslator(mode).translate(LPMLNReader.parse(program), builder);
    return builder.toString();
  }

  @Test
  public void testProgramOrder() {
    assertEquals(
        "bird(tweety).\n" +
        "{ fly(X) } :- bird(X); #true.\n" +
        ":~ not fly(X); bird(X); #true. [2@0, 0, (X,)]\n" +
        ":- fly(X); penguin(X).\n" +
        "{ swim(X) } :- penguin(X); #true.\n" +
        ":~ not swim(X); penguin(X); #true. [1@0, 2, (X,)]\n",
        translate(new TranslationMode(false, false, false, 0),
            "bird(tweety). 2 : fly(X) :- bird(X). :- fly(X), penguin(X). 1 : swim(X) :- penguin(X)."));
  }

  @Test
  public void testExtHelperDeclared() {
    String output = translate(new TranslationMode(false, false, true, 0), "2 : a :- b.");
    assertEquals(
        "#external ext_helper.\n" +
        "{ a } :- b; #true.\n" +
        ":~ ext_helper; not a; b; #true. [2@0, 0, ()]\n",
        output);
  }

  @Test
  public void testExtHelperNotDuplicated() {
    String output = translate(new TranslationMode(false, false, true, 0), "#external ext_helper. 2 : a :- b.");
    assertEquals(output.indexOf("#external ext_helper."), output.lastIndexOf("#external ext_helper."));
    assertTrue(output.startsWith("#external ext_helper.\n"));
  }

  @Test
  public void testNoExtHelperWithUnsatEncoding() {
    String output = translate(new TranslationMode(false, true, true, 0), "2 : a :- b.");
    assertFalse(output.contains("ext_helper"));
  }

  @Test
  public void testStatistics() {
    LPMLNTranslator translator = new LPMLNTranslator(new TranslationMode(false, false, false, 0));
    translator.translate(LPMLNReader.parse("a. 2 : b :- a. &evidence(b). :- c."), new ListProgramBuilder());
    assertEquals(4, translator.statementsRead());
    assertEquals(5, translator.statementsEmitted());
    assertEquals(1, translator.count(Translation.Outcome.ENCODED));
    assertEquals(1, translator.count(Translation.Outcome.EVIDENCE));
    assertEquals(2, translator.count(Translation.Outcome.UNCHANGED));
    assertEquals(0, translator.count(Translation.Outcome.PLOG));
    assertEquals(2, translator.ruleIndex());
    assertEquals("read 4 statements, wrote 5: 1 encoded, 1 evidence, 0 P-log, 2 unchanged", translator.summary());
  }

  @Test
  public void testStopsAtFirstError() {
    ListProgramBuilder builder = new ListProgramBuilder();
    LPMLNTranslator translator = new LPMLNTranslator(new TranslationMode(false, false, false, 0));
    try {
      translator.translate(LPMLNReader.parse("2 : a :- b. c :- &foo(1). d."), builder);
      fail("Expected an unsupported annotation");
    } catch (TranslationException e) {
      assertEquals(TranslationException.Kind.UNSUPPORTED_THEORY_ANNOTATION, e.kind);
    }
    assertEquals(2, builder.statements().size());
    assertEquals(2, translator.statementsRead());
  }

  @Test
  public void testPrintingBuilder() {
    StringWriter out = new StringWriter();
    PrintingProgramBuilder builder = new PrintingProgramBuilder(out);
    new LPMLNTranslator(new TranslationMode(false, false, false, 1)).translate(LPMLNReader.parse("0.25 : a :- b."), builder);
    builder.flush();
    assertEquals(2, builder.count());
    String[] lines = out.toString().split("\\R");
    assertEquals(2, lines.length);
    assertEquals(":~ not a; b; #true. [\"2.5\"@0, 0, ()]", lines[1]);
  }

  @Test
  public void testVerboseSession() {
    LPMLNTranslator translator = new LPMLNTranslator(new TranslationMode(false, true, false, 0),
        PlogConverter.UNSUPPORTED, Weights.POWER_OF_TEN, true);
    ListProgramBuilder builder = new ListProgramBuilder();
    translator.translate(LPMLNReader.parse("2 : a :- b. &evidence(a)."), builder);
    assertEquals(4, builder.statements().size());
  }
}
