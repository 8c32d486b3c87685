package edu.stanford.nlp.lpmln;

import edu.stanford.nlp.io.IOUtils;
import edu.stanford.nlp.io.RuntimeIOException;
import edu.stanford.nlp.lpmln.ast.AST;
import edu.stanford.nlp.lpmln.common.ConfigUtils;
import edu.stanford.nlp.lpmln.common.Props;
import edu.stanford.nlp.lpmln.io.LPMLNReader;
import edu.stanford.nlp.lpmln.io.PrintingProgramBuilder;
import edu.stanford.nlp.lpmln.translate.LPMLNTranslator;
import edu.stanford.nlp.lpmln.translate.PlogConverter;
import edu.stanford.nlp.lpmln.translate.TranslationException;
import edu.stanford.nlp.lpmln.translate.TranslationMode;
import edu.stanford.nlp.lpmln.translate.Weights;
import edu.stanford.nlp.util.ArgumentParser;
import edu.stanford.nlp.util.StringUtils;
import edu.stanford.nlp.util.logging.Redwood;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * The command line entry point: translates LP^MLN programs into ASP programs a solver such as clingo can run.
 *
 * <p>
 *   Usage, with options as in {@link Props}:
 *   <pre>
 *     LPMLN2ASP -input a.lp,b.lp -output out.lp -unsat -power_of_ten 0
 *     LPMLN2ASP options.conf
 *   </pre>
 *   With no input the program is read from standard input; with no output it is written to standard output.
 * </p>
 */
public class LPMLN2ASP {
  private static final Redwood.RedwoodChannels logger = Redwood.channels("Main");

  /**
   * The options given on the command line. A single argument naming a .conf, .json or .properties file
   * (on the file system or the classpath) is loaded as a Typesafe config; anything else is read as flags.
   */
  public static Properties parseArgs(String[] args) {
    if (args.length == 1 && ConfigUtils.isConfigFile(args[0])) {
      return ConfigUtils.toProperties(ConfigUtils.load(args[0]));
    }
    return StringUtils.argsToProperties(args);
  }

  /** Fill in and validate {@link Props} from the given options. */
  public static void initialize(Properties props) {
    ArgumentParser.fillOptions(new Class<?>[]{ Props.class }, props);
    Props.initializeAndValidate();
  }

  /**
   * Read a program from the input files in order, or from the given stream if there are none.
   * @throws TranslationException if an input is not a well-formed program.
   */
  public static List<AST> readProgram(List<File> inputs, InputStream stdin) {
    List<AST> program = new ArrayList<>();
    try {
      if (inputs.isEmpty()) {
        BufferedReader in = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        program.addAll(LPMLNReader.parse(in, "<stdin>"));
      }
      for (File input : inputs) {
        try (BufferedReader in = IOUtils.readerFromString(input.getPath())) {
          program.addAll(LPMLNReader.parse(in, input.getPath()));
        }
      }
    } catch (IOException e) {
      throw new RuntimeIOException(e);
    }
    return program;
  }

  /**
   * Translate a program with the options in {@link Props}, writing the result to the given writer.
   * @return The session which translated the program, for its statistics.
   */
  public static LPMLNTranslator translate(List<AST> program, Writer out) {
    LPMLNTranslator translator = new LPMLNTranslator(TranslationMode.fromProps(),
        PlogConverter.UNSUPPORTED, Weights.POWER_OF_TEN, Props.VERBOSE);
    PrintingProgramBuilder builder = new PrintingProgramBuilder(out);
    translator.translate(program, builder);
    builder.flush();
    return translator;
  }

  /**
   * Run the translator end to end.
   * @param args The command line arguments. @see LPMLN2ASP#parseArgs(String[])
   * @param stdin The stream to read a program from if no input is given.
   * @param stdout The stream to write the translation to if no output is given.
   */
  public static LPMLNTranslator exec(String[] args, InputStream stdin, OutputStream stdout) {
    initialize(parseArgs(args));
    List<AST> program = readProgram(Props.INPUT_FILES, stdin);
    if (Props.OUTPUT == null) {
      return translate(program, new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
    }
    try (Writer out = IOUtils.getPrintWriter(Props.OUTPUT)) {
      LPMLNTranslator translator = translate(program, out);
      logger.log("wrote " + translator.statementsEmitted() + " statements to " + Props.OUTPUT);
      return translator;
    } catch (IOException e) {
      throw new RuntimeIOException("Could not write " + Props.OUTPUT, e);
    }
  }

  public static void main(String[] args) {
    try {
      exec(args, System.in, System.out);
    } catch (TranslationException | IllegalArgumentException e) {
      logger.err(e.getMessage());
      System.exit(1);
    } catch (RuntimeIOException e) {
      logger.err(e);
      System.exit(2);
    }
  }
}
