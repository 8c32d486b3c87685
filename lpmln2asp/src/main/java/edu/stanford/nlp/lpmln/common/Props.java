package edu.stanford.nlp.lpmln.common;

import edu.stanford.nlp.util.ArgumentParser.Option;

import java.io.File;
import java.lang.reflect.Field;
import java.util.*;

import static edu.stanford.nlp.util.logging.Redwood.Util.*;

/**
 * The options of the translator, filled in from the command line or a config file
 * by {@link edu.stanford.nlp.util.ArgumentParser}.
 */
public class Props {

  //
  // TRANSLATION
  //
  @Option(name="hr", gloss="If true, translate hard rules into weak constraints at priority 1")
  public static boolean TRANSLATE_HARD_RULES = false;
  @Option(name="unsat", gloss="If true, use the unsat-atom encoding rather than the compact one")
  public static boolean USE_UNSAT_ENCODING = false;
  @Option(name="two_solve_calls", gloss="If true, guard soft weak constraints with the external atom ext_helper")
  public static boolean TWO_SOLVE_CALLS = false;
  @Option(name="power_of_ten", gloss="Weights are multiplied by 10 to this power before use")
  public static int POWER_OF_TEN = 5;

  //
  // IO
  //
  @Option(name="input", gloss="A comma-separated list of LP^MLN files to translate; standard input if not given")
  public static String INPUT = null;
  @Option(name="output", gloss="The file to write the translated program to; standard output if not given")
  public static String OUTPUT = null;
  @Option(name="verbose", gloss="If true, log every translated rule")
  public static boolean VERBOSE = false;

  /** The input files; constructed on initialization */
  public static List<File> INPUT_FILES = Collections.emptyList();

  /** The largest scaling exponent in either direction. */
  public static final int MAX_POWER_OF_TEN = 9;

  public static void initializeAndValidate() {
    if (POWER_OF_TEN < -MAX_POWER_OF_TEN || POWER_OF_TEN > MAX_POWER_OF_TEN) {
      throw new IllegalArgumentException("power_of_ten must be between " + (-MAX_POWER_OF_TEN) + " and " + MAX_POWER_OF_TEN + ": " + POWER_OF_TEN);
    }
    List<File> files = new ArrayList<>();
    if (INPUT != null && !INPUT.trim().isEmpty()) {
      for (String path : INPUT.split(",")) {
        File file = new File(path.trim());
        if (!file.exists()) { throw new IllegalArgumentException("No such input file: " + file); }
        files.add(file);
      }
    }
    INPUT_FILES = Collections.unmodifiableList(files);
    if (USE_UNSAT_ENCODING && TWO_SOLVE_CALLS) {
      warn("two_solve_calls has no effect with the unsat encoding");
    }
  }

  /**
   * The default options declared in this class, before they have been overwritten by {@link edu.stanford.nlp.util.ArgumentParser}.
   */
  public static final Map<String, String> defaultOptions = Collections.unmodifiableMap(asMap());

  /**
   * Get all the options in this class as a map from the option name (as per the {@link Option} annotation),
   * to the {@link Object#toString()} of its current value.
   */
  public static Map<String, String> asMap() {
    Map<String, String> map = new TreeMap<>();
    for (Field field : Props.class.getFields()) {
      Option o = field.getAnnotation(Option.class);
      if (o != null) {
        try {
          Object value = field.get(null);
          map.put(o.name(), value == null ? null : value.toString());
        } catch (IllegalAccessException e) {
          warn("could not read field: " + field);
        }
      }
    }
    return map;
  }

  /** Reset every option to its default; tests change these globals. */
  public static void reset() {
    TRANSLATE_HARD_RULES = false;
    USE_UNSAT_ENCODING = false;
    TWO_SOLVE_CALLS = false;
    POWER_OF_TEN = 5;
    INPUT = null;
    OUTPUT = null;
    VERBOSE = false;
    INPUT_FILES = Collections.emptyList();
  }
}
