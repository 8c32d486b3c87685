package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.AST;
import edu.stanford.nlp.lpmln.ast.Location;
import edu.stanford.nlp.lpmln.io.ProgramBuilder;
import edu.stanford.nlp.util.logging.Redwood;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static edu.stanford.nlp.util.logging.Redwood.Util.*;

/**
 * A translation session: feeds the statements of an LP^MLN program through an {@link LPMLNTransformer},
 * in order, and hands the translated statements to a {@link ProgramBuilder}.
 */
public class LPMLNTranslator {
  private static final Redwood.RedwoodChannels logger = Redwood.channels("LPMLN");

  public final TranslationMode mode;
  private final LPMLNTransformer transformer;
  private final boolean verbose;

  private int statementsRead = 0;
  private int statementsEmitted = 0;
  private final Map<Translation.Outcome, Integer> outcomes = new EnumMap<>(Translation.Outcome.class);
  private boolean warnedNonIntegral = false;

  public LPMLNTranslator(TranslationMode mode, PlogConverter plog, WeightScaler scaler, boolean verbose) {
    this.mode = mode;
    this.transformer = new LPMLNTransformer(mode, plog, scaler);
    this.verbose = verbose;
    for (Translation.Outcome outcome : Translation.Outcome.values()) {
      outcomes.put(outcome, 0);
    }
  }

  public LPMLNTranslator(TranslationMode mode) {
    this(mode, PlogConverter.UNSUPPORTED, Weights.POWER_OF_TEN, false);
  }

  /**
   * Translate a program.
   *
   * @param program The statements of the program, in source order.
   * @param builder The sink to add the translated statements to.
   * @throws TranslationException at the first statement which cannot be translated.
   */
  public void translate(List<AST> program, ProgramBuilder builder) {
    startTrack("Translating " + program.size() + " statements (" + mode + ")");
    try {
      if (mode.twoSolveCalls && !mode.useUnsatEncoding && !declaresExtHelper(program)) {
        Location loc = program.isEmpty() ? Location.UNKNOWN : program.get(0).location;
        emit(builder, new AST.External(loc, PenaltyEncoder.extHelperAtom(loc), Collections.<AST>emptyList()));
      }
      for (AST statement : program) {
        statementsRead += 1;
        Translation translation = transformer.translate(statement);
        outcomes.put(translation.outcome, outcomes.get(translation.outcome) + 1);
        if (verbose && translation.outcome != Translation.Outcome.UNCHANGED) {
          logger.log(statement + "  -->  " + translation.statements());
        }
        for (AST rule : translation.prefix) {
          emit(builder, rule);
        }
        emit(builder, translation.statement);
      }
    } finally {
      endTrack("Translating " + program.size() + " statements (" + mode + ")");
    }
    log(summary());
  }

  private void emit(ProgramBuilder builder, AST statement) {
    if (!warnedNonIntegral && statement instanceof AST.Minimize) {
      AST weight = ((AST.Minimize) statement).weight;
      if (weight instanceof AST.SymbolicTerm && ((AST.SymbolicTerm) weight).symbol.isString()) {
        warn("weight " + weight + " is not an integer; solvers expect integral weights (raise power_of_ten)");
        warnedNonIntegral = true;
      }
    }
    builder.add(statement);
    statementsEmitted += 1;
  }

  /** True if the program declares {@code #external ext_helper.} itself. */
  private static boolean declaresExtHelper(List<AST> program) {
    AST helper = PenaltyEncoder.extHelperAtom(Location.UNKNOWN);
    for (AST statement : program) {
      if (statement instanceof AST.External && ((AST.External) statement).atom.equals(helper)) {
        return true;
      }
    }
    return false;
  }

  /** The index the next encoded rule will take, which is the number of rules indexed so far. */
  public int ruleIndex() {
    return transformer.ruleIndex();
  }

  public int statementsRead() { return statementsRead; }

  public int statementsEmitted() { return statementsEmitted; }

  public int count(Translation.Outcome outcome) { return outcomes.get(outcome); }

  public String summary() {
    return String.format("read %d statements, wrote %d: %d encoded, %d evidence, %d P-log, %d unchanged",
        statementsRead, statementsEmitted,
        outcomes.get(Translation.Outcome.ENCODED), outcomes.get(Translation.Outcome.EVIDENCE),
        outcomes.get(Translation.Outcome.PLOG), outcomes.get(Translation.Outcome.UNCHANGED));
  }
}
