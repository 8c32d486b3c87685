package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.common.Props;

/**
 * The configuration of one translation session. Immutable.
 */
public class TranslationMode {
  /** Encode rules without a weight annotation as weak constraints at priority 1. */
  public final boolean translateHardRules;
  /** Encode weighted rules with an explicit unsat atom, rather than as a choice rule. */
  public final boolean useUnsatEncoding;
  /** Guard soft weak constraints with the atom ext_helper, for a second solving pass. */
  public final boolean twoSolveCalls;
  /** The power of ten every numeric weight is scaled by. */
  public final int weightScale;

  public TranslationMode(boolean translateHardRules, boolean useUnsatEncoding, boolean twoSolveCalls, int weightScale) {
    this.translateHardRules = translateHardRules;
    this.useUnsatEncoding = useUnsatEncoding;
    this.twoSolveCalls = twoSolveCalls;
    this.weightScale = weightScale;
  }

  /** A snapshot of the current options in {@link Props}. */
  public static TranslationMode fromProps() {
    return new TranslationMode(Props.TRANSLATE_HARD_RULES, Props.USE_UNSAT_ENCODING, Props.TWO_SOLVE_CALLS, Props.POWER_OF_TEN);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TranslationMode)) return false;
    TranslationMode other = (TranslationMode) o;
    return translateHardRules == other.translateHardRules && useUnsatEncoding == other.useUnsatEncoding
        && twoSolveCalls == other.twoSolveCalls && weightScale == other.weightScale;
  }

  @Override
  public int hashCode() {
    int result = translateHardRules ? 1 : 0;
    result = 31 * result + (useUnsatEncoding ? 1 : 0);
    result = 31 * result + (twoSolveCalls ? 1 : 0);
    result = 31 * result + weightScale;
    return result;
  }

  @Override
  public String toString() {
    return String.format("hr=%s unsat=%s two_solve_calls=%s power_of_ten=%d",
        translateHardRules, useUnsatEncoding, twoSolveCalls, weightScale);
  }
}
