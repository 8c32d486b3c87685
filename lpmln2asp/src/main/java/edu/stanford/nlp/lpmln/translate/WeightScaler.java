package edu.stanford.nlp.lpmln.translate;

/**
 * The scaling policy applied to every numeric weight before it is used in a weak constraint.
 */
public interface WeightScaler {

  /**
   * @param raw The weight as computed from its annotation.
   * @param powerOfTen The scaling exponent of the translation session.
   * @return The weight to use in the translated program.
   * @throws ArithmeticException if the result is not a finite number.
   */
  Weight scale(double raw, int powerOfTen);
}
