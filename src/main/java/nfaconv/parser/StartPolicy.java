package nfaconv.parser;

/**
 * How many start designations a textual description may contain.
 *
 * Both policies require at least one.
 */
public enum StartPolicy {
  /**
   * Exactly one start state.
   */
  SINGLE,

  /**
   * One or more start states.
   */
  MULTIPLE
}
