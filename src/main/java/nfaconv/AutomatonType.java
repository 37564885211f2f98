package nfaconv;

/**
 * Kind of a finite automaton, derived from its transition relation.
 *
 * The kinds are ordered from most to least restrictive: every DFA is also an
 * NFA and every NFA is also an epsilon-NFA.
 */
public enum AutomatonType {
  /**
   * Deterministic finite automaton.
   *
   * Every {@code (state, symbol)} pair has at most one destination and there
   * are no epsilon transitions.
   */
  DFA,

  /**
   * Non-deterministic finite automaton.
   *
   * Some {@code (state, symbol)} pair has two or more destinations, but there
   * are no epsilon transitions.
   */
  NFA,

  /**
   * Non-deterministic finite automaton with epsilon transitions.
   */
  EPSILON_NFA;

  /**
   * Classify a transition relation.
   *
   * @param table transitions to classify
   * @return the most restrictive kind describing the transitions
   */
  public static AutomatonType of(TransitionTable table) {
    if (table.hasEpsilon()) {
      return EPSILON_NFA;
    } else if (table.isDeterministic()) {
      return DFA;
    } else {
      return NFA;
    }
  }
}
