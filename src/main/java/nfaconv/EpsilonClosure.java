package nfaconv;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Stack;

/**
 * Epsilon closures over the transitions of an automaton.
 *
 * The closure of a set of states is every state reachable from them using
 * zero or more epsilon transitions. The search is an explicit depth-first
 * traversal with a visited set, so it terminates on epsilon cycles and visits
 * every state and epsilon edge at most once per call.
 */
public final class EpsilonClosure {

  private final TransitionTable transitions;

  public EpsilonClosure(Automaton automaton) {
    this.transitions = automaton.transitions();
  }

  /**
   * Compute the epsilon closure of a single state.
   *
   * @param state starting state
   * @return the state plus everything reachable from it over epsilon transitions
   */
  public StateSet closure(String state) {
    return closure(List.of(state));
  }

  /**
   * Compute the epsilon closure of a set of states.
   *
   * @param states starting states (assumed to be registered)
   * @return the states plus everything reachable from them over epsilon transitions
   */
  public StateSet closure(Collection<String> states) {
    final var seenStates = new HashSet<String>();
    final var toVisit = new Stack<String>();

    // Seed the DFS with the starting states
    for (String state : states) {
      if (seenStates.add(state)) {
        toVisit.push(state);
      }
    }

    while (!toVisit.isEmpty()) {
      for (String to : transitions.destinations(toVisit.pop(), Automaton.EPSILON)) {
        if (seenStates.add(to)) {
          toVisit.push(to);
        }
      }
    }

    return new StateSet(seenStates);
  }
}
