package nfaconv;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Automata shared between tests.
 */
final class Fixtures {

  private Fixtures() { }

  /**
   * Thompson-style epsilon-NFA for {@code (a|b)*abb} (11 states, start
   * {@code "0"}, final {@code "10"}).
   */
  static Automaton abbSuffix() {
    final var enfa = new Automaton("eNFA");
    for (int i = 0; i < 11; i++) {
      enfa.addState(Integer.toString(i));
    }

    enfa.setStart("0");
    enfa.setFinalStates(Set.of("10"));
    enfa.setAlphabet(Set.of('a', 'b'));

    enfa.addTransition("0", "1", "ε");
    enfa.addTransition("0", "7", "ε");
    enfa.addTransition("1", "2", "ε");
    enfa.addTransition("1", "4", "ε");
    enfa.addTransition("2", "3", "a");
    enfa.addTransition("4", "5", "b");
    enfa.addTransition("3", "6", "ε");
    enfa.addTransition("5", "6", "ε");
    enfa.addTransition("6", "1", "ε");
    enfa.addTransition("6", "7", "ε");
    enfa.addTransition("7", "8", "a");
    enfa.addTransition("8", "9", "b");
    enfa.addTransition("9", "10", "b");
    return enfa;
  }

  /**
   * Epsilon-NFA with two start states ({@code q0} and {@code q3}) whose
   * epsilon transitions overlap on {@code q2}.
   */
  static Automaton twoStarts() {
    final var enfa = new Automaton("eNFA");
    for (int i = 0; i <= 6; i++) {
      enfa.addState("q" + i);
    }

    enfa.setStartStates(Set.of("q0", "q3"));
    enfa.setFinalStates(Set.of("q5", "q6"));
    enfa.setAlphabet(Set.of('a', 'b'));

    enfa.addTransition("q0", "q1", "ε");
    enfa.addTransition("q0", "q2", "ε");
    enfa.addTransition("q0", "q5", "ε");
    enfa.addTransition("q1", "q6", "b");
    enfa.addTransition("q2", "q2", "a");
    enfa.addTransition("q2", "q2", "b");
    enfa.addTransition("q2", "q5", "b");
    enfa.addTransition("q2", "q6", "b");
    enfa.addTransition("q3", "q2", "ε");
    enfa.addTransition("q3", "q4", "ε");
    enfa.addTransition("q4", "q6", "b");
    enfa.addTransition("q5", "q5", "b");
    enfa.addTransition("q6", "q6", "a");
    enfa.addTransition("q6", "q6", "b");
    return enfa;
  }

  /**
   * NFA (no epsilon transitions) over {@code {0,1}} accepting strings whose
   * third to last symbol is {@code 1}.
   */
  static Automaton thirdFromEnd() {
    final var nfa = new Automaton("nfa");
    for (String state : List.of("p0", "p1", "p2", "p3")) {
      nfa.addState(state);
    }

    nfa.setStart("p0");
    nfa.setFinalStates(Set.of("p3"));
    nfa.setAlphabet(Set.of('0', '1'));

    nfa.addTransition("p0", "p0", '0');
    nfa.addTransition("p0", "p0", '1');
    nfa.addTransition("p0", "p1", '1');
    nfa.addTransition("p1", "p2", '0');
    nfa.addTransition("p1", "p2", '1');
    nfa.addTransition("p2", "p3", '0');
    nfa.addTransition("p2", "p3", '1');
    return nfa;
  }

  /**
   * Epsilon-NFA with the epsilon cycle {@code q0 -> q1 -> q2 -> q0}, accepting
   * only {@code "a"}.
   */
  static Automaton epsilonCycle() {
    final var enfa = new Automaton("cycle");
    for (int i = 0; i <= 3; i++) {
      enfa.addState("q" + i);
    }

    enfa.setStart("q0");
    enfa.setFinalStates(Set.of("q3"));
    enfa.setAlphabet(Set.of('a'));

    enfa.addTransition("q0", "q1", Automaton.EPSILON);
    enfa.addTransition("q1", "q2", Automaton.EPSILON);
    enfa.addTransition("q2", "q0", Automaton.EPSILON);
    enfa.addTransition("q2", "q3", 'a');
    return enfa;
  }

  /**
   * Every string over the alphabet of an automaton up to some length.
   *
   * @param automaton automaton whose alphabet is used
   * @param maxLength longest string to generate
   * @return strings, shortest first
   */
  static List<String> allStrings(Automaton automaton, int maxLength) {
    final var strings = new ArrayList<String>();
    strings.add("");
    int from = 0;
    for (int length = 1; length <= maxLength; length++) {
      final int to = strings.size();
      for (int i = from; i < to; i++) {
        for (char symbol : automaton.alphabet()) {
          strings.add(strings.get(i) + symbol);
        }
      }
      from = to;
    }
    return strings;
  }
}
