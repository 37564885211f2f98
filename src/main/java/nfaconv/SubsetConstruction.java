package nfaconv;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion of any finite automaton into an equivalent DFA using the subset
 * (powerset) construction.
 *
 * Each state of the output stands for the set of source states the source
 * automaton could be in at the same point of the input. Only sets reachable
 * from the epsilon closure of the start states are generated. The source
 * automaton is never modified.
 */
public final class SubsetConstruction {

  private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);

  /**
   * Output of the subset construction.
   *
   * @param dfa deterministic automaton accepting the same language as the source
   * @param subsets mapping from every state of {@code dfa} to the source states
   *                it stands for (in the order the states were generated)
   */
  public record Determinization(Automaton dfa, Map<String, StateSet> subsets) {

    /**
     * Look up the source states behind a state of the DFA.
     *
     * @param state state of the DFA
     * @return source states
     * @throws UnknownStateException if the state is not part of the DFA
     */
    public StateSet subsetOf(String state) {
      final StateSet subset = subsets.get(state);
      if (subset == null) {
        throw new UnknownStateException(state);
      }
      return subset;
    }
  }

  private SubsetConstruction() { }

  /**
   * Construct a DFA equivalent to the input automaton.
   *
   * @param source automaton of any kind
   * @return fresh deterministic automaton
   */
  public static Automaton convert(Automaton source) {
    return determinize(source).dfa();
  }

  /**
   * Construct a DFA equivalent to the input automaton, keeping track of which
   * source states each generated state stands for.
   *
   * Generated states are labelled {@code "0"}, {@code "1"}, ... in breadth-first
   * order of discovery, with symbols explored in ascending order, so the same
   * input always produces the same labels. {@code "0"} is the start state.
   *
   * The output alphabet only contains symbols that label at least one
   * transition of the output. If no start state is set, the output has no
   * states at all (and accepts nothing).
   *
   * @param source automaton of any kind
   * @return fresh deterministic automaton and its subset mapping
   */
  public static Determinization determinize(Automaton source) {
    final var closure = new EpsilonClosure(source);
    final var dfa = new Automaton(source.name() + "_dfa");
    final Set<Character> symbols = new TreeSet<>(source.alphabet());

    // Identity of generated states is the set of source states
    final var labels = new HashMap<StateSet, String>();
    final var subsets = new LinkedHashMap<String, StateSet>();
    final var toVisit = new LinkedList<StateSet>();
    final var usedSymbols = new TreeSet<Character>();

    final StateSet initial = closure.closure(source.startStates());
    if (initial.isEmpty()) {
      LOG.debug("{} has no start state, the DFA is empty", source.name());
      return new Determinization(dfa, Collections.emptyMap());
    }

    labels.put(initial, "0");
    subsets.put("0", initial);
    dfa.addState("0");
    toVisit.addLast(initial);

    while (!toVisit.isEmpty()) {
      final StateSet subset = toVisit.removeFirst();
      final String from = labels.get(subset);

      for (char symbol : symbols) {
        final StateSet target = closure.closure(source.successors(subset.toSet(), symbol));
        if (target.isEmpty()) {
          continue;
        }

        String to = labels.get(target);
        if (to == null) {
          to = Integer.toString(labels.size());
          labels.put(target, to);
          subsets.put(to, target);
          dfa.addState(to);
          toVisit.addLast(target);
          LOG.debug("new DFA state {} = {}", to, target);
        }

        dfa.addTransition(from, to, symbol);
        usedSymbols.add(symbol);
      }
    }

    final Set<String> finalStates = subsets
      .entrySet()
      .stream()
      .filter(entry -> entry.getValue().intersects(source.finalStates()))
      .map(Map.Entry::getKey)
      .collect(Collectors.toCollection(LinkedHashSet::new));

    dfa.setStart("0");
    dfa.setFinalStates(finalStates);
    dfa.setAlphabet(usedSymbols);

    LOG.debug(
      "converted {} {} ({} states) into a DFA with {} states",
      source.classify(),
      source.name(),
      source.states().size(),
      subsets.size()
    );
    return new Determinization(dfa, Collections.unmodifiableMap(subsets));
  }
}
