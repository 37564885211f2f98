package nfaconv.parser;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import nfaconv.Automaton;
import nfaconv.InvalidSymbolException;
import nfaconv.graph.DotGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds automata out of DOT graphs.
 *
 * <ul>
 *   <li>every node is a state, drawn with {@code shape = circle} or
 *       {@code shape = doublecircle} (accepting)</li>
 *   <li>every edge is a transition whose {@code label} is one symbol or
 *       {@code ε}</li>
 *   <li>edges out of the node with the empty ID mark start states</li>
 * </ul>
 *
 * The alphabet is every symbol used on some transition except {@code ε}.
 */
public final class DotReader {

  private static final Logger LOG = LoggerFactory.getLogger(DotReader.class);

  private DotReader() { }

  /**
   * Read an automaton which has exactly one start state.
   *
   * @param text DOT source
   * @return automaton
   */
  public static Automaton read(String text) {
    return read(text, StartPolicy.SINGLE);
  }

  /**
   * Read an automaton.
   *
   * @param text DOT source
   * @param startPolicy how many start states are allowed
   * @return automaton
   * @throws InvalidAutomatonException if the graph is not a valid automaton
   * @throws InvalidSymbolException if some transition label is missing or is not a single symbol
   */
  public static Automaton read(String text, StartPolicy startPolicy) {
    final DotParser.Graph graph = DotParser.parse(text);
    final var automaton = new Automaton(graph.name());

    // States
    final var finalStates = new LinkedHashSet<String>();
    for (Map.Entry<String, Map<String, String>> node : graph.nodes().entrySet()) {
      final String state = node.getKey();
      if (state.equals(DotGraph.ANONYMOUS_ID)) {
        continue;
      }

      automaton.addState(state);
      final String shape = node.getValue().get("shape");
      if (shape == null) {
        throw new InvalidAutomatonException("State \"" + state + "\" has no shape attribute");
      } else if (shape.equals("doublecircle")) {
        finalStates.add(state);
      } else if (!shape.equals("circle")) {
        throw new InvalidAutomatonException("State \"" + state + "\" has invalid shape \"" + shape + "\"");
      }
    }
    automaton.setFinalStates(finalStates);

    // Transitions and start states
    final Set<Character> alphabet = new LinkedHashSet<>();
    final Set<String> startStates = new LinkedHashSet<>();
    for (DotParser.Edge edge : graph.edges()) {
      if (edge.from().equals(DotGraph.ANONYMOUS_ID)) {
        if (startPolicy == StartPolicy.SINGLE && !startStates.isEmpty()) {
          throw new InvalidAutomatonException("More than one start state is designated", edge.index());
        }
        startStates.add(edge.to());
        continue;
      }

      final char symbol = Automaton.symbolOf(edge.attributes().get("label"));
      if (symbol != Automaton.EPSILON) {
        alphabet.add(symbol);
      }
      automaton.addTransition(edge.from(), edge.to(), symbol);
    }

    if (startStates.isEmpty()) {
      throw new InvalidAutomatonException("No start state is designated");
    }
    if (finalStates.isEmpty()) {
      throw new InvalidAutomatonException("There must be at least one accepting state");
    }
    automaton.setStartStates(startStates);
    automaton.setAlphabet(alphabet);

    LOG.debug("read {} with {} states", automaton.name(), automaton.states().size());
    return automaton;
  }
}
