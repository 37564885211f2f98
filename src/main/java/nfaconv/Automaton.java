package nfaconv;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import nfaconv.graph.DotGraph;

/**
 * Finite automaton (DFA, NFA or epsilon-NFA).
 *
 * States are opaque string identifiers which must be registered with
 * {@link #addState} before they can show up anywhere else. Symbols are single
 * characters; {@link #EPSILON} marks the empty-string transitions and is never
 * part of the alphabet.
 *
 * The automaton is built incrementally. Once handed off to a
 * {@link SubsetConstruction} it is only read. All collections returned from
 * accessors are unmodifiable.
 */
public final class Automaton implements DotGraph<String, Character> {

  /**
   * Marker for epsilon (empty string) transitions.
   */
  public static final char EPSILON = 'ε';

  private final String name;
  private final Set<String> states = new LinkedHashSet<>();
  private final Set<Character> alphabet = new LinkedHashSet<>();
  private final Set<String> startStates = new LinkedHashSet<>();
  private final Set<String> finalStates = new LinkedHashSet<>();
  private final TransitionTable transitions = new TransitionTable();

  /**
   * @param name name of the automaton (used as the graph name when rendered)
   */
  public Automaton(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  /**
   * Register a new state.
   *
   * @param state identifier of the state
   * @throws DuplicateStateException if the state is already registered
   */
  public void addState(String state) {
    Objects.requireNonNull(state, "state");
    if (!states.add(state)) {
      throw new DuplicateStateException(state);
    }
  }

  /**
   * Add a transition labelled with a symbol written out as text.
   *
   * @param from registered starting state
   * @param to registered destination state
   * @param label single character label, or {@code "ε"} for an epsilon transition
   * @throws UnknownStateException if either state is not registered
   * @throws InvalidSymbolException if the label is not exactly one character
   */
  public void addTransition(String from, String to, String label) {
    addTransition(from, to, symbolOf(label));
  }

  /**
   * Add a transition. Adding the same transition twice has no further effect.
   *
   * @param from registered starting state
   * @param to registered destination state
   * @param symbol symbol on the transition, or {@link #EPSILON}
   * @throws UnknownStateException if either state is not registered
   */
  public void addTransition(String from, String to, char symbol) {
    requireRegistered(from);
    requireRegistered(to);
    transitions.add(from, symbol, to);
  }

  /**
   * Set a single start state (replacing any previous ones).
   *
   * @param state registered state
   * @throws UnknownStateException if the state is not registered
   */
  public void setStart(String state) {
    setStartStates(Set.of(state));
  }

  /**
   * Set the start states (replacing any previous ones).
   *
   * @param states registered states
   * @throws UnknownStateException if any of the states is not registered
   */
  public void setStartStates(Collection<String> states) {
    states.forEach(this::requireRegistered);
    startStates.clear();
    startStates.addAll(states);
  }

  /**
   * Set the accepting states (replacing any previous ones).
   *
   * @param states registered states
   * @throws UnknownStateException if any of the states is not registered
   */
  public void setFinalStates(Collection<String> states) {
    states.forEach(this::requireRegistered);
    finalStates.clear();
    finalStates.addAll(states);
  }

  /**
   * Replace the alphabet.
   *
   * The symbols are not checked against the existing transitions.
   *
   * @param symbols new alphabet
   * @throws InvalidSymbolException if the alphabet contains {@link #EPSILON}
   */
  public void setAlphabet(Collection<Character> symbols) {
    if (symbols.contains(EPSILON)) {
      throw new InvalidSymbolException("The epsilon marker cannot be part of the alphabet", String.valueOf(EPSILON));
    }
    alphabet.clear();
    alphabet.addAll(symbols);
  }

  public Set<String> states() {
    return Collections.unmodifiableSet(states);
  }

  public Set<Character> alphabet() {
    return Collections.unmodifiableSet(alphabet);
  }

  public Set<String> startStates() {
    return Collections.unmodifiableSet(startStates);
  }

  public Set<String> finalStates() {
    return Collections.unmodifiableSet(finalStates);
  }

  /**
   * Read-only view of the transition relation.
   */
  public TransitionTable transitions() {
    return transitions;
  }

  public boolean containsState(String state) {
    return states.contains(state);
  }

  /**
   * Look up the transitions out of a state.
   *
   * @param state registered state
   * @return mapping of symbols to destination sets (empty if there are none)
   * @throws UnknownStateException if the state is not registered
   */
  public Map<Character, Set<String>> transitionsFrom(String state) {
    requireRegistered(state);
    return transitions.row(state);
  }

  /**
   * Classify the automaton from its transitions.
   *
   * @return DFA, NFA or epsilon-NFA
   */
  public AutomatonType classify() {
    return AutomatonType.of(transitions);
  }

  /**
   * All states reachable from some state in {@code from} over exactly one
   * {@code symbol} transition (epsilon transitions are not followed).
   *
   * @param from starting states
   * @param symbol symbol to follow
   * @return reachable states
   */
  public Set<String> successors(Collection<String> from, char symbol) {
    final var reachable = new LinkedHashSet<String>();
    for (String state : from) {
      reachable.addAll(transitions.destinations(state, symbol));
    }
    return reachable;
  }

  /**
   * Simulate the automaton on an input.
   *
   * This tracks the full set of active states, so it works for all kinds of
   * automata. Symbols outside of the alphabet are never accepted.
   *
   * @param input input string
   * @return whether the automaton accepts the input
   */
  public boolean accepts(CharSequence input) {
    final var closure = new EpsilonClosure(this);
    StateSet current = closure.closure(startStates);

    for (int i = 0; i < input.length() && !current.isEmpty(); i++) {
      final char symbol = input.charAt(i);
      if (!alphabet.contains(symbol)) {
        return false;
      }
      current = closure.closure(successors(current.toSet(), symbol));
    }

    return current.intersects(finalStates);
  }

  /**
   * Parse a textual transition label into a symbol.
   *
   * @param label exactly one character, or the epsilon marker
   * @return symbol
   * @throws InvalidSymbolException if the label is missing, empty or too long
   */
  public static char symbolOf(String label) {
    if (label == null) {
      throw new InvalidSymbolException("Missing transition symbol", null);
    } else if (label.length() != 1) {
      throw new InvalidSymbolException("Transition symbol must be exactly one character: \"" + label + "\"", label);
    }
    return label.charAt(0);
  }

  private void requireRegistered(String state) {
    if (!states.contains(state)) {
      throw new UnknownStateException(state);
    }
  }

  @Override
  public Stream<DotGraph.Vertex<String>> vertices() {
    return states
      .stream()
      .map((String state) -> new DotGraph.Vertex<String>(state, finalStates.contains(state)));
  }

  @Override
  public Stream<DotGraph.Edge<String, Character>> edges() {
    final var initialEdges = startStates
      .stream()
      .map((String start) -> new DotGraph.Edge<String, Character>(null, start, null));
    final var transitionEdges = transitions
      .stream()
      .map((TransitionTable.Transition t) -> new DotGraph.Edge<String, Character>(t.from(), t.to(), t.symbol()));
    return Stream.concat(initialEdges, transitionEdges);
  }

  @Override
  public String toString() {
    return "Automaton " + name
      + " (states: " + states
      + ", start: " + startStates
      + ", final: " + finalStates
      + ", alphabet: " + alphabet
      + ", transitions: " + transitions.size() + ")";
  }
}
