package nfaconv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Transition relation of a finite automaton.
 *
 * This is a table keyed on {@code (state, symbol)} whose cells are sets of
 * destination states, so non-determinism is supported natively. Rows and
 * cells are created lazily the first time a transition is added to them and
 * iterate in insertion order.
 *
 * Only the owning {@link Automaton} adds entries; everyone else gets
 * unmodifiable views.
 */
public final class TransitionTable {

  /**
   * Single {@code from --symbol--> to} entry of the table.
   *
   * @param from state where the transition starts
   * @param symbol symbol on the transition (possibly {@link Automaton#EPSILON})
   * @param to state where the transition ends
   */
  public record Transition(String from, char symbol, String to) {

    public boolean isEpsilon() {
      return symbol == Automaton.EPSILON;
    }
  }

  private final Map<String, Map<Character, Set<String>>> rows = new LinkedHashMap<>();

  TransitionTable() { }

  /**
   * Record a transition.
   *
   * @return whether the transition was not already present
   */
  boolean add(String from, char symbol, String to) {
    return rows
      .computeIfAbsent(from, k -> new LinkedHashMap<>())
      .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
      .add(to);
  }

  /**
   * Destinations of a {@code (state, symbol)} pair.
   *
   * @param from starting state
   * @param symbol symbol or epsilon marker
   * @return unmodifiable destination set (empty if there are no transitions)
   */
  public Set<String> destinations(String from, char symbol) {
    final Map<Character, Set<String>> row = rows.get(from);
    if (row == null) {
      return Collections.emptySet();
    }
    final Set<String> cell = row.get(symbol);
    return cell == null ? Collections.emptySet() : Collections.unmodifiableSet(cell);
  }

  /**
   * All transitions out of a state.
   *
   * @param from starting state
   * @return unmodifiable map of symbols to destination sets
   */
  public Map<Character, Set<String>> row(String from) {
    final Map<Character, Set<String>> row = rows.get(from);
    if (row == null) {
      return Collections.emptyMap();
    }
    final var view = new LinkedHashMap<Character, Set<String>>();
    for (var cell : row.entrySet()) {
      view.put(cell.getKey(), Collections.unmodifiableSet(cell.getValue()));
    }
    return Collections.unmodifiableMap(view);
  }

  /**
   * Symbols used on at least one transition.
   *
   * @return symbols in order of first use, including epsilon if it is used
   */
  public Set<Character> symbols() {
    final var symbols = new LinkedHashSet<Character>();
    for (var row : rows.values()) {
      symbols.addAll(row.keySet());
    }
    return symbols;
  }

  /**
   * @return whether any transition is labelled with the epsilon marker
   */
  public boolean hasEpsilon() {
    return rows
      .values()
      .stream()
      .anyMatch(row -> row.containsKey(Automaton.EPSILON));
  }

  /**
   * Check the DFA property of the table: no epsilon transitions and at most
   * one destination for each {@code (state, symbol)} pair.
   *
   * @return whether the table is deterministic
   */
  public boolean isDeterministic() {
    for (var row : rows.values()) {
      for (var cell : row.entrySet()) {
        if (cell.getKey() == Automaton.EPSILON || cell.getValue().size() > 1) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * @return number of {@code (from, symbol, to)} triples in the table
   */
  public int size() {
    return rows
      .values()
      .stream()
      .flatMap(row -> row.values().stream())
      .mapToInt(Set::size)
      .sum();
  }

  /**
   * Flatten the table into its transitions.
   *
   * @return transitions ordered by starting state, then symbol, then destination
   *         (each in insertion order)
   */
  public Stream<Transition> stream() {
    return rows
      .entrySet()
      .stream()
      .flatMap((Map.Entry<String, Map<Character, Set<String>>> row) -> {
        final String from = row.getKey();
        return row
          .getValue()
          .entrySet()
          .stream()
          .flatMap((Map.Entry<Character, Set<String>> cell) -> {
            final char symbol = cell.getKey();
            return cell
              .getValue()
              .stream()
              .map((String to) -> new Transition(from, symbol, to));
          });
      });
  }
}
