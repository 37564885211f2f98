package nfaconv;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable set of state identifiers.
 *
 * Two state sets are equal exactly when they contain the same states, no
 * matter the order in which the states were discovered. This makes them
 * suitable as the identity of the states generated by a subset construction.
 */
public final class StateSet {

  public static final StateSet EMPTY = new StateSet(Set.of());

  // Sorted and distinct elements
  private final String[] elements;

  public static StateSet of(String... states) {
    return new StateSet(Arrays.asList(states));
  }

  public StateSet(Collection<String> states) {
    this.elements = new TreeSet<String>(states).toArray(new String[0]);
  }

  public Stream<String> stream() {
    return Arrays.stream(elements);
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(String state) {
    return Arrays.binarySearch(elements, state) >= 0;
  }

  /**
   * Check if this set shares at least one state with another collection.
   *
   * @param states states to check against
   * @return whether some state is in both
   */
  public boolean intersects(Collection<String> states) {
    return stream().anyMatch(states::contains);
  }

  /**
   * Copy the states into a fresh, modifiable, sorted set.
   *
   * @return states in ascending order
   */
  public Set<String> toSet() {
    return stream().collect(Collectors.toCollection(TreeSet::new));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof StateSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((StateSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return stream().collect(Collectors.joining(",", "{", "}"));
  }
}
