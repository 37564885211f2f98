package nfaconv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class EpsilonClosureTest {

  @Test
  public void closureIsReflexive() {
    final var closure = new EpsilonClosure(Fixtures.thirdFromEnd());
    assertEquals(StateSet.of("p1"), closure.closure("p1"));
    assertEquals(StateSet.EMPTY, closure.closure(List.of()));
  }

  @Test
  public void followsChainsOfEpsilonTransitions() {
    final var closure = new EpsilonClosure(Fixtures.abbSuffix());
    assertEquals(StateSet.of("0", "1", "2", "4", "7"), closure.closure("0"));
    assertEquals(StateSet.of("1", "2", "3", "4", "6", "7"), closure.closure("3"));
    assertEquals(StateSet.of("10"), closure.closure("10"));
  }

  @Test
  public void closureIsIdempotentAndMonotone() {
    final Automaton automaton = Fixtures.abbSuffix();
    final var closure = new EpsilonClosure(automaton);

    for (String state : automaton.states()) {
      for (String other : automaton.states()) {
        final Set<String> states = Set.of(state, other);
        final StateSet closed = closure.closure(states);
        assertTrue(states.stream().allMatch(closed::contains), "closure of " + states + " misses a source state");
        assertEquals(closed, closure.closure(closed.toSet()));
      }
    }
  }

  @Test
  public void terminatesOnEpsilonCycles() {
    final var closure = new EpsilonClosure(Fixtures.epsilonCycle());
    final StateSet closed = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> closure.closure("q1"));
    assertEquals(StateSet.of("q0", "q1", "q2"), closed);
  }

  @Test
  public void terminatesOnEpsilonSelfLoops() {
    final var automaton = new Automaton("loop");
    automaton.addState("q0");
    automaton.addTransition("q0", "q0", Automaton.EPSILON);
    assertEquals(StateSet.of("q0"), new EpsilonClosure(automaton).closure("q0"));
  }

  @Test
  public void mergesBranchesOfSeveralStartStates() {
    final Automaton automaton = Fixtures.twoStarts();
    final var closure = new EpsilonClosure(automaton);
    assertEquals(StateSet.of("q0", "q1", "q2", "q5"), closure.closure("q0"));
    assertEquals(StateSet.of("q2", "q3", "q4"), closure.closure("q3"));
    assertEquals(
      StateSet.of("q0", "q1", "q2", "q3", "q4", "q5"),
      closure.closure(automaton.startStates())
    );
  }
}
