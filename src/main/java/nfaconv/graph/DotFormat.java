package nfaconv.graph;

import java.util.Objects;
import nfaconv.Automaton;
import nfaconv.AutomatonFormat;
import nfaconv.parser.DotReader;
import nfaconv.parser.StartPolicy;

/**
 * Automata described as DOT graphs.
 *
 * Accepting states are drawn as double circles, other states as circles, and
 * start states are the targets of edges out of a blank, anonymous node.
 * Transitions are edges labelled with their symbol ({@code ε} for epsilon).
 */
public final class DotFormat implements AutomatonFormat {

  private final StartPolicy startPolicy;

  /**
   * Format requiring exactly one start state when reading.
   */
  public DotFormat() {
    this(StartPolicy.SINGLE);
  }

  /**
   * @param startPolicy how many start states are allowed when reading
   */
  public DotFormat(StartPolicy startPolicy) {
    this.startPolicy = Objects.requireNonNull(startPolicy, "startPolicy");
  }

  public StartPolicy startPolicy() {
    return startPolicy;
  }

  @Override
  public Automaton read(String text) {
    return DotReader.read(text, startPolicy);
  }

  @Override
  public String write(Automaton automaton) {
    return automaton.dotGraph(automaton.name());
  }
}
