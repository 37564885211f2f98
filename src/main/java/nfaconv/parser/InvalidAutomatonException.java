package nfaconv.parser;

import nfaconv.AutomatonException;

/**
 * Textual description which does not describe a valid automaton: malformed
 * DOT syntax, an undirected graph, states without a shape, a missing or
 * repeated start state, or no accepting states.
 */
public class InvalidAutomatonException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -3125067315628974706L;

  /**
   * Offset in the source text at which the problem was found, or {@code -1}
   * if the problem is not tied to one location.
   */
  public final int index;

  public InvalidAutomatonException(String description) {
    this(description, -1);
  }

  public InvalidAutomatonException(String description, int index) {
    super(index < 0 ? description : description + " (at index " + index + ")");
    this.index = index;
  }
}
