package nfaconv;

/**
 * Violation of the structure of a finite automaton.
 *
 * Errors are reported at the point where the violation is detected and
 * nothing partially built is returned to the caller.
 */
public abstract class AutomatonException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = -2716470853215049927L;

  protected AutomatonException(String message) {
    super(message);
  }
}
