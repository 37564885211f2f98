package nfaconv;

/**
 * A state was referenced (as a transition endpoint, start state, final state
 * or in a query) before being registered.
 */
public class UnknownStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -6003920318456120187L;

  /**
   * Unregistered state that was referenced.
   */
  public final String state;

  public UnknownStateException(String state) {
    super("State \"" + state + "\" is not registered");
    this.state = state;
  }
}
