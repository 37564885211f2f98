package nfaconv;

/**
 * A state identifier was registered a second time.
 */
public class DuplicateStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 4451398022716539176L;

  /**
   * State that was already registered.
   */
  public final String state;

  public DuplicateStateException(String state) {
    super("State \"" + state + "\" is already registered");
    this.state = state;
  }
}
