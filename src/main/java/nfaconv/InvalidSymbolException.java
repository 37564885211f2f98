package nfaconv;

/**
 * A transition label is not a single symbol or the epsilon marker, or the
 * epsilon marker was used where only alphabet symbols are allowed.
 */
public class InvalidSymbolException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 1380950327783655321L;

  /**
   * Offending label ({@code null} if the label was missing entirely).
   */
  public final String label;

  public InvalidSymbolException(String message, String label) {
    super(message);
    this.label = label;
  }
}
