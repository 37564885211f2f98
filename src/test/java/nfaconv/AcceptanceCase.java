package nfaconv;

/**
 * Test case in an acceptance file.
 *
 * @param automaton name of the DOT resource describing the automaton
 * @param input input string to feed to the automaton
 * @param accepted whether the input should be accepted
 * @param filePath source file from which the test originated
 * @param lineNumber line in the source file from which the test originated
 */
public record AcceptanceCase(
  String automaton,
  String input,
  boolean accepted,
  String filePath,
  int lineNumber
) {

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return automaton + " " + (accepted ? "accepts" : "rejects") + " \"" + input + "\" (at " + filePath + ":" + lineNumber + ")";
  }
}
