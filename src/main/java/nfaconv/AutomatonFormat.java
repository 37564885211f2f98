package nfaconv;

/**
 * Textual serialization of automata.
 */
public interface AutomatonFormat {

  /**
   * Parse exactly one automaton from its textual description.
   *
   * @param text textual description
   * @return freshly built automaton
   * @throws AutomatonException if the description is not a valid automaton
   */
  Automaton read(String text);

  /**
   * Render an automaton into its textual description.
   *
   * Reading the output back produces an automaton with the same states,
   * start states, final states and transitions.
   *
   * @param automaton automaton to render
   * @return textual description
   */
  String write(Automaton automaton);
}
