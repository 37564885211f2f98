package nfaconv.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the subset of the DOT language used to describe automata.
 *
 * This is a fairly standard recursive descent parser over a single directed
 * graph. Node and edge attribute defaults ({@code node [...]} and
 * {@code edge [...]}) are resolved while parsing, so every parsed node and
 * edge carries its full set of attributes. Graph attributes are accepted and
 * ignored.
 *
 * Subgraphs, ports and undirected graphs are rejected.
 */
public final class DotParser {

  /**
   * Parsed directed graph.
   *
   * @param name graph ID (empty if the graph is anonymous)
   * @param nodes attributes of every node, in order of first mention
   * @param edges edges, in source order
   */
  public record Graph(
    String name,
    Map<String, Map<String, String>> nodes,
    List<Edge> edges
  ) { }

  /**
   * Parsed edge.
   *
   * @param from ID of the node where the edge starts
   * @param to ID of the node where the edge ends
   * @param attributes edge attributes (defaults included)
   * @param index offset of the edge in the source text
   */
  public record Edge(String from, String to, Map<String, String> attributes, int index) { }

  // DOT IDs, and whether they were bare (so they might be keywords)
  private record Id(String text, boolean bare, int index) {

    boolean isKeyword(String keyword) {
      return bare && text.equalsIgnoreCase(keyword);
    }
  }

  // Bookkeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  // Graph being built
  private final Map<String, Map<String, String>> nodes = new LinkedHashMap<>();
  private final List<Edge> edges = new ArrayList<>();
  private final Map<String, String> nodeDefaults = new LinkedHashMap<>();
  private final Map<String, String> edgeDefaults = new LinkedHashMap<>();

  /**
   * Parse exactly one directed graph.
   *
   * @param input DOT source
   * @return parsed graph
   * @throws InvalidAutomatonException if the input is not exactly one supported directed graph
   */
  public static Graph parse(String input) throws InvalidAutomatonException {
    final var parser = new DotParser(input);
    final Graph graph = parser.parseGraph();
    if (parser.peekChar() != -1) {
      throw parser.error("Expected exactly one graph");
    }
    return graph;
  }

  private DotParser(String input) {
    this.input = input;
    this.length = input.length();
  }

  private InvalidAutomatonException error(String message) {
    return new InvalidAutomatonException(message, position);
  }

  /**
   * Advance the cursor past any whitespace or comments.
   */
  private void skipSpaceAndComments() {
    while (position < length) {
      final char c = input.charAt(position);
      if (Character.isWhitespace(c)) {
        position++;
      } else if (c == '#' || input.startsWith("//", position)) {
        while (position < length && input.charAt(position) != '\n') {
          position++;
        }
      } else if (input.startsWith("/*", position)) {
        final int end = input.indexOf("*/", position + 2);
        if (end < 0) {
          throw error("Unterminated comment");
        }
        position = end + 2;
      } else {
        break;
      }
    }
  }

  /**
   * Peek the next character in the input without advancing the position.
   *
   * @return next character or else -1 if there is none
   */
  int peekChar() {
    skipSpaceAndComments();
    return position < length ? input.charAt(position) : -1;
  }

  /**
   * Advance past the next character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  boolean nextCharIf(char matching) {
    skipSpaceAndComments();
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  /**
   * Advance past the next characters only if they match the expected.
   *
   * @param matching desired characters
   * @return whether the characters were found
   */
  boolean nextIf(String matching) {
    skipSpaceAndComments();
    final boolean matches = input.startsWith(matching, position);
    if (matches) {
      position += matching.length();
    }
    return matches;
  }

  /**
   * Parse the graph header and body.
   */
  private Graph parseGraph() {
    if (peekChar() == -1) {
      throw error("Expected a graph");
    }

    Id keyword = parseId();
    if (keyword.isKeyword("strict")) {
      keyword = parseId();
    }
    if (keyword.isKeyword("graph")) {
      throw new InvalidAutomatonException("Automaton cannot be an undirected graph", keyword.index());
    } else if (!keyword.isKeyword("digraph")) {
      throw new InvalidAutomatonException("Expected `digraph`", keyword.index());
    }

    String name = "";
    if (peekChar() != '{') {
      name = parseId().text();
    }
    if (!nextCharIf('{')) {
      throw error("Expected `{` to open the graph body");
    }

    while (!nextCharIf('}')) {
      if (peekChar() == -1) {
        throw error("Expected `}` to close the graph body");
      }
      parseStatement();
      nextCharIf(';');
    }

    return new Graph(name, Collections.unmodifiableMap(nodes), Collections.unmodifiableList(edges));
  }

  /**
   * Parse a node, edge, attribute or assignment statement.
   */
  private void parseStatement() {
    if (peekChar() == '{') {
      throw error("Subgraphs are not supported");
    }

    final Id first = parseId();
    if (first.isKeyword("subgraph")) {
      throw new InvalidAutomatonException("Subgraphs are not supported", first.index());
    } else if (first.isKeyword("node")) {
      nodeDefaults.putAll(parseAttributeLists());
      return;
    } else if (first.isKeyword("edge")) {
      edgeDefaults.putAll(parseAttributeLists());
      return;
    } else if (first.isKeyword("graph")) {
      parseAttributeLists();
      return;
    }

    // Graph attribute assignment
    if (nextCharIf('=')) {
      parseId();
      return;
    }

    if (peekChar() == ':') {
      throw error("Ports are not supported");
    }

    // Edge statement (possibly a chain)
    if (peekEdgeOperator()) {
      final var chain = new ArrayList<Id>();
      chain.add(first);
      while (peekEdgeOperator()) {
        final int operatorIndex = position;
        if (nextIf("--")) {
          throw new InvalidAutomatonException("Automaton cannot have undirected edges", operatorIndex);
        }
        nextIf("->");
        if (peekChar() == '{') {
          throw error("Subgraphs are not supported");
        }
        chain.add(parseId());
        if (peekChar() == ':') {
          throw error("Ports are not supported");
        }
      }

      final Map<String, String> ownAttributes = parseAttributeLists();
      for (int i = 1; i < chain.size(); i++) {
        final String from = touchNode(chain.get(i - 1).text());
        final String to = touchNode(chain.get(i).text());
        final var attributes = new LinkedHashMap<String, String>(edgeDefaults);
        attributes.putAll(ownAttributes);
        edges.add(new Edge(from, to, Collections.unmodifiableMap(attributes), chain.get(i - 1).index()));
      }
      return;
    }

    // Node statement
    final Map<String, String> ownAttributes = parseAttributeLists();
    nodes.get(touchNode(first.text())).putAll(ownAttributes);
  }

  /**
   * Make sure a node exists, creating it with the current node defaults if
   * this is its first mention.
   */
  private String touchNode(String id) {
    nodes.computeIfAbsent(id, k -> new LinkedHashMap<>(nodeDefaults));
    return id;
  }

  private boolean peekEdgeOperator() {
    skipSpaceAndComments();
    return input.startsWith("->", position) || input.startsWith("--", position);
  }

  /**
   * Parse zero or more bracketed attribute lists.
   *
   * @return attributes, with later ones overriding earlier ones
   */
  private Map<String, String> parseAttributeLists() {
    final var attributes = new LinkedHashMap<String, String>();
    while (nextCharIf('[')) {
      while (!nextCharIf(']')) {
        if (peekChar() == -1) {
          throw error("Expected `]` to close the attribute list");
        }
        final Id key = parseId();
        if (!nextCharIf('=')) {
          throw error("Expected `=` after attribute `" + key.text() + "`");
        }
        attributes.put(key.text(), parseId().text());
        if (!nextCharIf(',')) {
          nextCharIf(';');
        }
      }
    }
    return attributes;
  }

  /**
   * Parse an ID: a bare identifier, a numeral, a double-quoted string (or a
   * concatenation of them using {@code +}), or an HTML string.
   */
  private Id parseId() {
    final int c = peekChar();
    final int start = position;

    if (c == '"') {
      final var builder = new StringBuilder();
      do {
        if (peekChar() != '"') {
          throw error("Expected a double-quoted string after `+`");
        }
        parseQuoted(builder);
      } while (nextCharIf('+'));
      return new Id(builder.toString(), false, start);
    } else if (c == '<') {
      return new Id(parseHtml(), false, start);
    } else if (c != -1 && isIdStart((char) c)) {
      while (position < length && isIdPart(input.charAt(position))) {
        position++;
      }
      return new Id(input.substring(start, position), true, start);
    } else if (c != -1 && (c == '-' || c == '.' || Character.isDigit(c))) {
      position++;
      while (position < length && (input.charAt(position) == '.' || Character.isDigit(input.charAt(position)))) {
        position++;
      }
      final String numeral = input.substring(start, position);
      if (numeral.equals("-") || numeral.equals(".") || numeral.equals("-.")) {
        throw new InvalidAutomatonException("Invalid numeral", start);
      }
      return new Id(numeral, false, start);
    } else {
      throw error("Expected an ID");
    }
  }

  /**
   * Parse a double-quoted string, appending its contents.
   *
   * {@code \"} and {@code \\} are unescaped and escaped newlines are line
   * continuations. Any other backslash is kept as is.
   */
  private void parseQuoted(StringBuilder builder) {
    final int start = position;
    position++;
    while (true) {
      if (position >= length) {
        throw new InvalidAutomatonException("Unterminated string", start);
      }
      final char c = input.charAt(position++);
      if (c == '"') {
        return;
      } else if (c == '\\' && position < length) {
        final char escaped = input.charAt(position);
        if (escaped == '"' || escaped == '\\') {
          builder.append(escaped);
          position++;
        } else if (escaped == '\n') {
          position++;
        } else if (escaped == '\r' && input.startsWith("\r\n", position)) {
          position += 2;
        } else {
          builder.append(c);
        }
      } else {
        builder.append(c);
      }
    }
  }

  /**
   * Parse an HTML string, returning what is between the outer angle brackets.
   */
  private String parseHtml() {
    final int start = position;
    int depth = 0;
    do {
      if (position >= length) {
        throw new InvalidAutomatonException("Unterminated HTML string", start);
      }
      final char c = input.charAt(position++);
      if (c == '<') {
        depth++;
      } else if (c == '>') {
        depth--;
      }
    } while (depth > 0);
    return input.substring(start + 1, position - 1);
  }

  // Letters include everything outside of ASCII
  private static boolean isIdStart(char c) {
    return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c >= '\u0080';
  }

  private static boolean isIdPart(char c) {
    return isIdStart(c) || (c >= '0' && c <= '9');
  }
}
