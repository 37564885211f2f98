package nfaconv.graph;

import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * Vertices are drawn as circles, or double circles if they are accepting.
 * Edges without a starting vertex are drawn from a single anonymous vertex
 * (with the empty ID), which is how start states are marked.
 *
 * @param <V> vertex in the graph
 * @param <E> edge in the graph
 */
public interface DotGraph<V, E> {

  /**
   * ID of the anonymous vertex from which start edges are drawn.
   */
  String ANONYMOUS_ID = "";

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edges starts (or the anonymous vertex if {@code null})
   * @param to vertex where the edges ends
   * @param label label on the edge (or no label if {@code null})
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  public Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  public Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return label string
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    return edge.label().toString();
  }

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    // Vertices
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + "];\n");
    }

    // Edges
    boolean anonymous = false;
    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final V fromV = edge.from();
      anonymous |= fromV == null;

      final var from = escapeId(fromV == null ? ANONYMOUS_ID : fromV.toString());
      final var to = escapeId(edge.to().toString());
      builder.append("  " + from + " -> " + to);
      if (edge.label() != null) {
        builder.append(" [label = " + escapeId(renderEdgeLabel(edge)) + "]");
      }
      builder.append(";\n");
    }

    // Blank source vertex
    if (anonymous) {
      builder.append("  " + escapeId(ANONYMOUS_ID) + " [shape = none, label = \"\"];\n");
    }

    builder.append("}\n");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")". Strings which are already double-quoted
   * are passed through unchanged.
   *
   * @param str string to escape into an ID
   */
  static String escapeId(String str) {
    if (str.length() >= 2 && str.startsWith("\"") && str.endsWith("\"")) {
      return str;
    }
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
