package atn.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * State graph rendered to Graphviz DOT source, with vertices grouped into
 * clusters.
 *
 * @param <V> vertex identifier
 * @param <E> edge label
 */
public interface DotGraph<V, E> {

  /**
   * Vertices outside of any cluster.
   */
  int NO_CLUSTER = -1;

  /**
   * @param id vertex identifier
   * @param cluster cluster drawn around the vertex, or {@link #NO_CLUSTER}
   * @param accepting is the vertex drawn as a final state?
   */
  record Vertex<V>(V id, int cluster, boolean accepting) { }

  /**
   * @param from source vertex, or {@code null} for an arrow entering the graph
   * @param to target vertex
   * @param label edge label, or {@code null}
   */
  record Edge<V, E>(V from, V to, E label) { }

  Stream<Vertex<V>> vertices();

  Stream<Edge<V, E>> edges();

  /**
   * @return HTML label of an edge
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    return edge.label() == null ? "" : edge.label().toString();
  }

  /**
   * @return HTML label of a vertex
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return vertex.id().toString();
  }

  /**
   * @return HTML title of a cluster
   */
  default String renderClusterLabel(int cluster) {
    return Integer.toString(cluster);
  }

  /**
   * Render the graph into DOT source.
   *
   * @param name graph title
   * @return DOT source
   */
  default String dotGraph(String name) {
    final var clusters = new TreeMap<Integer, List<Vertex<V>>>();
    vertices().forEach(v -> clusters.computeIfAbsent(v.cluster(), c -> new ArrayList<>()).add(v));

    final var dot = new StringBuilder();
    dot.append("digraph ").append(quote(name)).append(" {\n");
    dot.append("  rankdir = LR;\n");

    for (Map.Entry<Integer, List<Vertex<V>>> cluster : clusters.entrySet()) {
      String indent = "  ";
      if (cluster.getKey() != NO_CLUSTER) {
        dot.append("  subgraph ").append(quote("cluster_" + cluster.getKey())).append(" {\n");
        dot.append("    label = <").append(renderClusterLabel(cluster.getKey())).append(">;\n");
        indent = "    ";
      }
      for (Vertex<V> vertex : cluster.getValue()) {
        dot.append(indent)
          .append(quote(vertex.id().toString()))
          .append(" [shape = ")
          .append(vertex.accepting() ? "doublecircle" : "circle")
          .append(", label = <")
          .append(renderVertexLabel(vertex))
          .append(">];\n");
      }
      if (cluster.getKey() != NO_CLUSTER) {
        dot.append("  }\n");
      }
    }

    // Arrows entering the graph start from a point of their own
    int entries = 0;
    for (Edge<V, E> edge : (Iterable<Edge<V, E>>) () -> edges().iterator()) {
      final String from;
      if (edge.from() == null) {
        from = quote("_entry" + ++entries);
        dot.append("  ").append(from).append(" [shape = point];\n");
      } else {
        from = quote(edge.from().toString());
      }
      dot.append("  ")
        .append(from)
        .append(" -> ")
        .append(quote(edge.to().toString()))
        .append(" [label = <")
        .append(renderEdgeLabel(edge))
        .append(">];\n");
    }

    return dot.append("}").toString();
  }

  private static String quote(String id) {
    return "\"" + id.replace("\"", "\\\"") + "\"";
  }
}
