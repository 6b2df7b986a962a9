package mincut.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import mincut.core.model.Edge;
import mincut.core.model.Graph;

/** Writes graphs in the DIMACS format read by {@link GraphLoader}. */
public final class GraphWriter {
  private GraphWriter() {}

  public static void write(Graph graph, Path path, String comment) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(graph, writer, comment);
    }
  }

  public static String format(Graph graph, String comment) {
    StringWriter out = new StringWriter();
    try {
      write(graph, out, comment);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toString();
  }

  private static void write(Graph graph, Writer writer, String comment) throws IOException {
    if (comment != null && !comment.isBlank()) {
      for (String line : comment.split("\\R")) {
        writer.write("c " + line + "\n");
      }
    }
    writer.write("p edge " + graph.vertexCount() + " " + graph.edgeCount() + "\n");
    for (Edge edge : graph.edges()) {
      writer.write("e " + (edge.tail() + 1) + " " + (edge.head() + 1) + "\n");
    }
  }
}
