package mincut.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import mincut.core.model.Edge;
import mincut.core.model.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads DIMACS style graph files.
 *
 * <p>{@code p edge <n> <m>} declares the vertex count and an edge count hint, {@code e <u> <v>}
 * declares an edge with 1-based vertex ids. Lines starting with any other character are skipped.
 * Anything else that fails to parse is reported as a {@link GraphFormatException}.
 */
public final class GraphLoader {
  private static final Logger LOG = LoggerFactory.getLogger(GraphLoader.class);
  private static final Path INLINE = Path.of("<inline>");
  private static final int MAX_INITIAL_EDGE_CAPACITY = 1 << 16;

  private GraphLoader() {}

  public static Graph load(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(path.toString(), null, "graph file not found");
    }
    // only ASCII matters on p/e lines; Latin-1 decodes any byte in comments
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
      return read(reader, path);
    }
  }

  public static Graph parse(String content) throws GraphFormatException {
    try (BufferedReader reader = new BufferedReader(new StringReader(content))) {
      return read(reader, INLINE);
    } catch (GraphFormatException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new IllegalStateException("reading from a string failed", ex);
    }
  }

  private static Graph read(BufferedReader reader, Path path) throws IOException {
    int vertexCount = -1;
    int declaredEdges = -1;
    List<Edge> edges = new ArrayList<>();

    int lineNumber = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isEmpty()) {
        continue;
      }
      switch (line.charAt(0)) {
        case 'p' -> {
          if (vertexCount >= 0) {
            throw new GraphFormatException(path, lineNumber, "duplicate problem line");
          }
          String[] tokens = tokens(line, 4, path, lineNumber);
          vertexCount = parseCount(tokens[2], path, lineNumber);
          declaredEdges = parseCount(tokens[3], path, lineNumber);
          if (vertexCount < 2) {
            throw new GraphFormatException(
                path, lineNumber, "graph needs at least 2 vertices, got " + vertexCount);
          }
          edges = new ArrayList<>(Math.min(declaredEdges, MAX_INITIAL_EDGE_CAPACITY));
        }
        case 'e' -> {
          if (vertexCount < 0) {
            throw new GraphFormatException(path, lineNumber, "edge before problem line");
          }
          String[] tokens = tokens(line, 3, path, lineNumber);
          int tail = parseVertex(tokens[1], vertexCount, path, lineNumber);
          int head = parseVertex(tokens[2], vertexCount, path, lineNumber);
          edges.add(new Edge(tail, head));
        }
        default -> {
          // comments and anything else
        }
      }
    }

    if (vertexCount < 0) {
      throw new GraphFormatException(path, lineNumber, "missing problem line 'p edge <n> <m>'");
    }
    if (declaredEdges != edges.size()) {
      LOG.warn(
          "{} declares {} edges but lists {}; using the listed edges.",
          path,
          declaredEdges,
          edges.size());
    }
    LOG.debug("Loaded {} (|V|={}, |E|={})", path, vertexCount, edges.size());
    return new Graph(vertexCount, edges);
  }

  private static String[] tokens(String line, int expected, Path path, int lineNumber)
      throws GraphFormatException {
    String[] tokens = line.trim().split("\\s+");
    if (tokens.length != expected) {
      throw new GraphFormatException(
          path, lineNumber, "expected " + expected + " fields but found " + tokens.length);
    }
    if (tokens[0].length() != 1) {
      throw new GraphFormatException(path, lineNumber, "unknown line type '" + tokens[0] + "'");
    }
    return tokens;
  }

  private static int parseCount(String raw, Path path, int lineNumber)
      throws GraphFormatException {
    int value = parseInt(raw, path, lineNumber);
    if (value < 0) {
      throw new GraphFormatException(path, lineNumber, "negative count: " + raw);
    }
    return value;
  }

  private static int parseVertex(String raw, int vertexCount, Path path, int lineNumber)
      throws GraphFormatException {
    int value = parseInt(raw, path, lineNumber);
    if (value < 1 || value > vertexCount) {
      throw new GraphFormatException(
          path, lineNumber, "vertex " + raw + " outside [1, " + vertexCount + "]");
    }
    return value - 1;
  }

  private static int parseInt(String raw, Path path, int lineNumber) throws GraphFormatException {
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new GraphFormatException(path, lineNumber, "not an integer: " + raw, ex);
    }
  }
}
