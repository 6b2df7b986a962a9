package mincut.core.model;

/** Undirected edge between two vertex ids. The endpoint order carries no meaning. */
public record Edge(int tail, int head) {

  public Edge {
    if (tail < 0 || head < 0) {
      throw new IllegalArgumentException("vertex ids must be non-negative: " + tail + ", " + head);
    }
  }

  public boolean isSelfLoop() {
    return tail == head;
  }

  @Override
  public String toString() {
    return tail + " -- " + head;
  }
}
