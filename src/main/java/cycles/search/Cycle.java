package cycles.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An elementary cycle: the vertex ids along the closed walk, starting at the anchor vertex. The
 * closing edge back to the first vertex is implicit, so {@code [0, 3, 5]} stands for 0 -> 3 -> 5 ->
 * 0.
 */
public final class Cycle {

  private final List<Integer> vertices;

  public Cycle(List<Integer> vertices) {
    this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));
  }

  public List<Integer> getVertices() {
    return vertices;
  }

  public int size() {
    return vertices.size();
  }

  public int anchor() {
    return vertices.get(0);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Cycle && vertices.equals(((Cycle) o).vertices);
  }

  @Override
  public int hashCode() {
    return vertices.hashCode();
  }

  /** Renders as {@code [0, 3, 5]}. */
  @Override
  public String toString() {
    return vertices.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
  }
}
