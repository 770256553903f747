package cycles.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/** 强连通分量：一组相互可达的顶点id，按id升序保存 */
public class StronglyConnectedComponent {

  private final SortedSet<Integer> vertices;

  public StronglyConnectedComponent(Collection<Integer> vertices) {
    this.vertices = Collections.unmodifiableSortedSet(new TreeSet<>(vertices));
  }

  public SortedSet<Integer> getVertices() {
    return vertices;
  }

  public int size() {
    return vertices.size();
  }

  /** 分量中id最小的顶点，作为Johnson算法一轮搜索的起点 */
  public int anchor() {
    return vertices.first();
  }

  public boolean contains(int vertex) {
    return vertices.contains(vertex);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StronglyConnectedComponent)) {
      return false;
    }
    return vertices.equals(((StronglyConnectedComponent) o).vertices);
  }

  @Override
  public int hashCode() {
    return vertices.hashCode();
  }

  @Override
  public String toString() {
    return "SCC" + vertices;
  }
}
