package cycles.graph;

import exception.CycleSearchException;
import exception.GraphConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lombok.Getter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.GraphTests;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleDirectedGraph;

/**
 * 带类型标签的有向图，是环路搜索的核心数据结构。
 *
 * <p>顶点以稳定的整数id标识：id在第一次出现时分配，删除顶点之后其他顶点的id保持不变，也不会被复用。底层存储交给JGraphT的 {@link
 * SimpleDirectedGraph}，它以id为key保存邻接结构，因此不存在"存储位置"与"id"的混淆。
 *
 * <p>重复边只保留一条；自环在构建时被丢弃并计数，单顶点的环永远不会被输出。
 */
public class TypedGraph {

  private static final Logger logger = LogManager.getLogger(TypedGraph.class);

  /** 核心数据结构：一个简单有向图，图的节点是顶点id */
  private final SimpleDirectedGraph<Integer, DefaultEdge> graph;

  /** 顶点id -> 顶点名 */
  private final Map<Integer, String> names;

  /** 顶点id -> 顶点类型，类型可以为null */
  private final Map<Integer, String> types;

  /** 构建时被丢弃的自环数目 */
  @Getter private int droppedSelfLoops;

  /** 构建时被合并的重复边数目 */
  @Getter private int duplicateEdges;

  private TypedGraph() {
    this.graph = new SimpleDirectedGraph<>(DefaultEdge.class);
    this.names = new HashMap<>();
    this.types = new HashMap<>();
  }

  /**
   * Creates a builder that interns vertex names into ids on first sight.
   *
   * @param typeFunction derives the type tag from a vertex name; may return null
   */
  public static Builder builder(Function<String, String> typeFunction) {
    return new Builder(typeFunction);
  }

  /** Builder without type tags. */
  public static Builder builder() {
    return new Builder(name -> null);
  }

  /**
   * 从任意JGraphT图复制出一个TypedGraph，顶点按照源图vertexSet的迭代顺序分配id
   *
   * @param source 源图，必须是有向图
   * @param nameOf 顶点名
   * @param typeOf 顶点类型，可以返回null
   * @throws GraphConfigurationException 源图是无向图
   */
  public static <V, E> TypedGraph copyOf(
      Graph<V, E> source, Function<V, String> nameOf, Function<V, String> typeOf)
      throws GraphConfigurationException {
    if (source == null) {
      throw new GraphConfigurationException("source graph is null");
    }
    try {
      GraphTests.requireDirected(source, "source graph must be directed");
    } catch (IllegalArgumentException e) {
      throw new GraphConfigurationException(e.getMessage(), e);
    }

    Map<V, Integer> ids = new HashMap<>();
    TypedGraph result = new TypedGraph();
    for (V v : source.vertexSet()) {
      int id = ids.size();
      ids.put(v, id);
      result.addVertex(id, nameOf.apply(v), typeOf.apply(v));
    }
    for (E e : source.edgeSet()) {
      result.addEdge(ids.get(source.getEdgeSource(e)), ids.get(source.getEdgeTarget(e)));
    }
    return result;
  }

  private void addVertex(int id, String name, String type) {
    graph.addVertex(id);
    names.put(id, name);
    types.put(id, type);
  }

  /**
   * 添加一条有向边，自环和重复边不会进入图中
   *
   * @return 是否真的添加了一条新边
   */
  private boolean addEdge(int source, int target) {
    if (source == target) {
      droppedSelfLoops++;
      return false;
    }
    if (graph.containsEdge(source, target)) {
      duplicateEdges++;
      return false;
    }
    graph.addEdge(source, target);
    return true;
  }

  public boolean containsVertex(int vertex) {
    return graph.containsVertex(vertex);
  }

  public Set<Integer> vertexSet() {
    return Collections.unmodifiableSet(graph.vertexSet());
  }

  public int vertexCount() {
    return graph.vertexSet().size();
  }

  public int edgeCount() {
    return graph.edgeSet().size();
  }

  /**
   * 顶点的出边邻居，按id升序排列，保证搜索结果可复现
   *
   * @throws CycleSearchException 顶点不存在
   */
  public List<Integer> outNeighbors(int vertex) {
    requireVertex(vertex);
    List<Integer> successors = Graphs.successorListOf(graph, vertex);
    Collections.sort(successors);
    return successors;
  }

  public String nameOf(int vertex) {
    requireVertex(vertex);
    return names.get(vertex);
  }

  public String typeOf(int vertex) {
    requireVertex(vertex);
    return types.get(vertex);
  }

  /**
   * 删除一个顶点及其所有关联边。删除不存在的顶点不做任何事。
   *
   * @return 顶点是否存在并被删除
   */
  public boolean deleteVertex(int vertex) {
    if (!graph.removeVertex(vertex)) {
      logger.debug("vertex {} is not in the graph, nothing to delete", vertex);
      return false;
    }
    names.remove(vertex);
    types.remove(vertex);
    return true;
  }

  public void deleteVertices(Collection<Integer> vertices) {
    for (int vertex : vertices) {
      deleteVertex(vertex);
    }
  }

  /**
   * 取由指定顶点集合导出的子图，子图中的顶点保持原有的id、名字和类型
   *
   * @param vertices 导出子图的顶点集合
   * @return 新的图，和当前图不共享任何状态
   * @throws CycleSearchException 集合中有顶点不在当前图中
   */
  public TypedGraph inducedSubgraph(Collection<Integer> vertices) {
    TypedGraph result = new TypedGraph();
    for (int v : vertices) {
      requireVertex(v);
      result.addVertex(v, names.get(v), types.get(v));
    }
    for (int v : vertices) {
      for (DefaultEdge e : graph.outgoingEdgesOf(v)) {
        int target = graph.getEdgeTarget(e);
        if (result.containsVertex(target)) {
          result.graph.addEdge(v, target);
        }
      }
    }
    return result;
  }

  private void requireVertex(int vertex) {
    if (!graph.containsVertex(vertex)) {
      throw CycleSearchException.missingVertex(vertex);
    }
  }

  @Override
  public String toString() {
    return String.format("TypedGraph(%d vertices, %d edges)", vertexCount(), edgeCount());
  }

  /** 按名字构建TypedGraph，名字第一次出现时分配下一个id */
  public static class Builder {
    private final Function<String, String> typeFunction;
    private final Map<String, Integer> ids = new LinkedHashMap<>();
    private final List<int[]> edges = new ArrayList<>();

    private Builder(Function<String, String> typeFunction) {
      this.typeFunction = typeFunction;
    }

    /**
     * 注册一个顶点（如果还不存在）
     *
     * @return 顶点的id
     */
    public int vertex(String name) {
      Integer id = ids.get(name);
      if (id == null) {
        id = ids.size();
        ids.put(name, id);
      }
      return id;
    }

    public Builder edge(String source, String target) {
      edges.add(new int[] {vertex(source), vertex(target)});
      return this;
    }

    public int edgeRows() {
      return edges.size();
    }

    public TypedGraph build() {
      TypedGraph result = new TypedGraph();
      for (Map.Entry<String, Integer> entry : ids.entrySet()) {
        String name = entry.getKey();
        result.addVertex(entry.getValue(), name, typeFunction.apply(name));
      }
      for (int[] edge : edges) {
        result.addEdge(edge[0], edge[1]);
      }
      if (result.droppedSelfLoops > 0) {
        logger.info("dropped {} self-loop edges", result.droppedSelfLoops);
      }
      return result;
    }
  }
}
