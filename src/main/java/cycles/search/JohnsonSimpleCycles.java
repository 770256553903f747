package cycles.search;

import cycles.diagnostics.DiagnosticsSink;
import cycles.graph.StrongConnectivity;
import cycles.graph.StronglyConnectedComponent;
import cycles.graph.TypedGraph;
import exception.CycleSearchException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.Getter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Find all simple cycles of a directed graph using a nonrecursive variant of Johnson's algorithm.
 *
 * <p>See:<br>
 * D.B.Johnson, Finding all the elementary circuits of a directed graph, SIAM J. Comput., 4 (1975),
 * pp. 77-84.
 *
 * <p>算法在强连通分量的工作栈上迭代：每次弹出一个分量，以其中id最小的顶点为anchor做一轮深度优先搜索，找出所有经过anchor的环；随后从图中永久删除anchor，
 * 对分量剩下的顶点重新计算强连通分量，顶点数不小于 {@link #MIN_SCC_SIZE} 的分量重新入栈，其余顶点不可能再构成环，直接从图中删除。
 *
 * <p>环是惰性产生的：{@link #cycles()} 返回的迭代器每次只计算到下一个环为止。图会被原地修改，所以每个实例只能遍历一次，重新搜索需要重新构建图。
 */
public class JohnsonSimpleCycles {

  private static final Logger logger = LogManager.getLogger(JohnsonSimpleCycles.class);

  /** 参与搜索的强连通分量的最小顶点数。为2时单顶点的分量（自环）不会被考虑 */
  public static final int MIN_SCC_SIZE = 2;

  // The graph, mutated in place.
  private final TypedGraph graph;
  private final PathLimit limit;
  private final DiagnosticsSink diagnostics;

  private final int totalVertices;
  private final int totalEdges;

  /** 待处理的强连通分量，作为栈使用 */
  private final ArrayDeque<StronglyConnectedComponent> sccs = new ArrayDeque<>();

  // The state of the current anchor iteration.
  private StronglyConnectedComponent scc = null;
  private TypedGraph component = null;
  private SearchState state = null;

  /** 已经处理过的anchor数目 */
  @Getter private int iteration = 0;

  /** 已经输出的环数目 */
  @Getter private long cycleCount = 0;

  private boolean consumed = false;

  /**
   * Create a simple cycle finder for the specified graph.
   *
   * @param graph the graph to search, owned and mutated by this finder until the search is over
   * @param limit length or type limit of the reported cycles
   * @param diagnostics receives progress events
   * @throws IllegalArgumentException if an argument is null
   */
  public JohnsonSimpleCycles(TypedGraph graph, PathLimit limit, DiagnosticsSink diagnostics) {
    if (graph == null) {
      throw new IllegalArgumentException("Null graph.");
    }
    if (limit == null || diagnostics == null) {
      throw new IllegalArgumentException("Null limit or diagnostics sink.");
    }
    this.graph = graph;
    this.limit = limit;
    this.diagnostics = diagnostics;
    this.totalVertices = graph.vertexCount();
    this.totalEdges = graph.edgeCount();

    for (StronglyConnectedComponent initial : StrongConnectivity.components(graph, MIN_SCC_SIZE)) {
      sccs.push(initial);
    }
    logger.debug("{} strongly connected components to search, limit: {}", sccs.size(), limit);
  }

  public JohnsonSimpleCycles(TypedGraph graph) {
    this(graph, PathLimit.UNLIMITED, DiagnosticsSink.NONE);
  }

  /**
   * 返回一个惰性的、只能遍历一次的环迭代器
   *
   * @throws IllegalStateException 已经调用过cycles()或stream()
   */
  public Iterator<Cycle> cycles() {
    if (consumed) {
      throw new IllegalStateException("cycles can only be enumerated once, rebuild the graph");
    }
    consumed = true;
    return new CycleEmitter(this);
  }

  /** {@link #cycles()} as an ordered sequential stream. */
  public Stream<Cycle> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            cycles(), Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT),
        false);
  }

  /** Drains {@link #cycles()} into a list. */
  public List<Cycle> findSimpleCycles() {
    List<Cycle> result = new ArrayList<>();
    cycles().forEachRemaining(result::add);
    return result;
  }

  /**
   * 继续搜索，直到找到下一个环
   *
   * @return 下一个环，所有分量都处理完时返回null
   */
  Cycle nextCycle() {
    while (true) {
      if (state == null) {
        if (sccs.isEmpty()) {
          return null;
        }
        initState(sccs.pop());
      }

      Cycle cycle = findCycleInSCG();
      if (cycle != null) {
        cycleCount++;
        if (logger.isDebugEnabled()) {
          logger.debug("{}. cycle = {}", iteration, cycle);
        }
        return cycle;
      }

      finishAnchor();
    }
  }

  private void initState(StronglyConnectedComponent next) {
    iteration++;
    scc = next;
    // 只在当前强连通分量导出的子图上搜索
    component = graph.inducedSubgraph(next.getVertices());
    int anchor = next.anchor();
    state = new SearchState(anchor, component.outNeighbors(anchor), limit.counts(component, anchor));
  }

  /**
   * 从上次停下的位置继续深度优先搜索
   *
   * @return 找到的环；本轮anchor搜索结束时返回null
   */
  private Cycle findCycleInSCG() {
    int anchor = state.getAnchor();
    while (state.hasFrames()) {
      SearchState.Frame top = state.peek();
      boolean inLimit = limit.permits(state.getCounted());

      if (top.remaining.hasNext() && inLimit) {
        int next = top.remaining.next();
        if (next == anchor) {
          return state.closeCycle();
        } else if (!state.isBlocked(next)) {
          state.push(next, component.outNeighbors(next), limit.counts(component, next));
        }
        continue;
      }

      // 后继已经全部尝试过，或者路径超出了长度限制
      if (top.remaining.hasNext()) {
        state.closeTruncatedPath();
      }
      state.retreat(component.outNeighbors(top.vertex));
    }
    return null;
  }

  private void finishAnchor() {
    int anchor = state.getAnchor();

    // 1.永久删除anchor
    if (!graph.deleteVertex(anchor)) {
      throw CycleSearchException.missingVertex(anchor);
    }

    // 2.在分量剩余顶点导出的子图上重新计算强连通分量
    List<Integer> residual = new ArrayList<>(scc.getVertices());
    residual.remove(Integer.valueOf(anchor));
    TypedGraph h = graph.inducedSubgraph(residual);
    for (StronglyConnectedComponent sub : StrongConnectivity.components(h, 1)) {
      if (sub.size() >= MIN_SCC_SIZE) {
        sccs.push(sub);
      } else {
        // 2.1太小的分量不可能再构成环
        graph.deleteVertices(sub.getVertices());
      }
    }

    diagnostics.recordEvent(progress());
    clearState();
  }

  private void clearState() {
    scc = null;
    component = null;
    state = null;
  }

  private String progress() {
    int vertices = graph.vertexCount();
    int edges = graph.edgeCount();
    return String.format(
        Locale.ROOT,
        "%d. subgraph (%d/%d vertices [%.2f%% processed], %d/%d edges [%.2f%% processed])",
        iteration,
        vertices,
        totalVertices,
        processed(vertices, totalVertices),
        edges,
        totalEdges,
        processed(edges, totalEdges));
  }

  private static double processed(int remaining, int total) {
    return total == 0 ? 100.0 : (1 - (double) remaining / total) * 100;
  }
}
