package cycles.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tarjan's strongly connected components algorithm, written with an explicit stack so that long
 * chains do not overflow the thread stack.
 *
 * <p>Roots are visited in ascending id order and successors in {@link TypedGraph#outNeighbors}
 * order, so the returned list is deterministic for a given graph.
 */
public class StrongConnectivity {

  private final TypedGraph graph;

  // Tarjan的状态
  private int index = 0;
  private final Map<Integer, Integer> vIndex = new HashMap<>();
  private final Map<Integer, Integer> vLowlink = new HashMap<>();
  private final ArrayDeque<Integer> path = new ArrayDeque<>();
  private final Set<Integer> pathSet = new HashSet<>();
  private final List<StronglyConnectedComponent> SCCs = new ArrayList<>();

  private StrongConnectivity(TypedGraph graph) {
    this.graph = graph;
  }

  /**
   * 计算图中所有强连通分量，只保留顶点数不小于minSize的分量
   *
   * @param graph 输入图，不会被修改
   * @param minSize 分量的最小顶点数
   * @return 强连通分量列表，按发现顺序排列
   */
  public static List<StronglyConnectedComponent> components(TypedGraph graph, int minSize) {
    StrongConnectivity tarjan = new StrongConnectivity(graph);
    for (int v : new TreeSet<>(graph.vertexSet())) {
      if (!tarjan.vIndex.containsKey(v)) {
        tarjan.strongConnect(v);
      }
    }
    List<StronglyConnectedComponent> result = new ArrayList<>();
    for (StronglyConnectedComponent scc : tarjan.SCCs) {
      if (scc.size() >= minSize) {
        result.add(scc);
      }
    }
    return result;
  }

  /** 一个DFS栈帧：当前顶点和它尚未访问的后继 */
  private static final class Visit {
    final int vertex;
    final Iterator<Integer> successors;

    Visit(int vertex, Iterator<Integer> successors) {
      this.vertex = vertex;
      this.successors = successors;
    }
  }

  private void strongConnect(int root) {
    ArrayDeque<Visit> callStack = new ArrayDeque<>();
    enter(root, callStack);

    while (!callStack.isEmpty()) {
      Visit top = callStack.peek();
      if (top.successors.hasNext()) {
        int successor = top.successors.next();
        if (!vIndex.containsKey(successor)) {
          // 1.后继还没有被访问过，相当于递归调用
          enter(successor, callStack);
        } else if (pathSet.contains(successor)) {
          // 2.后继在栈上，属于当前的强连通分量
          lower(top.vertex, vIndex.get(successor));
        }
        continue;
      }

      // 3.所有后继都处理完了，相当于递归返回
      callStack.pop();
      int vertex = top.vertex;
      if (vLowlink.get(vertex).equals(vIndex.get(vertex))) {
        List<Integer> component = new ArrayList<>();
        int temp;
        do {
          temp = path.pop();
          pathSet.remove(temp);
          component.add(temp);
        } while (temp != vertex);
        SCCs.add(new StronglyConnectedComponent(component));
      }
      if (!callStack.isEmpty()) {
        lower(callStack.peek().vertex, vLowlink.get(vertex));
      }
    }
  }

  private void enter(int vertex, ArrayDeque<Visit> callStack) {
    vIndex.put(vertex, index);
    vLowlink.put(vertex, index);
    index++;
    path.push(vertex);
    pathSet.add(vertex);
    callStack.push(new Visit(vertex, graph.outNeighbors(vertex).iterator()));
  }

  private void lower(int vertex, int candidate) {
    vLowlink.put(vertex, Math.min(vLowlink.get(vertex), candidate));
  }
}
