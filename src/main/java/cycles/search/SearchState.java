package cycles.search;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Johnson算法以一个anchor顶点为起点的一轮搜索状态，每个anchor重新创建，搜索结束后丢弃。
 *
 * <p>递归版本的circuit过程被改写成显式的栈：{@code frames}中每个栈帧保存一个顶点和它还没有尝试过的后继。
 */
class SearchState {

  /** 一个栈帧：当前顶点、它剩余的后继、以及它是否计入长度限制 */
  static final class Frame {
    final int vertex;
    final Iterator<Integer> remaining;
    final boolean counted;

    Frame(int vertex, List<Integer> neighbors, boolean counted) {
      this.vertex = vertex;
      this.remaining = neighbors.iterator();
      this.counted = counted;
    }
  }

  private final int anchor;

  // The main state of the algorithm.
  private final List<Integer> path = new ArrayList<>();
  private final Set<Integer> blocked = new HashSet<>();
  private final Map<Integer, Set<Integer>> bSets = new HashMap<>();
  private final ArrayDeque<Frame> frames = new ArrayDeque<>();

  /** 本轮搜索中已知处在某个环上的顶点 */
  private final Set<Integer> closed = new HashSet<>();

  /** 路径上计入长度限制的顶点数 */
  private int counted = 0;

  SearchState(int anchor, List<Integer> anchorNeighbors, boolean anchorCounted) {
    this.anchor = anchor;
    push(anchor, anchorNeighbors, anchorCounted);
  }

  int getAnchor() {
    return anchor;
  }

  int getCounted() {
    return counted;
  }

  boolean hasFrames() {
    return !frames.isEmpty();
  }

  Frame peek() {
    return frames.peek();
  }

  boolean isBlocked(int vertex) {
    return blocked.contains(vertex);
  }

  /** 沿着vertex扩展当前路径 */
  void push(int vertex, List<Integer> neighbors, boolean vertexCounted) {
    path.add(vertex);
    frames.push(new Frame(vertex, neighbors, vertexCounted));
    closed.remove(vertex);
    blocked.add(vertex);
    if (vertexCounted) {
      counted++;
    }
  }

  /** 当前路径就是一个环，路径上所有顶点都标记为closed */
  Cycle closeCycle() {
    closed.addAll(path);
    return new Cycle(path);
  }

  /**
   * 长度限制截断了栈顶顶点剩余的后继。路径上的顶点都标记为closed，这样它们出栈时会被解除阻塞，被截断的子树不会让任何顶点一直处于阻塞状态。
   */
  void closeTruncatedPath() {
    closed.addAll(path);
  }

  /**
   * 栈顶顶点处理完毕，出栈
   *
   * @param neighbors 栈顶顶点在图中的全部后继
   */
  void retreat(List<Integer> neighbors) {
    Frame top = frames.pop();
    int vertex = top.vertex;
    if (closed.contains(vertex)) {
      unblock(vertex);
    } else {
      // 没有找到经过vertex的环：任一后继被解除阻塞时，vertex也要被解除阻塞
      for (int neighbor : neighbors) {
        getBSet(neighbor).add(vertex);
      }
    }
    path.remove(path.size() - 1);
    if (top.counted) {
      counted--;
    }
  }

  private void unblock(int vertex) {
    ArrayDeque<Integer> stack = new ArrayDeque<>();
    stack.push(vertex);
    while (!stack.isEmpty()) {
      int node = stack.pop();
      if (blocked.remove(node)) {
        Set<Integer> bSet = bSets.remove(node);
        if (bSet != null) {
          bSet.forEach(stack::push);
        }
      }
    }
  }

  private Set<Integer> getBSet(int vertex) {
    // B sets typically not all needed,
    // so instantiate lazily.
    return bSets.computeIfAbsent(vertex, k -> new HashSet<>());
  }
}
