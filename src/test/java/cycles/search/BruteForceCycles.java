package cycles.search;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Exhaustive enumeration of the elementary cycles of a small graph, rotated to start at their smallest vertex. */
class BruteForceCycles {

  private final List<List<Integer>> adjacency;
  private final Set<List<Integer>> cycles = new HashSet<>();

  BruteForceCycles(List<List<Integer>> adjacency) {
    this.adjacency = adjacency;
  }

  Set<List<Integer>> find() {
    for (int start = 0; start < adjacency.size(); start++) {
      List<Integer> path = new ArrayList<>();
      path.add(start);
      extend(start, path);
    }
    return cycles;
  }

  private void extend(int start, List<Integer> path) {
    int last = path.get(path.size() - 1);
    for (int next : adjacency.get(last)) {
      if (next == start && path.size() > 1) {
        cycles.add(new ArrayList<>(path));
      } else if (next > start && !path.contains(next)) {
        path.add(next);
        extend(start, path);
        path.remove(path.size() - 1);
      }
    }
  }

  static List<Integer> canonical(List<Integer> cycle) {
    int min = 0;
    for (int i = 1; i < cycle.size(); i++) {
      if (cycle.get(i) < cycle.get(min)) {
        min = i;
      }
    }
    List<Integer> rotated = new ArrayList<>(cycle.subList(min, cycle.size()));
    rotated.addAll(cycle.subList(0, min));
    return rotated;
  }
}
