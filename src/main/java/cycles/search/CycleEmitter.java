package cycles.search;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pull-based view over a running {@link JohnsonSimpleCycles}. Each {@link #hasNext()} advances the
 * search just far enough to find one more cycle. Abandoning the iterator simply leaves the graph in
 * its partially searched state.
 */
public class CycleEmitter implements Iterator<Cycle> {

  private final JohnsonSimpleCycles finder;

  private Cycle pending = null;
  private boolean exhausted = false;

  CycleEmitter(JohnsonSimpleCycles finder) {
    this.finder = finder;
  }

  @Override
  public boolean hasNext() {
    if (pending == null && !exhausted) {
      pending = finder.nextCycle();
      if (pending == null) {
        exhausted = true;
      }
    }
    return pending != null;
  }

  @Override
  public Cycle next() {
    if (!hasNext()) {
      throw new NoSuchElementException("no more cycles");
    }
    Cycle cycle = pending;
    pending = null;
    return cycle;
  }
}
