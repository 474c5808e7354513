package grove.outline;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/*
 * Where a node sits: its parent's key (null for roots) and its index among siblings.
 * This is what a backend record needs to restore the order.
 * */
public class Placement<K> {
  public final K key;
  @Nullable
  public final K parent;
  public final long index;

  public Placement(K key, @Nullable K parent, long index) {
    this.key = key;
    this.parent = parent;
    this.index = index;
  }

  public boolean isRoot() {
    return parent == null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Placement<?> placement = (Placement<?>)o;
    return index == placement.index &&
           Objects.equals(key, placement.key) &&
           Objects.equals(parent, placement.parent);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, parent, index);
  }

  @Override
  public String toString() {
    return "Placement{" +
           "key=" + key +
           ", parent=" + parent +
           ", index=" + index +
           '}';
  }
}
