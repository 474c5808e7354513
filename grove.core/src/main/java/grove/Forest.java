package grove;

import io.lacuna.bifurcan.List;
import io.lacuna.bifurcan.Lists;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Objects;

/*
 * Ordered sequence of independent trees. Root order is the display order.
 * */
public class Forest<V> {
  public final List<Tree<V>> roots;

  public Forest(@NotNull List<Tree<V>> roots) {
    this.roots = Objects.requireNonNull(roots, "roots");
  }

  public static <V> Forest<V> empty() {
    return new Forest<>(new List<>());
  }

  @SafeVarargs
  public static <V> Forest<V> of(Tree<V>... roots) {
    List<Tree<V>> list = new List<Tree<V>>().linear();
    for (Tree<V> root : roots) {
      list = list.addLast(Objects.requireNonNull(root, "root"));
    }
    return new Forest<>(list.forked());
  }

  public static <V> Forest<V> of(Iterable<Tree<V>> roots) {
    List<Tree<V>> list = new List<Tree<V>>().linear();
    for (Tree<V> root : roots) {
      list = list.addLast(Objects.requireNonNull(root, "root"));
    }
    return new Forest<>(list.forked());
  }

  public boolean isEmpty() {
    return roots.size() == 0;
  }

  /*
   * number of roots
   * */
  public long size() {
    return roots.size();
  }

  /*
   * number of nodes in all trees
   * */
  public long count() {
    long count = 0;
    for (Tree<V> root : roots) {
      count += root.count();
    }
    return count;
  }

  /*
   * all values in pre-order: roots left to right, each subtree before the next sibling
   * */
  public java.util.List<V> values() {
    ArrayList<V> result = new ArrayList<>();
    for (Tree<V> root : roots) {
      collect(root, result);
    }
    return result;
  }

  private static <V> void collect(Tree<V> tree, ArrayList<V> result) {
    result.add(tree.value);
    for (Tree<V> child : tree.children) {
      collect(child, result);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Forest<?> forest = (Forest<?>)o;
    return roots.equals(forest.roots);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(Lists.hash(roots));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    boolean first = true;
    for (Tree<V> root : roots) {
      if (!first) {
        sb.append(", ");
      }
      root.appendTo(sb);
      first = false;
    }
    return sb.append(']').toString();
  }
}
