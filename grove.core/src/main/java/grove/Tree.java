package grove;

import io.lacuna.bifurcan.List;
import io.lacuna.bifurcan.Lists;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/*
 * A node of an ordered multi-way tree: a value and its children, left to right.
 * Children are owned by value, so a tree never contains itself.
 * */
public class Tree<V> {
  public final V value;
  public final List<Tree<V>> children;

  public Tree(@NotNull V value, @NotNull List<Tree<V>> children) {
    this.value = Objects.requireNonNull(value, "value");
    this.children = Objects.requireNonNull(children, "children");
  }

  public static <V> Tree<V> leaf(@NotNull V value) {
    return new Tree<>(value, new List<>());
  }

  @SafeVarargs
  public static <V> Tree<V> tree(@NotNull V value, Tree<V>... children) {
    List<Tree<V>> list = new List<Tree<V>>().linear();
    for (Tree<V> child : children) {
      list = list.addLast(Objects.requireNonNull(child, "child"));
    }
    return new Tree<>(value, list.forked());
  }

  public static <V> Tree<V> of(@NotNull V value, Iterable<Tree<V>> children) {
    List<Tree<V>> list = new List<Tree<V>>().linear();
    for (Tree<V> child : children) {
      list = list.addLast(Objects.requireNonNull(child, "child"));
    }
    return new Tree<>(value, list.forked());
  }

  public boolean isLeaf() {
    return children.size() == 0;
  }

  public Tree<V> withChildren(@NotNull List<Tree<V>> children) {
    return new Tree<>(this.value, children);
  }

  public Tree<V> withValue(@NotNull V value) {
    return new Tree<>(value, this.children);
  }

  /*
   * number of nodes in this tree, including the root
   * */
  public long count() {
    long count = 1;
    for (Tree<V> child : children) {
      count += child.count();
    }
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Tree<?> tree = (Tree<?>)o;
    return value.equals(tree.value) &&
           children.equals(tree.children);
  }

  @Override
  public int hashCode() {
    return 31 * value.hashCode() + Long.hashCode(Lists.hash(children));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  void appendTo(StringBuilder sb) {
    sb.append(value);
    if (children.size() > 0) {
      sb.append('[');
      boolean first = true;
      for (Tree<V> child : children) {
        if (!first) {
          sb.append(' ');
        }
        child.appendTo(sb);
        first = false;
      }
      sb.append(']');
    }
  }
}
