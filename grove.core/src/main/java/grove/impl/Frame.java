package grove.impl;

import grove.Tree;
import io.lacuna.bifurcan.List;
import io.lacuna.bifurcan.Lists;

import java.util.Objects;

/*
 * One breadcrumb level of a cursor: the ancestor's value and the ancestor's own siblings.
 * `left` is in document order (closest to the ancestor last), `right` too (closest first).
 * */
public class Frame<V> {
  public final List<Tree<V>> left;
  public final V value;
  public final List<Tree<V>> right;

  public Frame(List<Tree<V>> left, V value, List<Tree<V>> right) {
    this.left = left;
    this.value = value;
    this.right = right;
  }

  static <V> List<Tree<V>> join(List<Tree<V>> left, Tree<V> middle, List<Tree<V>> right) {
    List<Tree<V>> result = left.linear().addLast(middle);
    for (Tree<V> tree : right) {
      result = result.addLast(tree);
    }
    return result.forked();
  }

  static <V> List<Tree<V>> join(List<Tree<V>> left, List<Tree<V>> right) {
    if (right.size() == 0) {
      return left;
    }
    if (left.size() == 0) {
      return right;
    }
    List<Tree<V>> result = left.linear();
    for (Tree<V> tree : right) {
      result = result.addLast(tree);
    }
    return result.forked();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Frame<?> frame = (Frame<?>)o;
    return value.equals(frame.value) &&
           left.equals(frame.left) &&
           right.equals(frame.right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Lists.hash(left), value, Lists.hash(right));
  }

  @Override
  public String toString() {
    return "Frame{" +
           "left=" + left +
           ", value=" + value +
           ", right=" + right +
           '}';
  }
}
